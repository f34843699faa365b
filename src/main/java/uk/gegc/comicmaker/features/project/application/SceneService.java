package uk.gegc.comicmaker.features.project.application;

import uk.gegc.comicmaker.features.project.api.dto.SceneBatchResponse;
import uk.gegc.comicmaker.features.project.api.dto.SceneDto;
import uk.gegc.comicmaker.features.project.api.dto.SceneInput;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.util.List;
import java.util.UUID;

public interface SceneService {

    SceneBatchResponse upsertScenes(User user, UUID projectId, List<SceneInput> scenes);

    List<SceneDto> listScenes(User user, UUID projectId);

    /**
     * Upserts panels for a project whose ownership is already established and recomputes
     * {@code totalPages}. Enforces DRAFT status, the 1..4 panel rule and the snapshot page limit.
     */
    SceneBatchResponse saveScenes(Project project, List<SceneInput> scenes);
}
