package uk.gegc.comicmaker.features.project.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.project.api.dto.ProjectDto;
import uk.gegc.comicmaker.features.project.api.dto.SceneDto;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.Scene;

@Component
public class ProjectMapper {

    public ProjectDto toDto(Project project) {
        return new ProjectDto(
                project.getId(),
                project.getTitle(),
                project.getDescription(),
                project.getConfig(),
                project.getPlanSnapshot(),
                project.getStatus(),
                project.getTotalPages(),
                project.getCreatedAt(),
                project.getUpdatedAt(),
                project.getCompletedAt());
    }

    public SceneDto toDto(Scene scene) {
        return new SceneDto(
                scene.getId(),
                scene.getPageNo(),
                scene.getPanelNo(),
                scene.getNarrativeText(),
                scene.getLanguage(),
                scene.getPromptUsed());
    }
}
