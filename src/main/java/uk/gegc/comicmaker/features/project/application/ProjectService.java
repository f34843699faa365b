package uk.gegc.comicmaker.features.project.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.comicmaker.features.project.api.dto.CreateProjectRequest;
import uk.gegc.comicmaker.features.project.api.dto.ProjectDto;
import uk.gegc.comicmaker.features.project.api.dto.UpdateProjectRequest;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.util.UUID;

public interface ProjectService {

    ProjectDto createProject(User user, CreateProjectRequest request);

    Page<ProjectDto> listProjects(User user, Pageable pageable);

    ProjectDto getProject(User user, UUID projectId);

    ProjectDto updateProject(User user, UUID projectId, UpdateProjectRequest request);

    void deleteProject(User user, UUID projectId);

    /**
     * Loads a live (not soft-deleted) project and checks that {@code user} owns it.
     *
     * @throws uk.gegc.comicmaker.features.project.domain.exception.ProjectNotFoundException
     * @throws uk.gegc.comicmaker.features.project.domain.exception.ProjectAccessDeniedException
     */
    Project loadOwnedProject(User user, UUID projectId);
}
