package uk.gegc.comicmaker.features.project.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.comicmaker.features.project.api.dto.CreateProjectRequest;
import uk.gegc.comicmaker.features.project.api.dto.ProjectDto;
import uk.gegc.comicmaker.features.project.api.dto.UpdateProjectRequest;
import uk.gegc.comicmaker.features.project.application.ProjectService;
import uk.gegc.comicmaker.features.project.domain.exception.ProjectAccessDeniedException;
import uk.gegc.comicmaker.features.project.domain.exception.ProjectInvalidStatusException;
import uk.gegc.comicmaker.features.project.domain.exception.ProjectNotFoundException;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.ProjectConfig;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;
import uk.gegc.comicmaker.features.project.domain.repository.ProjectRepository;
import uk.gegc.comicmaker.features.project.infra.mapping.ProjectMapper;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectServiceImpl implements ProjectService {

    private final ProjectRepository projectRepository;
    private final ProjectMapper projectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public ProjectDto createProject(User user, CreateProjectRequest request) {
        Project project = new Project();
        project.setUserId(user.getId());
        project.setTitle(request.title().trim());
        project.setDescription(request.description());
        project.setConfig(request.config() != null ? request.config() : ProjectConfig.defaults());
        project.setPlanSnapshot(user.getPlan());
        project.setStatus(ProjectStatus.DRAFT);
        project.setTotalPages(0);
        project.setCreatedAt(LocalDateTime.now(clock));

        Project saved = projectRepository.save(project);
        log.info("Created project {} for user {} (plan snapshot {})", saved.getId(), user.getId(), saved.getPlanSnapshot());
        return projectMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ProjectDto> listProjects(User user, Pageable pageable) {
        return projectRepository.findByUserIdAndDeletedAtIsNull(user.getId(), pageable)
                .map(projectMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public ProjectDto getProject(User user, UUID projectId) {
        return projectMapper.toDto(loadOwnedProject(user, projectId));
    }

    @Override
    @Transactional
    public ProjectDto updateProject(User user, UUID projectId, UpdateProjectRequest request) {
        Project project = loadOwnedProject(user, projectId);
        if (project.getStatus() != ProjectStatus.DRAFT) {
            throw new ProjectInvalidStatusException(project.getStatus(),
                    "Only DRAFT projects can be edited; project is " + project.getStatus());
        }
        if (request.title() != null) {
            project.setTitle(request.title().trim());
        }
        if (request.description() != null) {
            project.setDescription(request.description());
        }
        if (request.config() != null) {
            project.setConfig(request.config());
        }
        return projectMapper.toDto(projectRepository.save(project));
    }

    @Override
    @Transactional
    public void deleteProject(User user, UUID projectId) {
        Project project = loadOwnedProject(user, projectId);
        project.setDeletedAt(LocalDateTime.now(clock));
        projectRepository.save(project);
        log.info("Soft-deleted project {} for user {}", projectId, user.getId());
    }

    @Override
    @Transactional(readOnly = true)
    public Project loadOwnedProject(User user, UUID projectId) {
        Project project = projectRepository.findByIdAndDeletedAtIsNull(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        if (!project.getUserId().equals(user.getId())) {
            throw new ProjectAccessDeniedException(projectId);
        }
        return project;
    }
}
