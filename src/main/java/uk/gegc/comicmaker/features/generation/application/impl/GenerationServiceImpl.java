package uk.gegc.comicmaker.features.generation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.comicmaker.features.asset.api.dto.PdfAssetDto;
import uk.gegc.comicmaker.features.asset.config.PdfProperties;
import uk.gegc.comicmaker.features.asset.domain.exception.AssetMissingException;
import uk.gegc.comicmaker.features.asset.domain.exception.PdfAlreadyExistsException;
import uk.gegc.comicmaker.features.asset.domain.repository.ComicAssetRepository;
import uk.gegc.comicmaker.features.asset.domain.repository.PdfAssetRepository;
import uk.gegc.comicmaker.features.asset.infra.mapping.AssetMapper;
import uk.gegc.comicmaker.features.generation.api.dto.GenerationStartResponse;
import uk.gegc.comicmaker.features.generation.api.dto.PdfStatusResponse;
import uk.gegc.comicmaker.features.generation.api.dto.TaskStatusResponse;
import uk.gegc.comicmaker.features.generation.application.GenerationDispatcher;
import uk.gegc.comicmaker.features.generation.application.GenerationService;
import uk.gegc.comicmaker.features.generation.domain.model.Generation;
import uk.gegc.comicmaker.features.generation.domain.model.TaskStatusView;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;
import uk.gegc.comicmaker.features.generation.domain.repository.GenerationRepository;
import uk.gegc.comicmaker.features.plan.application.PlanGuard;
import uk.gegc.comicmaker.features.plan.application.PlanPolicy;
import uk.gegc.comicmaker.features.plan.domain.exception.FreeStoryAlreadyUsedException;
import uk.gegc.comicmaker.features.plan.domain.exception.PlanLimitExceededException;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.project.application.ProjectService;
import uk.gegc.comicmaker.features.project.domain.exception.ProjectInvalidStatusException;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;
import uk.gegc.comicmaker.features.project.domain.repository.ProjectRepository;
import uk.gegc.comicmaker.features.user.domain.model.User;
import uk.gegc.comicmaker.shared.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationServiceImpl implements GenerationService {

    private final ProjectService projectService;
    private final ProjectRepository projectRepository;
    private final GenerationDispatcher dispatcher;
    private final GenerationRepository generationRepository;
    private final PlanGuard planGuard;
    private final PlanPolicy planPolicy;
    private final PdfProperties pdfProperties;
    private final PdfAssetRepository pdfAssetRepository;
    private final ComicAssetRepository comicAssetRepository;
    private final AssetMapper assetMapper;
    private final Clock clock;

    @Override
    @Transactional
    public GenerationStartResponse startGeneration(User user, UUID projectId) {
        Project project = projectService.loadOwnedProject(user, projectId);
        if (project.getStatus() != ProjectStatus.DRAFT) {
            throw new ProjectInvalidStatusException(project.getStatus(),
                    "Generation can only start from DRAFT; project is " + project.getStatus());
        }
        if (project.getTotalPages() < 1) {
            throw new ValidationException("Project has no scenes to generate");
        }

        if (project.getPlanSnapshot() == PlanTier.FREE) {
            if (!user.isFreeStoryAvailable() || user.isFreeStoryUsed()) {
                throw new FreeStoryAlreadyUsedException();
            }
        } else {
            planGuard.checkGenerationQuota(user);
        }

        Generation generation = dispatcher.enqueue(project, user, TaskType.IMAGE_GENERATION);
        projectRepository.transitionStatus(projectId, ProjectStatus.DRAFT, ProjectStatus.GENERATING, LocalDateTime.now(clock));
        log.info("User {} started generation {} for project {}", user.getId(), generation.getId(), projectId);
        return GenerationStartResponse.queued(generation.getJobId(), generation.getId());
    }

    @Override
    @Transactional(readOnly = true)
    public TaskStatusResponse getGenerationStatus(User user, UUID projectId, String taskId) {
        projectService.loadOwnedProject(user, projectId);
        TaskStatusView view = dispatcher.getStatus(taskId);
        if (!view.isFound() || !projectId.equals(view.projectId())) {
            return new TaskStatusResponse(TaskStatusView.NOT_FOUND, null, null);
        }
        return new TaskStatusResponse(view.status(), view.progress(), view.error());
    }

    @Override
    @Transactional
    public GenerationStartResponse requestPdf(User user, UUID projectId, boolean forceRegenerate) {
        Project project = projectService.loadOwnedProject(user, projectId);
        planGuard.checkPlanAccess(user, pdfProperties.getMinPlan());
        if (project.getStatus() != ProjectStatus.COMPLETED) {
            throw new ProjectInvalidStatusException(project.getStatus(),
                    "PDF compilation requires a COMPLETED project; project is " + project.getStatus());
        }
        if (!forceRegenerate && pdfAssetRepository.existsByProjectId(projectId)) {
            throw new PdfAlreadyExistsException(projectId);
        }
        int maxPages = planPolicy.limitsFor(project.getPlanSnapshot()).maxPages();
        if (project.getTotalPages() > maxPages) {
            throw new PlanLimitExceededException(project.getPlanSnapshot() + " plan allows maximum "
                    + maxPages + " pages. Project has " + project.getTotalPages() + ".");
        }
        long rendered = comicAssetRepository.countByProjectId(projectId);
        if (rendered != project.getTotalPages()) {
            throw new AssetMissingException("Expected " + project.getTotalPages() + " rendered pages, found " + rendered);
        }

        Generation generation = dispatcher.enqueue(project, user, TaskType.PDF_COMPILATION);
        log.info("User {} requested PDF {} for project {} (force={})", user.getId(), generation.getId(), projectId, forceRegenerate);
        return GenerationStartResponse.queued(generation.getJobId(), generation.getId());
    }

    @Override
    @Transactional(readOnly = true)
    public PdfStatusResponse getPdfStatus(User user, UUID projectId) {
        projectService.loadOwnedProject(user, projectId);
        Optional<Generation> latest = generationRepository
                .findFirstByProjectIdAndTaskTypeOrderByCreatedAtDesc(projectId, TaskType.PDF_COMPILATION);
        PdfAssetDto pdf = pdfAssetRepository.findByProjectId(projectId).map(assetMapper::toDto).orElse(null);

        if (latest.isEmpty()) {
            return new PdfStatusResponse(pdf != null ? "completed" : TaskStatusView.NOT_FOUND, null, null, null, pdf);
        }
        TaskStatusView view = TaskStatusView.of(latest.get());
        return new PdfStatusResponse(view.status(), view.progress(), view.error(), latest.get().getJobId(), pdf);
    }
}
