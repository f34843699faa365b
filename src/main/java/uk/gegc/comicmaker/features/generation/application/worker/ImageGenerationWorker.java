package uk.gegc.comicmaker.features.generation.application.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.comic.application.ComicPageRenderer;
import uk.gegc.comicmaker.features.comic.domain.exception.SceneStructureException;
import uk.gegc.comicmaker.features.generation.application.GenerationMetrics;
import uk.gegc.comicmaker.features.generation.application.GenerationStateService;
import uk.gegc.comicmaker.features.generation.domain.exception.GenerationTerminalException;
import uk.gegc.comicmaker.features.generation.domain.model.Generation;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;
import uk.gegc.comicmaker.features.generation.domain.repository.GenerationRepository;
import uk.gegc.comicmaker.features.plan.application.PlanPolicy;
import uk.gegc.comicmaker.features.plan.domain.exception.FreeStoryAlreadyUsedException;
import uk.gegc.comicmaker.features.plan.domain.exception.PlanLimitExceededException;
import uk.gegc.comicmaker.features.plan.domain.model.PlanLimits;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.repository.ProjectRepository;
import uk.gegc.comicmaker.features.user.domain.model.User;
import uk.gegc.comicmaker.features.user.domain.repository.UserRepository;
import uk.gegc.comicmaker.shared.exception.UpstreamServiceException;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Renders every page of a project. Progress: 5 job loaded, 10 project and user loaded, 15 plan
 * validated, then {@code 15 + done * 75 / total} before each page, 90 after the last one and 100
 * on completion.
 * <p>
 * Plan limits are checked against the project's plan snapshot before any image is requested.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageGenerationWorker implements GenerationWorker {

    static final int FREE_STORY_MAX_PAGES = 1;
    private static final int MAX_BASE_SEED = 1_000_000;

    private final GenerationRepository generationRepository;
    private final ProjectRepository projectRepository;
    private final UserRepository userRepository;
    private final PlanPolicy planPolicy;
    private final ComicPageRenderer pageRenderer;
    private final GenerationStateService stateService;
    private final GenerationMetrics metrics;

    @Override
    public TaskType taskType() {
        return TaskType.IMAGE_GENERATION;
    }

    @Override
    public void execute(UUID generationId) {
        Optional<Generation> loaded = generationRepository.findById(generationId);
        if (loaded.isEmpty()) {
            log.error("Generation {} not found; dropping job", generationId);
            return;
        }
        Generation generation = loaded.get();
        if (generation.getStatus().isTerminal()) {
            log.info("Generation {} already {}; nothing to do", generationId, generation.getStatus());
            return;
        }
        stateService.markProcessing(generationId);
        stateService.updateProgress(generationId, 5);

        try {
            Project project = projectRepository.findByIdAndDeletedAtIsNull(generation.getProjectId())
                    .orElseThrow(() -> new GenerationTerminalException("Project " + generation.getProjectId() + " not found"));
            User user = userRepository.findById(generation.getUserId())
                    .orElseThrow(() -> new GenerationTerminalException("User " + generation.getUserId() + " not found"));
            stateService.updateProgress(generationId, 10);

            validatePlan(project, user);
            stateService.updateProgress(generationId, 15);

            int totalPages = project.getTotalPages();
            long baseSeed = nextBaseSeed();
            for (int pageNo = 1; pageNo <= totalPages; pageNo++) {
                int pagesDone = pageNo - 1;
                stateService.updateProgress(generationId, 15 + (pagesDone * 75) / totalPages);
                log.info("Generating page {}/{} of project {}", pageNo, totalPages, project.getId());
                pageRenderer.renderPage(project, pageNo, baseSeed + pageNo, generationId);
            }
            stateService.updateProgress(generationId, 90);

            stateService.completeImageGeneration(generation, project.getPlanSnapshot());
            metrics.incrementCompleted(taskType());
            log.info("Image generation completed for project {}: {} pages", project.getId(), totalPages);
        } catch (GenerationTerminalException | PlanLimitExceededException | SceneStructureException e) {
            failTerminally(generation, e.getMessage(), e.getClass().getSimpleName());
        } catch (UpstreamServiceException e) {
            if (e.isTransient()) {
                throw e;
            }
            failTerminally(generation, e.getMessage(), "provider_rejected");
        }
    }

    /**
     * FREE needs an unused free story and at most one page; other tiers are capped at their
     * configured page limit.
     */
    void validatePlan(Project project, User user) {
        PlanTier plan = project.getPlanSnapshot();
        PlanLimits limits = planPolicy.limitsFor(plan);
        int totalPages = project.getTotalPages();

        if (!limits.allowGeneration()) {
            throw new PlanLimitExceededException("The " + plan + " plan does not allow image generation");
        }
        if (totalPages < 1) {
            throw new GenerationTerminalException("Project has no pages to generate");
        }
        if (plan == PlanTier.FREE) {
            if (!user.isFreeStoryAvailable() || user.isFreeStoryUsed()) {
                throw new FreeStoryAlreadyUsedException();
            }
            int maxPages = Math.min(FREE_STORY_MAX_PAGES, limits.maxPages());
            if (totalPages > maxPages) {
                throw new PlanLimitExceededException("Free plan allows only " + maxPages + " page per story.");
            }
        } else if (totalPages > limits.maxPages()) {
            throw new PlanLimitExceededException(plan + " plan allows maximum " + limits.maxPages()
                    + " pages. Project has " + totalPages + ".");
        }
    }

    protected long nextBaseSeed() {
        return ThreadLocalRandom.current().nextLong(1, MAX_BASE_SEED + 1L);
    }

    private void failTerminally(Generation generation, String message, String reason) {
        log.error("Image generation {} failed permanently: {}", generation.getId(), message);
        stateService.fail(generation, message);
        metrics.incrementFailed(taskType(), reason);
    }
}
