package uk.gegc.comicmaker.features.generation.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.comicmaker.features.generation.domain.model.Generation;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;
import uk.gegc.comicmaker.features.generation.domain.repository.GenerationRepository;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;
import uk.gegc.comicmaker.features.project.domain.repository.ProjectRepository;
import uk.gegc.comicmaker.features.user.domain.repository.UserRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Writes Generation state in short transactions of its own so progress and failures are visible
 * while the job is still running.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerationStateService {

    private final GenerationRepository generationRepository;
    private final ProjectRepository projectRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    @Transactional
    public boolean markProcessing(UUID generationId) {
        return generationRepository.markProcessing(generationId, now()) > 0;
    }

    @Transactional
    public void updateProgress(UUID generationId, int progress) {
        if (generationRepository.updateProgress(generationId, progress, now()) == 0) {
            log.debug("Progress {} not applied to generation {} (lower than stored or job not processing)",
                    progress, generationId);
        }
    }

    @Transactional
    public void recordRetry(UUID generationId, String error) {
        generationRepository.recordRetry(generationId, Generation.truncateError(error), now());
    }

    /**
     * Marks the job FAILED. For image jobs the project moves from GENERATING to FAILED as well.
     * A job that already completed is left untouched.
     */
    @Transactional
    public boolean fail(Generation generation, String error) {
        LocalDateTime now = now();
        int updated = generationRepository.markFailed(generation.getId(), Generation.truncateError(error), now);
        if (updated == 0) {
            log.warn("Generation {} was already terminal; failure not recorded", generation.getId());
            return false;
        }
        if (generation.getTaskType() == TaskType.IMAGE_GENERATION) {
            projectRepository.transitionStatus(generation.getProjectId(), ProjectStatus.GENERATING, ProjectStatus.FAILED, now);
        }
        return true;
    }

    /**
     * Finishes a successful image job: consumes the free story (FREE snapshot) or one quota unit,
     * then completes the project and the job together.
     */
    @Transactional
    public void completeImageGeneration(Generation generation, PlanTier planSnapshot) {
        LocalDateTime now = now();
        if (planSnapshot == PlanTier.FREE) {
            if (userRepository.markFreeStoryUsed(generation.getUserId(), now) > 0) {
                log.info("Marked free story used for user {}", generation.getUserId());
            } else {
                log.warn("Free story of user {} was already consumed by another job", generation.getUserId());
            }
        } else {
            userRepository.incrementQuotaUsed(generation.getUserId(), now);
        }
        projectRepository.markCompleted(generation.getProjectId(), now);
        generationRepository.markCompleted(generation.getId(), now);
    }

    @Transactional
    public void complete(UUID generationId) {
        generationRepository.markCompleted(generationId, now());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
