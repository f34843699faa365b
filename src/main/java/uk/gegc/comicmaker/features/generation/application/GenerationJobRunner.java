package uk.gegc.comicmaker.features.generation.application;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.generation.application.worker.GenerationWorker;
import uk.gegc.comicmaker.features.generation.domain.model.GenerationJob;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;
import uk.gegc.comicmaker.features.generation.domain.repository.GenerationRepository;
import uk.gegc.comicmaker.shared.config.RetryProperties;
import uk.gegc.comicmaker.shared.util.Backoff;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a queued job on its worker. Exceptions escaping the worker are retried with exponential
 * backoff up to {@code comicmaker.retry.job.max-attempts}; after that the job is marked FAILED.
 */
@Slf4j
@Component
public class GenerationJobRunner {

    static final String MDC_JOB_ID = "generation_job_id";
    static final String MDC_GENERATION_ID = "generation_id";

    private final Map<TaskType, GenerationWorker> workers = new EnumMap<>(TaskType.class);
    private final GenerationRepository generationRepository;
    private final GenerationStateService stateService;
    private final GenerationMetrics metrics;
    private final RetryProperties retryProperties;
    private final Clock clock;

    public GenerationJobRunner(List<GenerationWorker> workers,
                               GenerationRepository generationRepository,
                               GenerationStateService stateService,
                               GenerationMetrics metrics,
                               RetryProperties retryProperties,
                               Clock clock) {
        for (GenerationWorker worker : workers) {
            if (this.workers.put(worker.taskType(), worker) != null) {
                throw new IllegalStateException("Duplicate worker registered for " + worker.taskType());
            }
        }
        this.generationRepository = generationRepository;
        this.stateService = stateService;
        this.metrics = metrics;
        this.retryProperties = retryProperties;
        this.clock = clock;
    }

    public void run(GenerationJob job) {
        MDC.put(MDC_JOB_ID, job.jobId());
        MDC.put(MDC_GENERATION_ID, String.valueOf(job.generationId()));
        Instant started = clock.instant();
        try {
            GenerationWorker worker = workers.get(job.taskType());
            if (worker == null) {
                log.error("No worker registered for {}", job.taskType());
                failAfterExhaustion(job, "No worker registered for " + job.taskType());
                return;
            }
            runWithRetries(worker, job);
        } finally {
            metrics.recordDuration(job.taskType(), Duration.between(started, clock.instant()));
            MDC.remove(MDC_JOB_ID);
            MDC.remove(MDC_GENERATION_ID);
        }
    }

    private void runWithRetries(GenerationWorker worker, GenerationJob job) {
        RetryProperties.Policy policy = retryProperties.getJob();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                worker.execute(job.generationId());
                return;
            } catch (RuntimeException e) {
                if (attempt >= policy.getMaxAttempts()) {
                    log.error("Job {} failed after {} attempts", job.jobId(), attempt, e);
                    failAfterExhaustion(job, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                    return;
                }
                long delay = Backoff.delayMs(policy, attempt - 1);
                log.warn("Job {} attempt {} failed ({}); retrying in {} ms", job.jobId(), attempt, e.getMessage(), delay);
                stateService.recordRetry(job.generationId(), e.getMessage());
                metrics.incrementRetry(job.taskType());
                if (!sleepFor(delay)) {
                    failAfterExhaustion(job, "Interrupted while waiting to retry");
                    return;
                }
            }
        }
    }

    private void failAfterExhaustion(GenerationJob job, String error) {
        generationRepository.findById(job.generationId()).ifPresentOrElse(
                generation -> {
                    if (stateService.fail(generation, error)) {
                        metrics.incrementFailed(job.taskType(), "retries_exhausted");
                    }
                },
                () -> log.error("Generation {} vanished before its failure could be recorded", job.generationId()));
    }

    /**
     * @return false if the thread was interrupted
     */
    protected boolean sleepFor(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
