package uk.gegc.comicmaker.features.generation.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.slf4j.MDC;
import uk.gegc.comicmaker.BaseUnitTest;
import uk.gegc.comicmaker.features.comic.domain.exception.ImageProviderException;
import uk.gegc.comicmaker.features.generation.application.worker.GenerationWorker;
import uk.gegc.comicmaker.features.generation.domain.model.Generation;
import uk.gegc.comicmaker.features.generation.domain.model.GenerationJob;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;
import uk.gegc.comicmaker.features.generation.domain.repository.GenerationRepository;
import uk.gegc.comicmaker.shared.config.RetryProperties;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("GenerationJobRunner Unit Tests")
class GenerationJobRunnerTest extends BaseUnitTest {

    @Mock
    private GenerationWorker imageWorker;
    @Mock
    private GenerationRepository generationRepository;
    @Mock
    private GenerationStateService stateService;
    @Mock
    private GenerationMetrics metrics;

    private RetryProperties retryProperties;
    private List<Long> sleeps;
    private boolean sleepSucceeds;
    private GenerationJobRunner runner;
    private Generation generation;
    private GenerationJob job;

    @BeforeEach
    void setUp() {
        when(imageWorker.taskType()).thenReturn(TaskType.IMAGE_GENERATION);

        retryProperties = new RetryProperties();
        retryProperties.setJob(new RetryProperties.Policy(3, 100, 1000, 0.0));
        sleeps = new ArrayList<>();
        sleepSucceeds = true;

        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        runner = new GenerationJobRunner(List.of(imageWorker), generationRepository, stateService, metrics,
                retryProperties, clock) {
            @Override
            protected boolean sleepFor(long millis) {
                sleeps.add(millis);
                return sleepSucceeds;
            }
        };

        generation = new Generation();
        generation.setId(UUID.randomUUID());
        generation.setProjectId(UUID.randomUUID());
        generation.setTaskType(TaskType.IMAGE_GENERATION);
        job = new GenerationJob("job-1", generation.getId(), generation.getProjectId(), TaskType.IMAGE_GENERATION);

        when(generationRepository.findById(generation.getId())).thenReturn(Optional.of(generation));
        when(stateService.fail(any(), anyString())).thenReturn(true);
    }

    @Test
    @DisplayName("two workers for the same task type are rejected at construction")
    void constructor_duplicateWorker_throws() {
        GenerationWorker other = mock(GenerationWorker.class);
        when(other.taskType()).thenReturn(TaskType.IMAGE_GENERATION);

        assertThatThrownBy(() -> new GenerationJobRunner(List.of(imageWorker, other), generationRepository,
                stateService, metrics, retryProperties, Clock.systemUTC()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("IMAGE_GENERATION");
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("successful first attempt: no retry recorded and duration measured")
        void run_success_noRetry() {
            runner.run(job);

            verify(imageWorker).execute(generation.getId());
            verify(stateService, never()).recordRetry(any(), any());
            verify(stateService, never()).fail(any(), any());
            verify(metrics).recordDuration(eq(TaskType.IMAGE_GENERATION), any());
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("transient failure then success: one retry with base delay")
        void run_failsOnceThenSucceeds_retries() {
            doThrow(new ImageProviderException("timeout", true, null))
                    .doNothing()
                    .when(imageWorker).execute(generation.getId());

            runner.run(job);

            verify(imageWorker, times(2)).execute(generation.getId());
            verify(stateService).recordRetry(generation.getId(), "timeout");
            verify(metrics).incrementRetry(TaskType.IMAGE_GENERATION);
            verify(stateService, never()).fail(any(), any());
            assertThat(sleeps).containsExactly(100L);
        }

        @Test
        @DisplayName("every attempt fails: backoff doubles and the job is marked FAILED")
        void run_exhausted_marksFailed() {
            doThrow(new IllegalStateException("boom")).when(imageWorker).execute(generation.getId());

            runner.run(job);

            verify(imageWorker, times(3)).execute(generation.getId());
            verify(stateService, times(2)).recordRetry(generation.getId(), "boom");
            verify(stateService).fail(generation, "boom");
            verify(metrics).incrementFailed(TaskType.IMAGE_GENERATION, "retries_exhausted");
            assertThat(sleeps).containsExactly(100L, 200L);
        }

        @Test
        @DisplayName("interrupted while waiting: job is failed without further attempts")
        void run_interrupted_failsImmediately() {
            sleepSucceeds = false;
            doThrow(new IllegalStateException("boom")).when(imageWorker).execute(generation.getId());

            runner.run(job);

            verify(imageWorker, times(1)).execute(generation.getId());
            verify(stateService).fail(generation, "Interrupted while waiting to retry");
        }

        @Test
        @DisplayName("failure already recorded elsewhere: failed counter untouched")
        void run_exhausted_alreadyTerminal_noFailedMetric() {
            when(stateService.fail(any(), anyString())).thenReturn(false);
            doThrow(new IllegalStateException("boom")).when(imageWorker).execute(generation.getId());

            runner.run(job);

            verify(metrics, never()).incrementFailed(any(), any());
        }

        @Test
        @DisplayName("no worker for the task type: job is failed")
        void run_noWorker_fails() {
            GenerationJob pdfJob = new GenerationJob("job-2", generation.getId(), generation.getProjectId(),
                    TaskType.PDF_COMPILATION);

            runner.run(pdfJob);

            verify(stateService).fail(eq(generation), contains("No worker registered"));
            verify(imageWorker, never()).execute(any());
        }

        @Test
        @DisplayName("MDC keys are cleared after the run")
        void run_clearsMdc() {
            runner.run(job);

            assertThat(MDC.get("generation_job_id")).isNull();
            assertThat(MDC.get("generation_id")).isNull();
        }
    }
}
