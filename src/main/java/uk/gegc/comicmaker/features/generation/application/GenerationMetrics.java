package uk.gegc.comicmaker.features.generation.application;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;

import java.time.Duration;

@Component
@RequiredArgsConstructor
public class GenerationMetrics {

    private static final String JOBS = "comicmaker.generation.jobs";
    private static final String FAILURES = "comicmaker.generation.failures";
    private static final String RETRIES = "comicmaker.generation.retries";
    private static final String DURATION = "comicmaker.generation.duration";

    private final MeterRegistry meterRegistry;

    public void incrementQueued(TaskType type) {
        jobs(type, "queued").increment();
    }

    public void incrementRejected(TaskType type) {
        jobs(type, "rejected").increment();
    }

    public void incrementCompleted(TaskType type) {
        jobs(type, "completed").increment();
    }

    public void incrementFailed(TaskType type, String reason) {
        jobs(type, "failed").increment();
        Counter.builder(FAILURES)
                .description("Failed generation jobs by cause")
                .tag("type", type.name())
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void incrementRetry(TaskType type) {
        Counter.builder(RETRIES)
                .description("Generation job retries after transient failures")
                .tag("type", type.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordDuration(TaskType type, Duration duration) {
        Timer.builder(DURATION)
                .description("Wall-clock time of a generation job run")
                .tag("type", type.name())
                .register(meterRegistry)
                .record(duration);
    }

    private Counter jobs(TaskType type, String result) {
        return Counter.builder(JOBS)
                .description("Generation jobs by outcome")
                .tag("type", type.name())
                .tag("result", result)
                .register(meterRegistry);
    }
}
