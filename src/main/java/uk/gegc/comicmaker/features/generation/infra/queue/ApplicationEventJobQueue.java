package uk.gegc.comicmaker.features.generation.infra.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.generation.application.JobQueue;
import uk.gegc.comicmaker.features.generation.domain.event.GenerationJobSubmittedEvent;
import uk.gegc.comicmaker.features.generation.domain.model.GenerationJob;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;

import java.util.UUID;

/**
 * In-process queue: jobs are published as events and picked up after commit by
 * {@link GenerationJobListener} on the generation executor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationEventJobQueue implements JobQueue {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public String submit(UUID generationId, UUID projectId, TaskType taskType) {
        String jobId = UUID.randomUUID().toString();
        eventPublisher.publishEvent(new GenerationJobSubmittedEvent(this,
                new GenerationJob(jobId, generationId, projectId, taskType)));
        log.debug("Queued {} job {} for generation {}", taskType, jobId, generationId);
        return jobId;
    }
}
