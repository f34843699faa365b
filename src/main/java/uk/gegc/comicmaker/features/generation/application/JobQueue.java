package uk.gegc.comicmaker.features.generation.application;

import uk.gegc.comicmaker.features.generation.domain.model.TaskType;

import java.util.UUID;

/**
 * Asynchronous execution substrate for generation jobs.
 */
public interface JobQueue {

    /**
     * Queues a job for the registered worker of {@code taskType}.
     *
     * @return the queue's job id, used for status polling
     */
    String submit(UUID generationId, UUID projectId, TaskType taskType);
}
