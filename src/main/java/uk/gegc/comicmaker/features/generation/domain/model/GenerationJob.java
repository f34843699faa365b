package uk.gegc.comicmaker.features.generation.domain.model;

import java.util.UUID;

/**
 * Typed payload handed to the job queue.
 */
public record GenerationJob(String jobId, UUID generationId, UUID projectId, TaskType taskType) {
}
