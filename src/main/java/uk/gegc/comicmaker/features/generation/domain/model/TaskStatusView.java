package uk.gegc.comicmaker.features.generation.domain.model;

import java.util.UUID;

/**
 * Read model returned by status polling. {@link #notFound()} is the sentinel for unknown job ids.
 */
public record TaskStatusView(
        String status,
        Integer progress,
        String error,
        UUID generationId,
        UUID projectId,
        TaskType taskType
) {

    public static final String NOT_FOUND = "not_found";

    public static TaskStatusView notFound() {
        return new TaskStatusView(NOT_FOUND, null, null, null, null, null);
    }

    public static TaskStatusView of(Generation generation) {
        return new TaskStatusView(
                generation.getStatus().name().toLowerCase(),
                generation.getProgress(),
                generation.getErrorMessage(),
                generation.getId(),
                generation.getProjectId(),
                generation.getTaskType()
        );
    }

    public boolean isFound() {
        return !NOT_FOUND.equals(status);
    }
}
