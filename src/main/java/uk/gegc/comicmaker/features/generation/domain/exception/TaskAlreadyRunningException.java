package uk.gegc.comicmaker.features.generation.domain.exception;

import java.util.UUID;

public class TaskAlreadyRunningException extends RuntimeException {

    public TaskAlreadyRunningException(UUID projectId) {
        super("A generation task is already queued or running for project " + projectId);
    }
}
