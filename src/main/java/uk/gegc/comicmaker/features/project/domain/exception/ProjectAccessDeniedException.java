package uk.gegc.comicmaker.features.project.domain.exception;

import java.util.UUID;

public class ProjectAccessDeniedException extends RuntimeException {

    public ProjectAccessDeniedException(UUID projectId) {
        super("You do not have access to project " + projectId);
    }
}
