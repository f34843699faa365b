package uk.gegc.comicmaker.features.project.domain.exception;

import uk.gegc.comicmaker.shared.exception.ResourceNotFoundException;

import java.util.UUID;

public class ProjectNotFoundException extends ResourceNotFoundException {

    public ProjectNotFoundException(UUID projectId) {
        super("Project " + projectId + " not found");
    }
}
