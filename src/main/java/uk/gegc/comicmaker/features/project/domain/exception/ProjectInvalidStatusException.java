package uk.gegc.comicmaker.features.project.domain.exception;

import lombok.Getter;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;

@Getter
public class ProjectInvalidStatusException extends RuntimeException {

    private final ProjectStatus status;

    public ProjectInvalidStatusException(ProjectStatus status, String message) {
        super(message);
        this.status = status;
    }
}
