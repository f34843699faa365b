package uk.gegc.comicmaker.features.asset.domain.exception;

import java.util.UUID;

public class PdfAlreadyExistsException extends RuntimeException {

    public PdfAlreadyExistsException(UUID projectId) {
        super("A PDF already exists for project " + projectId + ". Set forceRegenerate to rebuild it.");
    }
}
