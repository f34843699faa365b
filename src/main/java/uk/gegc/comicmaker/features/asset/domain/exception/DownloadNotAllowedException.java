package uk.gegc.comicmaker.features.asset.domain.exception;

import java.util.UUID;

public class DownloadNotAllowedException extends RuntimeException {

    public DownloadNotAllowedException(UUID projectId) {
        super("You are not allowed to download assets of project " + projectId);
    }
}
