package uk.gegc.comicmaker.features.asset.domain.exception;

import uk.gegc.comicmaker.shared.exception.UpstreamServiceException;

public class BlobStorageException extends UpstreamServiceException {

    public BlobStorageException(String message, Throwable cause) {
        super(message, true, cause);
    }
}
