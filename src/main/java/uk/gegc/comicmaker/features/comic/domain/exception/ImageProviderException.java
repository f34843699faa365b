package uk.gegc.comicmaker.features.comic.domain.exception;

import uk.gegc.comicmaker.shared.exception.UpstreamServiceException;

public class ImageProviderException extends UpstreamServiceException {

    public ImageProviderException(String message) {
        super(message, false);
    }

    public ImageProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, transientFailure, cause);
    }
}
