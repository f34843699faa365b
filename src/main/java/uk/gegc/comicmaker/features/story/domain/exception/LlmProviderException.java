package uk.gegc.comicmaker.features.story.domain.exception;

import uk.gegc.comicmaker.shared.exception.UpstreamServiceException;

public class LlmProviderException extends UpstreamServiceException {

    public LlmProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, transientFailure, cause);
    }

    public LlmProviderException(String message) {
        super(message, false);
    }
}
