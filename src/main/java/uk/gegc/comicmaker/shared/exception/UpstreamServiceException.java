package uk.gegc.comicmaker.shared.exception;

/**
 * Base type for failures reported by an external provider (LLM, image model, payment gateway, storage).
 * {@link #isTransient()} separates timeout/connection faults, which may be retried, from
 * application-level rejections, which may not.
 */
public abstract class UpstreamServiceException extends RuntimeException {

    private final boolean transientFailure;

    protected UpstreamServiceException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    protected UpstreamServiceException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
