package uk.gegc.comicmaker.features.billing.domain.exception;

public class InvalidPlanRequestedException extends RuntimeException {

    public InvalidPlanRequestedException(String message) {
        super(message);
    }
}
