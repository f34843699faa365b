package uk.gegc.comicmaker.features.plan.domain.exception;

/**
 * The caller's plan does not allow the requested action (insufficient tier, too many pages,
 * free story already consumed).
 */
public class PlanLimitExceededException extends RuntimeException {

    public PlanLimitExceededException(String message) {
        super(message);
    }
}
