package uk.gegc.comicmaker.features.plan.domain.exception;

public class FreeStoryAlreadyUsedException extends PlanLimitExceededException {

    public FreeStoryAlreadyUsedException() {
        super("Your free story has already been used. Upgrade to continue.");
    }
}
