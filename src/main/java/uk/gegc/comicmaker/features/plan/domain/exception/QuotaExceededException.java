package uk.gegc.comicmaker.features.plan.domain.exception;

import lombok.Getter;

@Getter
public class QuotaExceededException extends RuntimeException {

    private final int used;
    private final int quota;

    public QuotaExceededException(int used, int quota) {
        super("Monthly generation quota exceeded. Used: " + used + "/" + quota + ". Upgrade your plan for higher quota.");
        this.used = used;
        this.quota = quota;
    }
}
