package uk.gegc.comicmaker.features.plan.domain.model;

/**
 * Subscription tiers, declared in strictly increasing order. Comparisons use the ordinal.
 */
public enum PlanTier {
    FREE,
    PRO,
    CREATIVE;

    public boolean isAtLeast(PlanTier other) {
        return this.ordinal() >= other.ordinal();
    }

    public boolean isAbove(PlanTier other) {
        return this.ordinal() > other.ordinal();
    }
}
