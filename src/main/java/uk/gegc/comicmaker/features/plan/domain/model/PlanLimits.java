package uk.gegc.comicmaker.features.plan.domain.model;

public record PlanLimits(
        int maxPages,
        boolean allowGeneration,
        int monthlyQuota,
        boolean watermarkRequired
) {
}
