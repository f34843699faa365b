package uk.gegc.comicmaker.features.plan.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.plan.config.PlanProperties;
import uk.gegc.comicmaker.features.plan.domain.model.PlanLimits;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

/**
 * Pure mapping from a plan tier to its limits. Route guards, the scene service and the
 * generation workers all read limits from here.
 */
@Component
@RequiredArgsConstructor
public class PlanPolicy {

    private final PlanProperties properties;

    public PlanLimits limitsFor(PlanTier plan) {
        PlanProperties.Tier tier = switch (plan) {
            case FREE -> properties.getFree();
            case PRO -> properties.getPro();
            case CREATIVE -> properties.getCreative();
        };
        return new PlanLimits(tier.getMaxPages(), tier.isAllowGeneration(), tier.getMonthlyQuota(), tier.isWatermark());
    }

    public boolean hasAtLeast(PlanTier actual, PlanTier required) {
        return actual.isAtLeast(required);
    }

    public boolean isWatermarkRequired(PlanTier plan) {
        return limitsFor(plan).watermarkRequired();
    }
}
