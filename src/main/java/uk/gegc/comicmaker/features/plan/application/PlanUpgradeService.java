package uk.gegc.comicmaker.features.plan.application;

import uk.gegc.comicmaker.features.billing.domain.model.Payment;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.util.UUID;

public interface PlanUpgradeService {

    /**
     * Raise the user's plan to {@code purchasedPlan} on the strength of a captured payment.
     * <p>
     * Calling it again for a user already on {@code purchasedPlan} returns the user unchanged and
     * writes no audit record. A transition that is not upward is logged and still applied,
     * because the payment has already been collected.
     *
     * @throws uk.gegc.comicmaker.features.plan.domain.exception.PaymentNotSuccessfulException if the payment is not SUCCESS
     * @throws uk.gegc.comicmaker.shared.exception.ResourceNotFoundException if the user does not exist
     */
    User upgrade(UUID userId, PlanTier purchasedPlan, Payment payment);
}
