package uk.gegc.comicmaker.features.billing.application;

import uk.gegc.comicmaker.features.billing.domain.model.PaymentWebhookEvent;

/**
 * Applies a verified gateway event to its Payment.
 */
public interface PaymentReconciliationService {

    enum Outcome {
        CAPTURED,
        FAILED,
        /** Event recorded, but the payment was already terminal. */
        NO_TRANSITION,
        ORDER_NOT_FOUND,
        IGNORED
    }

    /**
     * Records the event id and applies the status transition in one transaction. On capture the
     * plan upgrade runs in that same transaction.
     *
     * @throws uk.gegc.comicmaker.features.billing.domain.exception.EventAlreadyProcessedException
     *         when the event id was applied before
     * @throws org.springframework.dao.DataIntegrityViolationException when a concurrent delivery
     *         of the same event id committed first
     */
    Outcome reconcile(PaymentWebhookEvent event);
}
