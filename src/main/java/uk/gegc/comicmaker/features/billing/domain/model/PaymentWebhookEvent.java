package uk.gegc.comicmaker.features.billing.domain.model;

/**
 * The fields of a gateway webhook envelope that reconciliation acts on.
 */
public record PaymentWebhookEvent(
        String eventId,
        String eventType,
        String orderId,
        String gatewayPaymentId,
        String entityStatus,
        String errorDescription
) {
    public static final String PAYMENT_CAPTURED = "payment.captured";
    public static final String PAYMENT_FAILED = "payment.failed";
}
