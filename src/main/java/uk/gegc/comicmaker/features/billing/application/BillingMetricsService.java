package uk.gegc.comicmaker.features.billing.application;

/**
 * Counters and timers for the payment flow.
 */
public interface BillingMetricsService {

    void incrementOrderCreated(String plan);

    void incrementWebhookReceived(String eventType);
    void incrementWebhookOk(String eventType);
    void incrementWebhookDuplicate(String eventType);
    void incrementWebhookIgnored(String eventType);
    void incrementWebhookFailed(String eventType);
    void incrementSignatureRejected();

    void recordWebhookLatency(String eventType, long latencyMs);
}
