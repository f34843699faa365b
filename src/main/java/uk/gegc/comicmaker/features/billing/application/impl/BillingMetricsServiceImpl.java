package uk.gegc.comicmaker.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.comicmaker.features.billing.application.BillingMetricsService;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed billing metrics. Meters are tagged by gateway event type.
 */
@Service
@RequiredArgsConstructor
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    @Override
    public void incrementOrderCreated(String plan) {
        counter("payments.orders.created", "plan", plan).increment();
    }

    @Override
    public void incrementWebhookReceived(String eventType) {
        counter("payments.webhooks.received", "event_type", eventType).increment();
    }

    @Override
    public void incrementWebhookOk(String eventType) {
        counter("payments.webhooks.ok", "event_type", eventType).increment();
    }

    @Override
    public void incrementWebhookDuplicate(String eventType) {
        counter("payments.webhooks.duplicate", "event_type", eventType).increment();
    }

    @Override
    public void incrementWebhookIgnored(String eventType) {
        counter("payments.webhooks.ignored", "event_type", eventType).increment();
    }

    @Override
    public void incrementWebhookFailed(String eventType) {
        counter("payments.webhooks.failed", "event_type", eventType).increment();
    }

    @Override
    public void incrementSignatureRejected() {
        Counter.builder("payments.webhooks.signature_rejected")
                .description("Webhook deliveries rejected for a bad or missing signature")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordWebhookLatency(String eventType, long latencyMs) {
        Timer.builder("payments.webhooks.latency")
                .description("Webhook processing latency")
                .tag("event_type", safe(eventType))
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        return Counter.builder(name)
                .tag(tagKey, safe(tagValue))
                .register(meterRegistry);
    }

    private static String safe(String value) {
        return value == null ? "unknown" : value;
    }
}
