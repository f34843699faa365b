package uk.gegc.comicmaker.features.billing.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.comicmaker.features.billing.application.BillingMetricsService;
import uk.gegc.comicmaker.features.billing.application.PaymentReconciliationService;
import uk.gegc.comicmaker.features.billing.application.PaymentWebhookService;
import uk.gegc.comicmaker.features.billing.application.WebhookLoggingContext;
import uk.gegc.comicmaker.features.billing.application.WebhookSignatureVerifier;
import uk.gegc.comicmaker.features.billing.config.RazorpayProperties;
import uk.gegc.comicmaker.features.billing.domain.exception.EventAlreadyProcessedException;
import uk.gegc.comicmaker.features.billing.domain.exception.InvalidWebhookSignatureException;
import uk.gegc.comicmaker.features.billing.domain.model.PaymentWebhookEvent;
import uk.gegc.comicmaker.features.billing.infra.repository.ProcessedPaymentEventRepository;
import uk.gegc.comicmaker.shared.exception.ValidationException;

import java.io.IOException;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentWebhookServiceImpl implements PaymentWebhookService {

    private final RazorpayProperties razorpayProperties;
    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentReconciliationService reconciliationService;
    private final ProcessedPaymentEventRepository processedPaymentEventRepository;
    private final BillingMetricsService metricsService;
    private final ObjectMapper objectMapper;

    @Override
    public Result process(byte[] rawBody, String signature, String eventIdHeader) {
        long startTime = System.currentTimeMillis();

        String webhookSecret = razorpayProperties.getWebhookSecret();
        if (!StringUtils.hasText(webhookSecret)) {
            log.error("Payment webhook secret not configured; rejecting request");
            metricsService.incrementSignatureRejected();
            throw new InvalidWebhookSignatureException("Webhook secret not configured");
        }
        if (!signatureVerifier.verify(rawBody, signature, webhookSecret)) {
            log.error("Payment webhook signature verification failed (signature {})",
                    StringUtils.hasText(signature) ? "mismatch" : "missing");
            metricsService.incrementSignatureRejected();
            throw new InvalidWebhookSignatureException("Invalid webhook signature");
        }

        PaymentWebhookEvent event = parse(rawBody, eventIdHeader);
        String type = event.eventType();
        metricsService.incrementWebhookReceived(type);

        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .eventId(event.eventId())
                .eventType(type)
                .orderId(event.orderId())
                .paymentId(event.gatewayPaymentId())
                .build();
        loggingContext.logInfo(log, "Processing payment webhook event: id={} type={}", event.eventId(), type);

        try {
            Result result = apply(event, loggingContext);
            switch (result) {
                case OK -> metricsService.incrementWebhookOk(type);
                case DUPLICATE -> metricsService.incrementWebhookDuplicate(type);
                case IGNORED -> metricsService.incrementWebhookIgnored(type);
            }
            metricsService.recordWebhookLatency(type, System.currentTimeMillis() - startTime);
            return result;
        } catch (RuntimeException e) {
            metricsService.incrementWebhookFailed(type);
            loggingContext.logError(log, "Failed to process payment webhook event: id={} type={}",
                    event.eventId(), type, e);
            throw e;
        } finally {
            WebhookLoggingContext.clearMDC();
        }
    }

    private Result apply(PaymentWebhookEvent event, WebhookLoggingContext loggingContext) {
        try {
            PaymentReconciliationService.Outcome outcome = reconciliationService.reconcile(event);
            return switch (outcome) {
                case CAPTURED, FAILED, NO_TRANSITION -> Result.OK;
                case ORDER_NOT_FOUND, IGNORED -> Result.IGNORED;
            };
        } catch (EventAlreadyProcessedException e) {
            return Result.DUPLICATE;
        } catch (DataIntegrityViolationException e) {
            if (StringUtils.hasText(event.eventId())
                    && processedPaymentEventRepository.existsByEventId(event.eventId())) {
                loggingContext.logInfo(log, "Concurrent delivery of event {} lost the race", event.eventId());
                return Result.DUPLICATE;
            }
            throw e;
        }
    }

    private PaymentWebhookEvent parse(byte[] rawBody, String eventIdHeader) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            throw new ValidationException("Malformed webhook payload");
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Malformed webhook payload");
        }
        JsonNode entity = root.path("payload").path("payment").path("entity");
        String gatewayPaymentId = text(entity, "id");
        String eventId = StringUtils.hasText(eventIdHeader) ? eventIdHeader.trim() : gatewayPaymentId;
        return new PaymentWebhookEvent(
                eventId,
                text(root, "event"),
                text(entity, "order_id"),
                gatewayPaymentId,
                text(entity, "status"),
                text(entity, "error_description"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
