package uk.gegc.comicmaker.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.comicmaker.features.audit.application.AuditService;
import uk.gegc.comicmaker.features.audit.domain.model.AuditAction;
import uk.gegc.comicmaker.features.billing.application.PaymentReconciliationService;
import uk.gegc.comicmaker.features.billing.application.WebhookLoggingContext;
import uk.gegc.comicmaker.features.billing.domain.exception.EventAlreadyProcessedException;
import uk.gegc.comicmaker.features.billing.domain.model.Payment;
import uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus;
import uk.gegc.comicmaker.features.billing.domain.model.PaymentWebhookEvent;
import uk.gegc.comicmaker.features.billing.domain.model.ProcessedPaymentEvent;
import uk.gegc.comicmaker.features.billing.infra.repository.PaymentRepository;
import uk.gegc.comicmaker.features.billing.infra.repository.ProcessedPaymentEventRepository;
import uk.gegc.comicmaker.features.plan.application.PlanUpgradeService;
import uk.gegc.comicmaker.shared.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentReconciliationServiceImpl implements PaymentReconciliationService {

    private static final int MAX_REASON_LENGTH = 500;

    private final PaymentRepository paymentRepository;
    private final ProcessedPaymentEventRepository processedPaymentEventRepository;
    private final PlanUpgradeService planUpgradeService;
    private final AuditService auditService;
    private final Clock clock;

    @Override
    @Transactional
    public Outcome reconcile(PaymentWebhookEvent event) {
        WebhookLoggingContext ctx = WebhookLoggingContext.builder()
                .eventId(event.eventId())
                .eventType(event.eventType())
                .orderId(event.orderId())
                .paymentId(event.gatewayPaymentId())
                .build();

        String type = event.eventType();
        if (!PaymentWebhookEvent.PAYMENT_CAPTURED.equals(type) && !PaymentWebhookEvent.PAYMENT_FAILED.equals(type)) {
            ctx.logInfo(log, "Ignoring payment event type={} (not handled)", type);
            return Outcome.IGNORED;
        }

        Payment payment = StringUtils.hasText(event.orderId())
                ? paymentRepository.findByOrderId(event.orderId()).orElse(null)
                : null;
        if (payment == null) {
            ctx.logWarn(log, "No payment for order {}; dropping event", event.orderId());
            return Outcome.ORDER_NOT_FOUND;
        }
        ctx.setUserId(payment.getUserId());

        if (!StringUtils.hasText(event.eventId())) {
            throw new ValidationException("Payment event carries no event id");
        }
        if (processedPaymentEventRepository.existsByEventId(event.eventId())) {
            ctx.logInfo(log, "Duplicate payment event {}", event.eventId());
            throw new EventAlreadyProcessedException(event.eventId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        // Primary key on event id: a concurrent delivery of the same event fails here
        processedPaymentEventRepository.saveAndFlush(
                new ProcessedPaymentEvent(event.eventId(), payment.getId(), type, now));

        PaymentStatus previous = payment.getStatus();
        if (PaymentWebhookEvent.PAYMENT_CAPTURED.equals(type)) {
            return applyCapture(event, payment, previous, now, ctx);
        }
        return applyFailure(event, payment, previous, now, ctx);
    }

    private Outcome applyCapture(PaymentWebhookEvent event, Payment payment, PaymentStatus previous,
                                 LocalDateTime now, WebhookLoggingContext ctx) {
        int updated = paymentRepository.markCaptured(payment.getId(), event.gatewayPaymentId(), now);
        if (updated == 0) {
            ctx.logWarn(log, "Payment {} already {}; capture event recorded without transition",
                    payment.getId(), previous);
            return Outcome.NO_TRANSITION;
        }

        Payment captured = paymentRepository.findById(payment.getId())
                .orElseThrow(() -> new IllegalStateException("Payment vanished during capture: " + payment.getId()));

        auditService.record(captured.getUserId(), AuditAction.PAYMENT_SUCCESS, "payment", captured.getId().toString(),
                previous.name(), PaymentStatus.SUCCESS.name(), linkage(event, captured));

        planUpgradeService.upgrade(captured.getUserId(), captured.getPlan(), captured);
        ctx.logInfo(log, "Payment captured for order {}; plan {} applied", captured.getOrderId(), captured.getPlan());
        return Outcome.CAPTURED;
    }

    private Outcome applyFailure(PaymentWebhookEvent event, Payment payment, PaymentStatus previous,
                                 LocalDateTime now, WebhookLoggingContext ctx) {
        String reason = truncate(StringUtils.hasText(event.errorDescription())
                ? event.errorDescription()
                : "Payment failed");
        int updated = paymentRepository.markFailed(payment.getId(), event.gatewayPaymentId(), reason, now);
        if (updated == 0) {
            ctx.logWarn(log, "Payment {} already {}; failure event recorded without transition",
                    payment.getId(), previous);
            return Outcome.NO_TRANSITION;
        }

        Map<String, Object> metadata = linkage(event, payment);
        metadata.put("reason", reason);
        auditService.record(payment.getUserId(), AuditAction.PAYMENT_FAILED, "payment", payment.getId().toString(),
                previous.name(), PaymentStatus.FAILED.name(), metadata);
        ctx.logWarn(log, "Payment failed for order {}: {}", payment.getOrderId(), reason);
        return Outcome.FAILED;
    }

    private static Map<String, Object> linkage(PaymentWebhookEvent event, Payment payment) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("eventId", event.eventId());
        metadata.put("orderId", payment.getOrderId());
        metadata.put("gatewayPaymentId", event.gatewayPaymentId());
        metadata.put("plan", payment.getPlan().name());
        metadata.put("amount", payment.getAmount());
        return metadata;
    }

    private static String truncate(String reason) {
        return reason.length() <= MAX_REASON_LENGTH ? reason : reason.substring(0, MAX_REASON_LENGTH - 3) + "...";
    }
}
