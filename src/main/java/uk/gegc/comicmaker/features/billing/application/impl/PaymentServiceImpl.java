package uk.gegc.comicmaker.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.comicmaker.features.audit.application.AuditService;
import uk.gegc.comicmaker.features.audit.domain.model.AuditAction;
import uk.gegc.comicmaker.features.billing.api.dto.CreateOrderResponse;
import uk.gegc.comicmaker.features.billing.api.dto.OrderStatusResponse;
import uk.gegc.comicmaker.features.billing.application.BillingMetricsService;
import uk.gegc.comicmaker.features.billing.application.PaymentGatewayClient;
import uk.gegc.comicmaker.features.billing.application.PaymentService;
import uk.gegc.comicmaker.features.billing.config.RazorpayProperties;
import uk.gegc.comicmaker.features.billing.domain.exception.InvalidPlanRequestedException;
import uk.gegc.comicmaker.features.billing.domain.exception.PaymentNotFoundException;
import uk.gegc.comicmaker.features.billing.domain.model.Payment;
import uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus;
import uk.gegc.comicmaker.features.billing.infra.repository.PaymentRepository;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentServiceImpl implements PaymentService {

    private final PaymentGatewayClient gatewayClient;
    private final PaymentRepository paymentRepository;
    private final RazorpayProperties razorpayProperties;
    private final AuditService auditService;
    private final BillingMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional
    public CreateOrderResponse createOrder(User user, PlanTier plan) {
        Long amount = plan == null ? null : razorpayProperties.priceFor(plan);
        if (amount == null) {
            throw new InvalidPlanRequestedException("Plan " + plan + " cannot be purchased. Choose PRO or CREATIVE.");
        }

        String currency = razorpayProperties.getCurrency();
        String receipt = "rcpt_" + UUID.randomUUID().toString().replace("-", "").substring(0, 20);
        Map<String, String> notes = Map.of(
                "user_id", user.getId().toString(),
                "plan", plan.name());

        PaymentGatewayClient.GatewayOrder order = gatewayClient.createOrder(amount, currency, receipt, notes);

        Payment payment = new Payment();
        payment.setUserId(user.getId());
        payment.setOrderId(order.id());
        payment.setPlan(plan);
        payment.setAmount(amount);
        payment.setCurrency(currency);
        payment.setReceipt(receipt);
        payment.setStatus(PaymentStatus.CREATED);
        payment.setCreatedAt(LocalDateTime.now(clock));
        Payment saved = paymentRepository.save(payment);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("orderId", order.id());
        metadata.put("amount", amount);
        metadata.put("currency", currency);
        auditService.record(user.getId(), AuditAction.PAYMENT_CREATED, "payment", saved.getId().toString(),
                null, PaymentStatus.CREATED.name(), metadata);
        metricsService.incrementOrderCreated(plan.name());

        log.info("Created payment order {} for user {} plan {} amount {} {}",
                order.id(), user.getId(), plan, amount, currency);
        return new CreateOrderResponse(order.id(), amount, currency, razorpayProperties.getKeyId(), plan);
    }

    @Override
    @Transactional(readOnly = true)
    public OrderStatusResponse getOrder(User user, String orderId) {
        Payment payment = paymentRepository.findByOrderIdAndUserId(orderId, user.getId())
                .orElseThrow(() -> new PaymentNotFoundException(orderId));
        return new OrderStatusResponse(payment.getOrderId(), payment.getPlan(), payment.getAmount(),
                payment.getCurrency(), payment.getStatus(), payment.getFailureReason(),
                payment.getCreatedAt(), payment.getCapturedAt());
    }
}
