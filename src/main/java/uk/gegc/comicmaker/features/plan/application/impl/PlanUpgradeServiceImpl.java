package uk.gegc.comicmaker.features.plan.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.comicmaker.features.audit.application.AuditService;
import uk.gegc.comicmaker.features.audit.domain.model.AuditAction;
import uk.gegc.comicmaker.features.billing.domain.model.Payment;
import uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus;
import uk.gegc.comicmaker.features.plan.application.PlanPolicy;
import uk.gegc.comicmaker.features.plan.application.PlanUpgradeService;
import uk.gegc.comicmaker.features.plan.domain.exception.PaymentNotSuccessfulException;
import uk.gegc.comicmaker.features.plan.domain.model.PlanLimits;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.user.domain.model.User;
import uk.gegc.comicmaker.features.user.domain.repository.UserRepository;
import uk.gegc.comicmaker.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlanUpgradeServiceImpl implements PlanUpgradeService {

    private final UserRepository userRepository;
    private final PlanPolicy planPolicy;
    private final AuditService auditService;
    private final Clock clock;

    @Override
    @Transactional
    public User upgrade(UUID userId, PlanTier purchasedPlan, Payment payment) {
        if (payment == null || payment.getStatus() != PaymentStatus.SUCCESS) {
            throw new PaymentNotSuccessfulException("Plan upgrade requires a successful payment; got status "
                    + (payment == null ? "none" : payment.getStatus()));
        }

        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User " + userId + " not found"));

        PlanTier currentPlan = user.getPlan();
        if (currentPlan == purchasedPlan) {
            log.info("User {} already on plan {}; upgrade for order {} is a no-op",
                    userId, purchasedPlan, payment.getOrderId());
            return user;
        }

        if (!purchasedPlan.isAbove(currentPlan)) {
            // Payment is already collected; apply it and leave the anomaly to an operator
            log.warn("Non-upward plan change for user {}: {} -> {} (order {}, payment {})",
                    userId, currentPlan, purchasedPlan, payment.getOrderId(), payment.getGatewayPaymentId());
        }

        PlanLimits limits = planPolicy.limitsFor(purchasedPlan);
        LocalDateTime now = LocalDateTime.now(clock);
        user.setPlan(purchasedPlan);
        user.setMonthlyQuota(limits.monthlyQuota());
        user.setPlanUpgradedAt(now);
        if (user.getQuotaResetAt() == null) {
            user.setQuotaResetAt(now.plusMonths(1));
        }
        User saved = userRepository.save(user);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("paymentId", payment.getId() != null ? payment.getId().toString() : null);
        metadata.put("orderId", payment.getOrderId());
        metadata.put("gatewayPaymentId", payment.getGatewayPaymentId());
        metadata.put("amount", payment.getAmount());
        metadata.put("currency", payment.getCurrency());
        auditService.record(userId, AuditAction.PLAN_UPGRADED, "user", userId.toString(),
                currentPlan.name(), purchasedPlan.name(), metadata);

        log.info("User {} plan changed {} -> {} (order {})", userId, currentPlan, purchasedPlan, payment.getOrderId());
        return saved;
    }
}
