package uk.gegc.comicmaker.features.plan.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.comicmaker.BaseUnitTest;
import uk.gegc.comicmaker.features.audit.application.AuditService;
import uk.gegc.comicmaker.features.audit.domain.model.AuditAction;
import uk.gegc.comicmaker.features.billing.domain.model.Payment;
import uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus;
import uk.gegc.comicmaker.features.plan.application.PlanPolicy;
import uk.gegc.comicmaker.features.plan.config.PlanProperties;
import uk.gegc.comicmaker.features.plan.domain.exception.PaymentNotSuccessfulException;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.user.domain.model.User;
import uk.gegc.comicmaker.features.user.domain.repository.UserRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("PlanUpgradeServiceImpl Unit Tests")
class PlanUpgradeServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private UserRepository userRepository;
    @Mock
    private AuditService auditService;

    private PlanUpgradeServiceImpl service;
    private User user;

    @BeforeEach
    void setUp() {
        service = new PlanUpgradeServiceImpl(userRepository, new PlanPolicy(new PlanProperties()), auditService,
                Clock.fixed(NOW, ZoneOffset.UTC));

        user = new User();
        user.setId(UUID.randomUUID());
        user.setUsername("artist");
        user.setPlan(PlanTier.FREE);
        user.setMonthlyQuota(0);

        when(userRepository.findByIdForUpdate(user.getId())).thenReturn(Optional.of(user));
        when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static Payment payment(PlanTier plan, PaymentStatus status) {
        Payment payment = new Payment();
        payment.setId(UUID.randomUUID());
        payment.setOrderId("order_1");
        payment.setPlan(plan);
        payment.setAmount(9900);
        payment.setCurrency("INR");
        payment.setStatus(status);
        return payment;
    }

    @Test
    @DisplayName("upgrade: FREE to PRO sets plan, quota and timestamps and writes an audit record")
    void upgrade_FreeToPro_AppliesLimits() {
        User result = service.upgrade(user.getId(), PlanTier.PRO, payment(PlanTier.PRO, PaymentStatus.SUCCESS));

        assertThat(result.getPlan()).isEqualTo(PlanTier.PRO);
        assertThat(result.getMonthlyQuota()).isEqualTo(50);
        assertThat(result.getPlanUpgradedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(result.getQuotaResetAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).plusMonths(1));
        verify(auditService).record(eq(user.getId()), eq(AuditAction.PLAN_UPGRADED), eq("user"),
                eq(user.getId().toString()), eq("FREE"), eq("PRO"), anyMap());
    }

    @Test
    @DisplayName("upgrade: CREATIVE to PRO is applied with a warning because payment was collected")
    void upgrade_CreativeToPro_AppliedAnyway() {
        user.setPlan(PlanTier.CREATIVE);
        user.setMonthlyQuota(200);

        User result = service.upgrade(user.getId(), PlanTier.PRO, payment(PlanTier.PRO, PaymentStatus.SUCCESS));

        assertThat(result.getPlan()).isEqualTo(PlanTier.PRO);
        assertThat(result.getMonthlyQuota()).isEqualTo(50);
        verify(auditService).record(any(), eq(AuditAction.PLAN_UPGRADED), any(), any(), eq("CREATIVE"), eq("PRO"), anyMap());
    }

    @Test
    @DisplayName("upgrade: same plan twice is a no-op without an audit record")
    void upgrade_SamePlan_Idempotent() {
        user.setPlan(PlanTier.PRO);
        user.setMonthlyQuota(50);

        User result = service.upgrade(user.getId(), PlanTier.PRO, payment(PlanTier.PRO, PaymentStatus.SUCCESS));

        assertThat(result.getPlan()).isEqualTo(PlanTier.PRO);
        verify(userRepository, never()).save(any());
        verifyNoInteractions(auditService);
    }

    @Test
    @DisplayName("upgrade: payment not in SUCCESS is rejected before touching the user")
    void upgrade_PaymentNotSuccessful_Throws() {
        assertThatThrownBy(() -> service.upgrade(user.getId(), PlanTier.PRO, payment(PlanTier.PRO, PaymentStatus.CREATED)))
                .isInstanceOf(PaymentNotSuccessfulException.class);
        assertThatThrownBy(() -> service.upgrade(user.getId(), PlanTier.PRO, null))
                .isInstanceOf(PaymentNotSuccessfulException.class);

        verify(userRepository, never()).findByIdForUpdate(any());
        assertThat(user.getPlan()).isEqualTo(PlanTier.FREE);
    }
}
