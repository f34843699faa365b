package uk.gegc.comicmaker.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import uk.gegc.comicmaker.BaseUnitTest;
import uk.gegc.comicmaker.features.audit.application.AuditService;
import uk.gegc.comicmaker.features.audit.domain.model.AuditAction;
import uk.gegc.comicmaker.features.billing.application.PaymentReconciliationService.Outcome;
import uk.gegc.comicmaker.features.billing.domain.exception.EventAlreadyProcessedException;
import uk.gegc.comicmaker.features.billing.domain.model.Payment;
import uk.gegc.comicmaker.features.billing.domain.model.PaymentStatus;
import uk.gegc.comicmaker.features.billing.domain.model.PaymentWebhookEvent;
import uk.gegc.comicmaker.features.billing.domain.model.ProcessedPaymentEvent;
import uk.gegc.comicmaker.features.billing.infra.repository.PaymentRepository;
import uk.gegc.comicmaker.features.billing.infra.repository.ProcessedPaymentEventRepository;
import uk.gegc.comicmaker.features.plan.application.PlanUpgradeService;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("PaymentReconciliationServiceImpl Unit Tests")
class PaymentReconciliationServiceImplTest extends BaseUnitTest {

    private static final String ORDER_ID = "order_123";

    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private ProcessedPaymentEventRepository processedPaymentEventRepository;
    @Mock
    private PlanUpgradeService planUpgradeService;
    @Mock
    private AuditService auditService;

    private PaymentReconciliationServiceImpl service;
    private Payment payment;
    private UUID userId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        service = new PaymentReconciliationServiceImpl(paymentRepository, processedPaymentEventRepository,
                planUpgradeService, auditService, clock);

        userId = UUID.randomUUID();
        payment = new Payment();
        payment.setId(UUID.randomUUID());
        payment.setUserId(userId);
        payment.setOrderId(ORDER_ID);
        payment.setPlan(PlanTier.PRO);
        payment.setAmount(9900);
        payment.setCurrency("INR");
        payment.setStatus(PaymentStatus.CREATED);

        when(paymentRepository.findByOrderId(ORDER_ID)).thenReturn(Optional.of(payment));
        when(processedPaymentEventRepository.existsByEventId(anyString())).thenReturn(false);
    }

    private static PaymentWebhookEvent event(String type, String eventId) {
        return new PaymentWebhookEvent(eventId, type, ORDER_ID, "pay_1", null, null);
    }

    @Nested
    @DisplayName("payment.captured")
    class Captured {

        @Test
        @DisplayName("when payment is CREATED then marks SUCCESS, audits and upgrades the plan")
        void captured_CreatedPayment_UpgradesPlan() {
            Payment captured = new Payment();
            captured.setId(payment.getId());
            captured.setUserId(userId);
            captured.setOrderId(ORDER_ID);
            captured.setPlan(PlanTier.PRO);
            captured.setAmount(9900);
            captured.setStatus(PaymentStatus.SUCCESS);
            when(paymentRepository.markCaptured(eq(payment.getId()), eq("pay_1"), any(LocalDateTime.class))).thenReturn(1);
            when(paymentRepository.findById(payment.getId())).thenReturn(Optional.of(captured));

            Outcome outcome = service.reconcile(event(PaymentWebhookEvent.PAYMENT_CAPTURED, "evt_1"));

            assertThat(outcome).isEqualTo(Outcome.CAPTURED);
            verify(processedPaymentEventRepository).saveAndFlush(any(ProcessedPaymentEvent.class));
            verify(auditService).record(eq(userId), eq(AuditAction.PAYMENT_SUCCESS), eq("payment"),
                    eq(payment.getId().toString()), eq("CREATED"), eq("SUCCESS"), anyMap());
            verify(planUpgradeService).upgrade(userId, PlanTier.PRO, captured);
        }

        @Test
        @DisplayName("when payment already terminal then records the event without upgrading")
        void captured_TerminalPayment_NoTransition() {
            payment.setStatus(PaymentStatus.SUCCESS);
            when(paymentRepository.markCaptured(any(), any(), any())).thenReturn(0);

            Outcome outcome = service.reconcile(event(PaymentWebhookEvent.PAYMENT_CAPTURED, "evt_2"));

            assertThat(outcome).isEqualTo(Outcome.NO_TRANSITION);
            verify(processedPaymentEventRepository).saveAndFlush(any(ProcessedPaymentEvent.class));
            verifyNoInteractions(planUpgradeService);
        }
    }

    @Nested
    @DisplayName("payment.failed")
    class Failed {

        @Test
        @DisplayName("when payment is CREATED then marks FAILED with the gateway reason and audits")
        @SuppressWarnings("unchecked")
        void failed_CreatedPayment_RecordsReason() {
            when(paymentRepository.markFailed(eq(payment.getId()), eq("pay_1"), eq("Card declined"), any())).thenReturn(1);
            PaymentWebhookEvent failed = new PaymentWebhookEvent("evt_3", PaymentWebhookEvent.PAYMENT_FAILED,
                    ORDER_ID, "pay_1", "failed", "Card declined");

            Outcome outcome = service.reconcile(failed);

            assertThat(outcome).isEqualTo(Outcome.FAILED);
            ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
            verify(auditService).record(eq(userId), eq(AuditAction.PAYMENT_FAILED), eq("payment"),
                    anyString(), eq("CREATED"), eq("FAILED"), metadata.capture());
            assertThat(metadata.getValue()).containsEntry("reason", "Card declined");
            verifyNoInteractions(planUpgradeService);
        }

        @Test
        @DisplayName("when gateway gives no reason then a default reason is stored")
        void failed_NoReason_UsesDefault() {
            when(paymentRepository.markFailed(any(), any(), eq("Payment failed"), any())).thenReturn(1);

            Outcome outcome = service.reconcile(event(PaymentWebhookEvent.PAYMENT_FAILED, "evt_4"));

            assertThat(outcome).isEqualTo(Outcome.FAILED);
            verify(paymentRepository).markFailed(eq(payment.getId()), eq("pay_1"), eq("Payment failed"), any());
        }
    }

    @Nested
    @DisplayName("edge cases")
    class EdgeCases {

        @Test
        @DisplayName("when event id already processed then throws EventAlreadyProcessedException")
        void duplicateEvent_Throws() {
            when(processedPaymentEventRepository.existsByEventId("evt_dup")).thenReturn(true);

            assertThatThrownBy(() -> service.reconcile(event(PaymentWebhookEvent.PAYMENT_CAPTURED, "evt_dup")))
                    .isInstanceOf(EventAlreadyProcessedException.class);
            verify(paymentRepository, never()).markCaptured(any(), any(), any());
            verifyNoInteractions(planUpgradeService);
        }

        @Test
        @DisplayName("when order is unknown then drops the event")
        void unknownOrder_ReturnsOrderNotFound() {
            when(paymentRepository.findByOrderId(ORDER_ID)).thenReturn(Optional.empty());

            Outcome outcome = service.reconcile(event(PaymentWebhookEvent.PAYMENT_CAPTURED, "evt_5"));

            assertThat(outcome).isEqualTo(Outcome.ORDER_NOT_FOUND);
            verify(processedPaymentEventRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("when event type is not handled then ignores it")
        void unhandledType_ReturnsIgnored() {
            Outcome outcome = service.reconcile(event("order.paid", "evt_6"));

            assertThat(outcome).isEqualTo(Outcome.IGNORED);
            verifyNoInteractions(paymentRepository, processedPaymentEventRepository, auditService, planUpgradeService);
        }
    }
}
