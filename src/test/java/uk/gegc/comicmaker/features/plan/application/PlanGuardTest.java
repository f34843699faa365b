package uk.gegc.comicmaker.features.plan.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.comicmaker.BaseUnitTest;
import uk.gegc.comicmaker.features.plan.config.PlanProperties;
import uk.gegc.comicmaker.features.plan.domain.exception.PlanLimitExceededException;
import uk.gegc.comicmaker.features.plan.domain.exception.QuotaExceededException;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.user.domain.model.User;
import uk.gegc.comicmaker.features.user.domain.repository.UserRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("PlanGuard Unit Tests")
class PlanGuardTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2026-05-10T08:00:00Z");
    private static final LocalDateTime NOW_LOCAL = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private UserRepository userRepository;

    private PlanGuard planGuard;
    private User user;

    @BeforeEach
    void setUp() {
        planGuard = new PlanGuard(new PlanPolicy(new PlanProperties()), userRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        user = new User();
        user.setId(UUID.randomUUID());
        user.setPlan(PlanTier.PRO);
        user.setMonthlyQuota(50);
    }

    @Nested
    @DisplayName("checkPlanAccess")
    class CheckPlanAccess {

        @Test
        @DisplayName("when plan is below the requirement then throws PlanLimitExceededException")
        void belowRequired_Throws() {
            assertThatThrownBy(() -> planGuard.checkPlanAccess(user, PlanTier.CREATIVE))
                    .isInstanceOf(PlanLimitExceededException.class)
                    .hasMessageContaining("CREATIVE");
        }

        @Test
        @DisplayName("when plan meets the requirement then passes")
        void meetsRequired_Passes() {
            assertThatCode(() -> planGuard.checkPlanAccess(user, PlanTier.PRO)).doesNotThrowAnyException();
            assertThatCode(() -> planGuard.checkPlanAccess(user, PlanTier.FREE)).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("checkGenerationQuota")
    class CheckGenerationQuota {

        @Test
        @DisplayName("when used equals quota inside the window then throws QuotaExceededException")
        void exhausted_Throws() {
            user.setQuotaUsed(50);
            user.setQuotaResetAt(NOW_LOCAL.plusDays(3));

            assertThatThrownBy(() -> planGuard.checkGenerationQuota(user))
                    .isInstanceOf(QuotaExceededException.class)
                    .hasMessageContaining("50/50");
            verify(userRepository, never()).resetQuotaIfDue(any(), any(), any());
        }

        @Test
        @DisplayName("when the window has elapsed then resets the counter and passes")
        void windowElapsed_ResetsAndPasses() {
            user.setQuotaUsed(50);
            user.setQuotaResetAt(NOW_LOCAL.minusSeconds(1));
            when(userRepository.resetQuotaIfDue(eq(user.getId()), any(), any())).thenReturn(1);

            assertThatCode(() -> planGuard.checkGenerationQuota(user)).doesNotThrowAnyException();
            verify(userRepository).resetQuotaIfDue(user.getId(), NOW_LOCAL.plusMonths(1), NOW_LOCAL);
        }

        @Test
        @DisplayName("when quota is zero then every generation is rejected")
        void zeroQuota_Throws() {
            user.setMonthlyQuota(0);
            user.setQuotaUsed(0);
            user.setQuotaResetAt(NOW_LOCAL.plusDays(10));

            assertThatThrownBy(() -> planGuard.checkGenerationQuota(user))
                    .isInstanceOf(QuotaExceededException.class);
        }

        @Test
        @DisplayName("when below quota then passes")
        void belowQuota_Passes() {
            user.setQuotaUsed(49);
            user.setQuotaResetAt(NOW_LOCAL.plusDays(10));

            assertThatCode(() -> planGuard.checkGenerationQuota(user)).doesNotThrowAnyException();
        }
    }
}
