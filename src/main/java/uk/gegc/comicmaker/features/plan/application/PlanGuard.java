package uk.gegc.comicmaker.features.plan.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.comicmaker.features.plan.domain.exception.PlanLimitExceededException;
import uk.gegc.comicmaker.features.plan.domain.exception.QuotaExceededException;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.user.domain.model.User;
import uk.gegc.comicmaker.features.user.domain.repository.UserRepository;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Plan-gated action checks consumed by the route layer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanGuard {

    private final PlanPolicy planPolicy;
    private final UserRepository userRepository;
    private final Clock clock;

    public void checkPlanAccess(User user, PlanTier requiredPlan) {
        if (!planPolicy.hasAtLeast(user.getPlan(), requiredPlan)) {
            log.info("Plan access denied for user {}: has {}, requires {}", user.getId(), user.getPlan(), requiredPlan);
            throw new PlanLimitExceededException(
                    "This feature requires the " + requiredPlan + " plan or higher. Current plan: " + user.getPlan());
        }
    }

    /**
     * Rejects the call when {@code used >= quota}. A counter whose monthly window has elapsed is
     * reset first.
     */
    @Transactional
    public void checkGenerationQuota(User user) {
        LocalDateTime now = LocalDateTime.now(clock);
        int used = user.getQuotaUsed();
        if (user.getQuotaResetAt() == null || !user.getQuotaResetAt().isAfter(now)) {
            if (userRepository.resetQuotaIfDue(user.getId(), now.plusMonths(1), now) > 0) {
                log.info("Monthly quota window reset for user {}", user.getId());
            }
            used = 0;
        }
        int quota = user.getMonthlyQuota();
        if (used >= quota) {
            throw new QuotaExceededException(used, quota);
        }
    }
}
