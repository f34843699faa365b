package uk.gegc.comicmaker.shared.util;

import uk.gegc.comicmaker.shared.config.RetryProperties;

import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {

    private Backoff() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Exponential backoff with jitter: {@code base * 2^retryIndex}, scaled by a random factor in
     * {@code [1 - jitter, 1 + jitter]} and capped at {@code maxDelayMs}.
     *
     * @param retryIndex zero for the delay before the first retry
     */
    public static long delayMs(RetryProperties.Policy policy, int retryIndex) {
        long exponentialDelay = policy.getBaseDelayMs() * (1L << Math.min(retryIndex, 20));
        double jitterRange = policy.getJitterFactor();
        double jitter = jitterRange <= 0
                ? 1.0
                : (1.0 - jitterRange) + (ThreadLocalRandom.current().nextDouble() * 2 * jitterRange);
        long delayWithJitter = (long) (exponentialDelay * jitter);
        return Math.min(delayWithJitter, policy.getMaxDelayMs());
    }
}
