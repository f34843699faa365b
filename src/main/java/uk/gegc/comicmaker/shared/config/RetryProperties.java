package uk.gegc.comicmaker.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Retry and backoff settings.
 * <p>
 * {@code job} governs re-execution of a whole generation job by the async substrate after a
 * transient or unclassified failure. {@code provider} governs retries at the point of an outbound
 * call to the LLM or image provider.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "comicmaker.retry")
public class RetryProperties {

    @Valid
    private Policy job = new Policy(3, 2000, 30000, 0.25);

    @Valid
    private Policy provider = new Policy(3, 2000, 10000, 0.0);

    @Data
    public static class Policy {

        /**
         * Total attempts including the first one
         */
        @Min(1)
        private int maxAttempts;

        /**
         * Base delay in milliseconds for exponential backoff
         */
        @Min(0)
        private long baseDelayMs;

        /**
         * Maximum delay in milliseconds (cap for exponential backoff)
         */
        @Min(0)
        private long maxDelayMs;

        /**
         * Jitter factor (0.0 = no jitter, 0.5 = ±50% variation)
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor;

        public Policy() {
        }

        public Policy(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterFactor) {
            this.maxAttempts = maxAttempts;
            this.baseDelayMs = baseDelayMs;
            this.maxDelayMs = maxDelayMs;
            this.jitterFactor = jitterFactor;
        }
    }
}
