package uk.gegc.comicmaker.features.billing.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

import java.time.Duration;

/**
 * Razorpay credentials and the server-side price list. Amounts are in minor units.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "comicmaker.billing.razorpay")
public class RazorpayProperties {

    private String keyId;
    private String keySecret;
    private String webhookSecret;

    @NotBlank
    private String currency = "INR";

    @NotBlank
    private String apiBaseUrl = "https://api.razorpay.com/v1";

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(15);

    @Min(1)
    private long proPlanPrice = 9900;

    @Min(1)
    private long creativePlanPrice = 29900;

    /**
     * @return the configured price, or {@code null} when the plan cannot be bought
     */
    public Long priceFor(PlanTier plan) {
        return switch (plan) {
            case PRO -> proPlanPrice;
            case CREATIVE -> creativePlanPrice;
            case FREE -> null;
        };
    }
}
