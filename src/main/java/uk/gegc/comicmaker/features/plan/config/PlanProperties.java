package uk.gegc.comicmaker.features.plan.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Plan to limit table. Values are read once at startup and never mutated.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "comicmaker.plans")
public class PlanProperties {

    @Valid
    @NotNull
    private Tier free = new Tier(1, true, 0, true);

    @Valid
    @NotNull
    private Tier pro = new Tier(3, true, 50, true);

    @Valid
    @NotNull
    private Tier creative = new Tier(10, true, 200, false);

    @Data
    public static class Tier {

        @Min(0)
        private int maxPages;

        private boolean allowGeneration;

        @Min(0)
        private int monthlyQuota;

        private boolean watermark;

        public Tier() {
        }

        public Tier(int maxPages, boolean allowGeneration, int monthlyQuota, boolean watermark) {
            this.maxPages = maxPages;
            this.allowGeneration = allowGeneration;
            this.monthlyQuota = monthlyQuota;
            this.watermark = watermark;
        }
    }
}
