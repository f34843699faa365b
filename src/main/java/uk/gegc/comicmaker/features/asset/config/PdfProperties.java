package uk.gegc.comicmaker.features.asset.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "comicmaker.pdf")
public class PdfProperties {

    @Min(36)
    private int freeDpi = 72;

    @Min(36)
    private int proDpi = 150;

    @Min(36)
    private int creativeDpi = 300;

    /**
     * Page width in inches (default US comic book trim)
     */
    @DecimalMin("1.0")
    private double pageWidthInches = 6.625;

    @DecimalMin("1.0")
    private double pageHeightInches = 10.25;

    /**
     * Minimum plan allowed to request a PDF
     */
    @NotNull
    private PlanTier minPlan = PlanTier.FREE;

    public int dpiFor(PlanTier plan) {
        return switch (plan) {
            case FREE -> freeDpi;
            case PRO -> proDpi;
            case CREATIVE -> creativeDpi;
        };
    }
}
