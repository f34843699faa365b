package uk.gegc.comicmaker.features.story.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "comicmaker.story")
public class StoryProperties {

    /**
     * Extra LLM calls allowed when the output does not match the script schema
     */
    @Min(0)
    private int maxSchemaRetries = 2;

    /**
     * Case-insensitive terms that reject the input before any LLM call
     */
    private List<String> blockedTerms = new ArrayList<>(List.of("forbidden_content"));

    private String defaultTheme = "standard";

    @NotNull
    private PlanTier minimumPlan = PlanTier.FREE;
}
