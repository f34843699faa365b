package uk.gegc.comicmaker.features.comic.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "comicmaker.image")
public class ImageGenerationProperties {

    /**
     * {@code openai} or {@code placeholder}
     */
    @NotBlank
    private String provider = "placeholder";

    @NotBlank
    private String model = "dall-e-3";

    /**
     * Model used for {@code LOW} resolution panels, which the default model cannot produce
     */
    @NotBlank
    private String lowResolutionModel = "dall-e-2";

    @Min(256)
    private int pageWidthPx = 2048;

    @Min(256)
    private int pageHeightPx = 2048;

    @Min(0)
    private int panelSpacingPx = 20;

    @Min(0)
    private int safeMarginPx = 40;

    @Min(50)
    private int maxPromptLength = 1000;

    @NotBlank
    private String watermarkText = "Comic AI";

    @NotBlank
    private String diagonalWatermarkText = "Comic AI Demo";
}
