package uk.gegc.comicmaker.features.comic.domain.model;

import lombok.Getter;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

@Getter
public enum ImageResolution {
    LOW(256, 256),
    STANDARD(1024, 1024),
    HIGH(1792, 1024);

    private final int width;
    private final int height;

    ImageResolution(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public static ImageResolution forPlan(PlanTier plan) {
        return switch (plan) {
            case FREE -> LOW;
            case PRO -> STANDARD;
            case CREATIVE -> HIGH;
        };
    }
}
