package uk.gegc.comicmaker.features.story.domain.model;

public record LlmUsage(String provider, String model, long tokensIn, long tokensOut) {

    public static LlmUsage empty(String provider, String model) {
        return new LlmUsage(provider, model, 0, 0);
    }
}
