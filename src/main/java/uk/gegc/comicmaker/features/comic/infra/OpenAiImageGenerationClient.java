package uk.gegc.comicmaker.features.comic.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.image.ImageModel;
import org.springframework.ai.image.ImagePrompt;
import org.springframework.ai.image.ImageResponse;
import org.springframework.ai.openai.OpenAiImageOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.comic.application.ImageGenerationClient;
import uk.gegc.comicmaker.features.comic.config.ImageGenerationProperties;
import uk.gegc.comicmaker.features.comic.domain.exception.ImageProviderException;
import uk.gegc.comicmaker.features.comic.domain.model.ImageResolution;
import uk.gegc.comicmaker.shared.config.RetryProperties;
import uk.gegc.comicmaker.shared.util.Backoff;
import uk.gegc.comicmaker.shared.util.TransientFailures;

import java.util.Base64;

/**
 * Panel generation through Spring AI's OpenAI image model. Timeouts and connection failures are
 * retried with exponential backoff; anything else fails the call immediately.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "comicmaker.image", name = "provider", havingValue = "openai")
public class OpenAiImageGenerationClient implements ImageGenerationClient {

    private static final String RESPONSE_FORMAT = "b64_json";

    private final ImageModel imageModel;
    private final ImageGenerationProperties properties;
    private final RetryProperties retryProperties;

    @Override
    public byte[] generate(String prompt, ImageResolution resolution, long seed) {
        RetryProperties.Policy policy = retryProperties.getProvider();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call(prompt, resolution);
            } catch (ImageProviderException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!TransientFailures.isTransient(e)) {
                    log.error("Image provider rejected request: {}", e.getMessage());
                    throw new ImageProviderException("Image provider error: " + e.getMessage(), false, e);
                }
                if (attempt >= policy.getMaxAttempts()) {
                    log.error("Image provider unreachable after {} attempts", attempt);
                    throw new ImageProviderException("Image provider unavailable after " + attempt + " attempts", true, e);
                }
                long delay = Backoff.delayMs(policy, attempt - 1);
                log.warn("Image generation attempt {} failed ({}); retrying in {} ms", attempt, e.getMessage(), delay);
                sleepFor(delay);
            }
        }
    }

    private byte[] call(String prompt, ImageResolution resolution) {
        String model = resolution == ImageResolution.LOW ? properties.getLowResolutionModel() : properties.getModel();
        OpenAiImageOptions options = OpenAiImageOptions.builder()
                .model(model)
                .N(1)
                .width(resolution.getWidth())
                .height(resolution.getHeight())
                .responseFormat(RESPONSE_FORMAT)
                .build();

        ImageResponse response = imageModel.call(new ImagePrompt(prompt, options));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ImageProviderException("No image returned by provider");
        }
        String b64 = response.getResult().getOutput().getB64Json();
        if (b64 == null || b64.isBlank()) {
            throw new ImageProviderException("Image provider returned an empty payload");
        }
        try {
            return Base64.getDecoder().decode(b64);
        } catch (IllegalArgumentException e) {
            throw new ImageProviderException("Image provider returned malformed base64", false, e);
        }
    }

    protected void sleepFor(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageProviderException("Interrupted while waiting to retry image generation", false, e);
        }
    }
}
