package uk.gegc.comicmaker.features.comic.application;

import uk.gegc.comicmaker.features.comic.domain.model.ImageResolution;

public interface ImageGenerationClient {

    /**
     * Generates one panel image.
     *
     * @param seed per-page seed; providers that cannot honour it may ignore it
     * @return encoded PNG bytes
     * @throws uk.gegc.comicmaker.features.comic.domain.exception.ImageProviderException on provider
     *         failure; {@code isTransient()} tells whether the job may be retried
     */
    byte[] generate(String prompt, ImageResolution resolution, long seed);
}
