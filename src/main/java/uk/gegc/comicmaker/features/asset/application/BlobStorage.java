package uk.gegc.comicmaker.features.asset.application;

import uk.gegc.comicmaker.features.asset.domain.model.SignedUrl;

/**
 * Object storage for rendered pages and compiled PDFs. Failures surface as
 * {@link uk.gegc.comicmaker.features.asset.domain.exception.BlobStorageException}.
 */
public interface BlobStorage {

    void upload(String path, byte[] data, String contentType);

    byte[] download(String path);

    /**
     * Time-limited read link using the configured TTL.
     */
    SignedUrl sign(String path);
}
