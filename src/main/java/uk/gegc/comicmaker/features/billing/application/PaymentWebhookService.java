package uk.gegc.comicmaker.features.billing.application;

public interface PaymentWebhookService {

    enum Result {
        OK,
        DUPLICATE,
        IGNORED
    }

    /**
     * Verifies and applies one gateway webhook delivery.
     *
     * @param rawBody       request body exactly as received
     * @param signature     hex HMAC-SHA256 from the signature header
     * @param eventIdHeader gateway event id header, may be {@code null}
     * @throws uk.gegc.comicmaker.features.billing.domain.exception.InvalidWebhookSignatureException
     *         if the signature is missing or does not match
     */
    Result process(byte[] rawBody, String signature, String eventIdHeader);
}
