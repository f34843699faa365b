package uk.gegc.comicmaker.features.billing.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 check of webhook bodies. Always pass the request body bytes exactly as received;
 * parsed and re-serialized JSON will not match the sender's digest.
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    public boolean verify(byte[] payload, String signature, String secret) {
        if (payload == null || !StringUtils.hasText(signature) || !StringUtils.hasText(secret)) {
            return false;
        }
        final byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signature.trim().toLowerCase());
        } catch (IllegalArgumentException e) {
            log.warn("Webhook signature is not valid hex");
            return false;
        }
        byte[] expected = hmac(payload, secret);
        return MessageDigest.isEqual(expected, provided);
    }

    public String sign(byte[] payload, String secret) {
        return HexFormat.of().formatHex(hmac(payload, secret));
    }

    private byte[] hmac(byte[] payload, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(payload);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
