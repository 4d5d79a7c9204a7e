package com.ludora.paymentcore.util;

import com.ludora.paymentcore.config.PaymentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Verifies the provider's HMAC-SHA256 webhook signature.
 *
 * The signature is computed over the raw request body with the provider secret key and
 * sent base64 encoded (hex is accepted too), optionally prefixed with "sha256=".
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSignatureVerifier {

    private static final String PREFIX = "sha256=";

    private final PaymentProperties props;

    public boolean isEnforced() {
        return props.getProvider().isEnforceSignature();
    }

    /**
     * @return true when the signature matches the body
     */
    public boolean verify(String rawBody, String signatureHeader) {
        String secret = props.getProvider().getSecretKey();
        if (secret == null || secret.isBlank()) {
            log.error("[WEBHOOK] Signature check enabled but payments.provider.secret-key is not set");
            return false;
        }
        if (signatureHeader == null || signatureHeader.isBlank() || rawBody == null) {
            return false;
        }

        String received = signatureHeader.trim();
        if (received.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            received = received.substring(PREFIX.length());
        }

        byte[] digest = new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secret).hmac(rawBody);
        String base64 = Base64.encodeBase64String(digest);
        String hex = Hex.encodeHexString(digest);

        return constantTimeEquals(base64, received) || constantTimeEquals(hex, received.toLowerCase());
    }

    /** Helper for tests and the provider sandbox: signs a body the way the provider does. */
    public String sign(String rawBody) {
        byte[] digest = new HmacUtils(HmacAlgorithms.HMAC_SHA_256, props.getProvider().getSecretKey()).hmac(rawBody);
        return Base64.encodeBase64String(digest);
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
