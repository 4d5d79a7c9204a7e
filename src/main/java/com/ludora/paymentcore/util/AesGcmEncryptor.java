package com.ludora.paymentcore.util;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-GCM encryption of provider customer tokens at rest.
 *
 * The data encryption key comes from configuration (base64, 256 bit) together with its
 * key id, which is stored next to each ciphertext for rotation.
 */
@Component
public class AesGcmEncryptor {

    private static final int IV_LENGTH = 12;   // Recommended length for GCM
    private static final int TAG_LENGTH = 16;
    private static final SecureRandom RND = new SecureRandom();

    private final SecretKeySpec key;
    private final String keyId;

    public AesGcmEncryptor(@Value("${app.crypto.token-key}") String base64Key,
                           @Value("${app.crypto.token-key-id:v1}") String keyId) {
        byte[] raw = Base64.getDecoder().decode(base64Key);
        if (raw.length != 32) {
            throw new IllegalStateException("app.crypto.token-key must be a base64 encoded 256-bit key");
        }
        this.key = new SecretKeySpec(raw, "AES");
        this.keyId = keyId;
    }

    public static class Result {
        public final byte[] ciphertext; // encrypted data (without tag)
        public final byte[] iv;         // 12-byte random IV
        public final byte[] tag;        // 16-byte authentication tag
        public final String dekKid;     // Key ID of the DEK

        public Result(byte[] c, byte[] i, byte[] t, String kid) {
            this.ciphertext = c;
            this.iv = i;
            this.tag = t;
            this.dekKid = kid;
        }
    }

    /**
     * Encrypts a provider token.
     *
     * @param plaintext the token value
     * @param aad additional authenticated data (e.g., userId + providerCustomerUid)
     * @return AES-GCM ciphertext + IV + tag + DEK key ID
     */
    public Result encrypt(String plaintext, byte[] aad) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            RND.nextBytes(iv);

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));

            if (aad != null && aad.length > 0) {
                cipher.updateAAD(aad);
            }

            byte[] out = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            byte[] ct = Arrays.copyOf(out, out.length - TAG_LENGTH);
            byte[] tag = Arrays.copyOfRange(out, out.length - TAG_LENGTH, out.length);

            return new Result(ct, iv, tag, keyId);
        } catch (Exception e) {
            throw new IllegalStateException("AES-GCM encrypt failed", e);
        }
    }

    /**
     * Decrypts a stored token for a recurring charge. The same AAD used at encryption is required.
     */
    public String decrypt(byte[] ciphertext, byte[] iv, byte[] tag, byte[] aad) {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));

            if (aad != null && aad.length > 0) {
                cipher.updateAAD(aad);
            }

            byte[] combined = new byte[ciphertext.length + tag.length];
            System.arraycopy(ciphertext, 0, combined, 0, ciphertext.length);
            System.arraycopy(tag, 0, combined, ciphertext.length, tag.length);

            return new String(cipher.doFinal(combined), StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("AES-GCM decrypt failed", e);
        }
    }
}
