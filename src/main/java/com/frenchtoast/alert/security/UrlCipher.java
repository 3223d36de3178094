package com.frenchtoast.alert.security;

import com.frenchtoast.alert.core.error.UrlCipherException;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encrypts subscriber delivery URLs for storage using AES-256-GCM.
 *
 * <p>Stored format: Base64( IV (12 bytes) + ciphertext + auth tag (16 bytes) ). A fresh IV is
 * drawn per encryption, so the same URL never produces the same ciphertext twice.</p>
 *
 * <p>The key is process-wide configuration ({@code frenchtoast.token-key}), a Base64 encoded
 * 32 byte value. Generate with: {@code openssl rand -base64 32}</p>
 */
public final class UrlCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKey secretKey;

    private UrlCipher(SecretKey secretKey) {
        this.secretKey = secretKey;
    }

    public static UrlCipher fromBase64Key(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new UrlCipherException(
                    "frenchtoast.token-key is not set. Generate with: openssl rand -base64 32");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(base64Key.trim());
        } catch (IllegalArgumentException e) {
            throw new UrlCipherException("frenchtoast.token-key must be valid Base64", e);
        }
        if (keyBytes.length != 32) {
            throw new UrlCipherException(
                    "frenchtoast.token-key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
        }
        return new UrlCipher(new SecretKeySpec(keyBytes, "AES"));
    }

    public String encrypt(String url) {
        if (url == null) {
            throw new UrlCipherException("Cannot encrypt a null url");
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] encrypted = cipher.doFinal(url.getBytes(StandardCharsets.UTF_8));

            ByteBuffer buffer = ByteBuffer.allocate(iv.length + encrypted.length);
            buffer.put(iv);
            buffer.put(encrypted);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (Exception e) {
            throw new UrlCipherException("Failed to encrypt delivery url", e);
        }
    }

    public String decrypt(String stored) {
        if (stored == null || stored.isBlank()) {
            throw new UrlCipherException("No encrypted url stored");
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(Base64.getDecoder().decode(stored));
            if (buffer.remaining() < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
                throw new UrlCipherException("Encrypted url is too short");
            }
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] encrypted = new byte[buffer.remaining()];
            buffer.get(encrypted);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (UrlCipherException e) {
            throw e;
        } catch (Exception e) {
            throw new UrlCipherException("Failed to decrypt delivery url", e);
        }
    }
}
