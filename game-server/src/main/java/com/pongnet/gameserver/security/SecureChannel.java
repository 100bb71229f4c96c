package com.pongnet.gameserver.security;

import org.springframework.security.crypto.encrypt.BytesEncryptor;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Seals player traffic into single-line envelopes: URL-safe Base64 of the encryptor output
 * ({@code iv || ciphertext || tag} for the AES-GCM encryptor wired in production).
 */
public class SecureChannel {
    private final BytesEncryptor encryptor;

    public SecureChannel(BytesEncryptor encryptor) {
        this.encryptor = encryptor;
    }

    public String encode(String plaintext) {
        byte[] sealed = encryptor.encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
        return Base64.getUrlEncoder().withoutPadding().encodeToString(sealed);
    }

    public String decode(String envelope) {
        if (envelope == null || envelope.isBlank()) {
            throw new CryptoException("Empty envelope", null);
        }
        try {
            byte[] sealed = Base64.getUrlDecoder().decode(envelope.trim());
            return new String(encryptor.decrypt(sealed), StandardCharsets.UTF_8);
        } catch (RuntimeException e) {
            // bad Base64, short input and tag mismatch all surface as runtime exceptions
            throw new CryptoException("Unable to open envelope", e);
        }
    }
}
