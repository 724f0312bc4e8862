package com.example.promptstudio.crypto;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-GCM encryption of provider API keys. The AES key is the SHA-256 of {@code studio.provider-keys.secret};
 * the stored form is Base64 of {@code iv || ciphertext+tag}.
 */
@Component
public class ProviderKeyCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public ProviderKeyCipher(@Value("${studio.provider-keys.secret}") String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("studio.provider-keys.secret must be configured");
        }
        this.key = new SecretKeySpec(ApiTokenHasher.sha256(secret.getBytes(StandardCharsets.UTF_8)), "AES");
    }

    public String encrypt(String plaintext) {
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(ByteBuffer.allocate(iv.length + sealed.length).put(iv).put(sealed).array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt provider key", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the value was not produced with the configured secret
     */
    public String decrypt(String encrypted) {
        byte[] all = Base64.getDecoder().decode(encrypted);
        if (all.length <= IV_LENGTH) {
            throw new IllegalArgumentException("Encrypted provider key is truncated");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, all, 0, IV_LENGTH));
            byte[] plain = cipher.doFinal(all, IV_LENGTH, all.length - IV_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (javax.crypto.AEADBadTagException e) {
            throw new IllegalArgumentException("Provider key cannot be decrypted with the configured secret", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to decrypt provider key", e);
        }
    }
}
