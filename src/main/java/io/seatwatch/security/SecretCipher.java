package io.seatwatch.security;

import io.seatwatch.config.ConfigException;
import io.seatwatch.config.SeatWatchConfig;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

public final class SecretCipher {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    public static final int KEY_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final SecretKeySpec key;

    public SecretCipher(byte[] rawKey) {
        if (rawKey == null || rawKey.length != KEY_BYTES) {
            throw new ConfigException("Encryption key must be " + KEY_BYTES + " bytes (256 bits)");
        }
        this.key = new SecretKeySpec(rawKey.clone(), "AES");
    }

    public static byte[] generateKey() {
        byte[] raw = new byte[KEY_BYTES];
        RANDOM.nextBytes(raw);
        return raw;
    }

    public static String generateKeyBase64() {
        return Base64.getEncoder().encodeToString(generateKey());
    }

    public static SecretCipher fromBase64(String encodedKey) {
        if (encodedKey == null || encodedKey.isBlank()) {
            throw new ConfigException("Encryption key is not set");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encodedKey.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to decode encryption key", e);
        }
        return new SecretCipher(raw);
    }

    public static SecretCipher fromConfig(SeatWatchConfig config) {
        String fromEnv = System.getenv(SeatWatchConfig.ENCRYPTION_KEY_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromBase64(fromEnv);
        }
        Path keyFile = config.encryptionKeyFile();
        if (!Files.exists(keyFile)) {
            throw new ConfigException(SeatWatchConfig.ENCRYPTION_KEY_ENV
                    + " is not set and no key file exists at " + keyFile);
        }
        try {
            return fromBase64(Files.readString(keyFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigException("Failed to read encryption key file: " + keyFile, e);
        }
    }

    public SealedSecret encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext is required");
        }
        byte[] iv = new byte[GCM_IV_BYTES];
        RANDOM.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] cipherText = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return new SealedSecret(
                    Base64.getEncoder().encodeToString(cipherText),
                    Base64.getEncoder().encodeToString(iv)
            );
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt secret", e);
        }
    }

    public String decrypt(SealedSecret sealed) {
        byte[] cipherText;
        byte[] iv;
        try {
            cipherText = Base64.getDecoder().decode(sealed.ciphertext());
            iv = Base64.getDecoder().decode(sealed.nonce());
        } catch (IllegalArgumentException e) {
            throw new SecretAuthenticationException("Sealed secret is not valid base64", e);
        }
        if (iv.length != GCM_IV_BYTES) {
            throw new SecretAuthenticationException(
                    "Nonce must be " + GCM_IV_BYTES + " bytes, got " + iv.length, null);
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] plain = cipher.doFinal(cipherText);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new SecretAuthenticationException("Failed to decrypt secret", e);
        }
    }
}
