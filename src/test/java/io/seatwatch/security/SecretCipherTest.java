package io.seatwatch.security;

import io.seatwatch.config.ConfigException;
import io.seatwatch.config.SeatWatchConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

final class SecretCipherTest {

    @Test
    void encryptDecryptRoundTripUsesFreshNonce() {
        SecretCipher cipher = new SecretCipher(SecretCipher.generateKey());

        SealedSecret first = cipher.encrypt("jlinksessionid=abc; other=1");
        SealedSecret second = cipher.encrypt("jlinksessionid=abc; other=1");

        Assertions.assertEquals("jlinksessionid=abc; other=1", cipher.decrypt(first));
        Assertions.assertNotEquals(first.nonce(), second.nonce());
        Assertions.assertNotEquals(first.ciphertext(), second.ciphertext());
        Assertions.assertEquals(12, Base64.getDecoder().decode(first.nonce()).length);
    }

    @Test
    void emptyPlaintextRoundTrips() {
        SecretCipher cipher = new SecretCipher(SecretCipher.generateKey());

        Assertions.assertEquals("", cipher.decrypt(cipher.encrypt("")));
    }

    @Test
    void wrongKeyFailsAuthentication() {
        SealedSecret sealed = new SecretCipher(SecretCipher.generateKey()).encrypt("secret");
        SecretCipher other = new SecretCipher(SecretCipher.generateKey());

        Assertions.assertThrows(SecretAuthenticationException.class, () -> other.decrypt(sealed));
    }

    @Test
    void tamperedCiphertextFailsAuthentication() {
        SecretCipher cipher = new SecretCipher(SecretCipher.generateKey());
        SealedSecret sealed = cipher.encrypt("secret");
        byte[] raw = Base64.getDecoder().decode(sealed.ciphertext());
        raw[0] ^= 0x01;
        SealedSecret tampered = new SealedSecret(Base64.getEncoder().encodeToString(raw), sealed.nonce());

        Assertions.assertThrows(SecretAuthenticationException.class, () -> cipher.decrypt(tampered));
    }

    @Test
    void mismatchedNonceFailsAuthentication() {
        SecretCipher cipher = new SecretCipher(SecretCipher.generateKey());
        SealedSecret a = cipher.encrypt("first");
        SealedSecret b = cipher.encrypt("second");

        Assertions.assertThrows(SecretAuthenticationException.class,
                () -> cipher.decrypt(new SealedSecret(a.ciphertext(), b.nonce())));
        Assertions.assertThrows(SecretAuthenticationException.class,
                () -> cipher.decrypt(new SealedSecret("not base64!!", a.nonce())));
        Assertions.assertThrows(SecretAuthenticationException.class,
                () -> cipher.decrypt(new SealedSecret(a.ciphertext(), "c2hvcnQ=")));
    }

    @Test
    void keyMustBeExactly32Bytes() {
        Assertions.assertThrows(ConfigException.class, () -> new SecretCipher(new byte[16]));
        Assertions.assertThrows(ConfigException.class,
                () -> SecretCipher.fromBase64(Base64.getEncoder().encodeToString(new byte[31])));
        Assertions.assertThrows(ConfigException.class, () -> SecretCipher.fromBase64("%%%"));
        Assertions.assertThrows(ConfigException.class, () -> SecretCipher.fromBase64(" "));
        Assertions.assertNotNull(SecretCipher.fromBase64(SecretCipher.generateKeyBase64()));
    }

    @Test
    void keyFileIsUsedWhenEnvironmentIsUnset() throws Exception {
        Assumptions.assumeTrue(System.getenv(SeatWatchConfig.ENCRYPTION_KEY_ENV) == null);
        Path root = Files.createTempDirectory("seatwatch-test-key-");
        try {
            SeatWatchConfig config = SeatWatchConfig.fromRoot(root.toString());
            Assertions.assertThrows(ConfigException.class, () -> SecretCipher.fromConfig(config));

            String key = SecretCipher.generateKeyBase64();
            Files.createDirectories(config.securityRoot());
            Files.writeString(config.encryptionKeyFile(), key + "\n", StandardCharsets.UTF_8);
            SealedSecret sealed = SecretCipher.fromConfig(config).encrypt("value");

            Assertions.assertEquals("value", SecretCipher.fromBase64(key).decrypt(sealed));
        } finally {
            Files.deleteIfExists(root.resolve("security").resolve("encryption.key"));
            Files.deleteIfExists(root.resolve("security"));
            Files.deleteIfExists(root);
        }
    }
}
