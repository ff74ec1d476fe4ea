package io.seatwatch.security;

public record SealedSecret(String ciphertext, String nonce) {
    public SealedSecret {
        if (ciphertext == null || ciphertext.isBlank() || nonce == null || nonce.isBlank()) {
            throw new IllegalArgumentException("ciphertext and nonce are required");
        }
    }
}
