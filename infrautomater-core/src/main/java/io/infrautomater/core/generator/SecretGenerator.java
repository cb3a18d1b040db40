package io.infrautomater.core.generator;

import java.security.SecureRandom;

/// Produces random secrets from a fixed alphanumeric alphabet.
///
/// Letters and digits only, so the value survives any quoting layer and any
/// provider's password rules without escaping.
public class SecretGenerator {

    static final String ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    public static final int DEFAULT_LENGTH = 24;

    private final SecureRandom random;
    private final int length;

    public SecretGenerator() {
        this(new SecureRandom(), DEFAULT_LENGTH);
    }

    public SecretGenerator(SecureRandom random, int length) {
        if (length < 16) {
            throw new IllegalArgumentException("secret length must be at least 16");
        }
        this.random = random;
        this.length = length;
    }

    public String generate() {
        StringBuilder secret = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            secret.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return secret.toString();
    }
}
