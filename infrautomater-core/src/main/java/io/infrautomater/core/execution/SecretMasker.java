package io.infrautomater.core.execution;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Collects the secret values seen during one provisioning attempt and scrubs
/// them from any text leaving the attempt (notes, log lines, returned output).
///
/// Generated secrets and consumed credentials are registered as they appear;
/// {@link #mask(String)} replaces every occurrence with {@value #MASK}.
///
/// @implNote Thread-safe.
public final class SecretMasker {

    public static final String MASK = "********";

    private static final int MIN_SECRET_LENGTH = 4;

    private final Set<String> secrets = ConcurrentHashMap.newKeySet();

    /// Registers a secret value.
    ///
    /// Values shorter than four characters are ignored; masking them would
    /// mangle ordinary text.
    ///
    /// @param secret the value to hide, may be null
    public void register(String secret) {
        if (secret != null && secret.length() >= MIN_SECRET_LENGTH) {
            secrets.add(secret);
        }
    }

    /// Replaces every registered secret in `text`.
    ///
    /// @param text text to scrub, may be null
    /// @return scrubbed text, or null if `text` is null
    public String mask(String text) {
        if (text == null || secrets.isEmpty()) {
            return text;
        }
        // longest first so a secret containing another is replaced whole
        List<String> ordered =
                secrets.stream().sorted(Comparator.comparingInt(String::length).reversed()).toList();
        String result = text;
        for (String secret : ordered) {
            result = result.replace(secret, MASK);
        }
        return result;
    }

    public int size() {
        return secrets.size();
    }
}
