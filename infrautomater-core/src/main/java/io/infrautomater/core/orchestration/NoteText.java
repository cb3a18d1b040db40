package io.infrautomater.core.orchestration;

import io.infrautomater.core.execution.SecretMasker;

/// Formats text bound for request notes: secrets masked, length capped.
final class NoteText {

    static final int MAX_LENGTH = 4000;
    static final String TRUNCATION_MARKER = "\n... [truncated]";

    private NoteText() {}

    static String of(String prefix, String body, SecretMasker masker) {
        return truncate(masker.mask(prefix + body));
    }

    static String truncate(String text) {
        if (text.length() <= MAX_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_LENGTH - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
    }
}
