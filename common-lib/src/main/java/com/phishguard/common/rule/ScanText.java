package com.phishguard.common.rule;

import java.util.Locale;

/**
 * Input text in both forms a {@link Matcher} may need: the original as submitted
 * and its lower-cased normalization. Almost every matcher reads only
 * {@link #normalized()}.
 */
public record ScanText(String original, String normalized) {

    public ScanText {
        original   = original == null ? "" : original;
        normalized = normalized == null ? normalize(original) : normalized;
    }

    public static ScanText of(String text) {
        String original = text == null ? "" : text;
        return new ScanText(original, normalize(original));
    }

    public static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    public boolean isEmpty() {
        return original.isEmpty();
    }

    /** {@code true} when at least one letter or digit is present. */
    public boolean hasAlphanumeric() {
        for (int i = 0; i < original.length(); i++) {
            if (Character.isLetterOrDigit(original.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
