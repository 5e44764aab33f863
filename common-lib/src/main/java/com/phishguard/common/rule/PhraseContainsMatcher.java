package com.phishguard.common.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Matches when the normalized text contains any of the phrases as a substring.
 */
public final class PhraseContainsMatcher implements Matcher {

    private final List<String> phrases;

    public PhraseContainsMatcher(List<String> phrases) {
        if (phrases == null || phrases.isEmpty()) {
            throw new IllegalArgumentException("Phrase list must not be empty");
        }
        List<String> normalized = new ArrayList<>(phrases.size());
        for (String phrase : phrases) {
            normalized.add(phrase.toLowerCase(Locale.ROOT));
        }
        this.phrases = List.copyOf(normalized);
    }

    public static PhraseContainsMatcher of(String... phrases) {
        return new PhraseContainsMatcher(List.of(phrases));
    }

    @Override
    public boolean matches(ScanText text) {
        String normalized = text.normalized();
        for (String phrase : phrases) {
            if (normalized.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    public List<String> phrases() {
        return phrases;
    }
}
