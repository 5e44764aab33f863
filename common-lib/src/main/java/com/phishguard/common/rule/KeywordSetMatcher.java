package com.phishguard.common.rule;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Matches when any whole word of the normalized text is in the keyword set.
 * "pin" matches "your pin" but not "spinning".
 */
public final class KeywordSetMatcher implements Matcher {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final Set<String> keywords;

    public KeywordSetMatcher(List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("Keyword set must not be empty");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String keyword : keywords) {
            normalized.add(keyword.toLowerCase(Locale.ROOT));
        }
        this.keywords = Set.copyOf(normalized);
    }

    public static KeywordSetMatcher of(String... keywords) {
        return new KeywordSetMatcher(List.of(keywords));
    }

    @Override
    public boolean matches(ScanText text) {
        for (String word : WORD_SEPARATOR.split(text.normalized())) {
            if (!word.isEmpty() && keywords.contains(word)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> keywords() {
        return keywords;
    }
}
