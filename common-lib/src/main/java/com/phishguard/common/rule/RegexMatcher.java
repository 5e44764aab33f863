package com.phishguard.common.rule;

import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * {@link Pattern#matcher(CharSequence)}{@code .find()} over the normalized text,
 * or over the original text for case-sensitive patterns built with
 * {@link #onOriginal(String)}.
 */
public final class RegexMatcher implements Matcher {

    private final Pattern pattern;
    private final boolean useOriginal;

    private RegexMatcher(Pattern pattern, boolean useOriginal) {
        this.pattern     = pattern;
        this.useOriginal = useOriginal;
    }

    /** Pattern applied to the lower-cased text; write it in lower case. */
    public static RegexMatcher of(String regex) {
        return new RegexMatcher(Pattern.compile(regex), false);
    }

    /** Case-sensitive pattern applied to the text as submitted. */
    public static RegexMatcher onOriginal(String regex) {
        return new RegexMatcher(Pattern.compile(regex), true);
    }

    /**
     * Run of at least {@code minLength} consecutive upper-case ASCII letters
     * ("URGENT", "ACT NOW" does not count as one run).
     */
    public static RegexMatcher uppercaseRun(int minLength) {
        if (minLength < 2) {
            throw new IllegalArgumentException("Uppercase run length must be at least 2, got " + minLength);
        }
        return onOriginal("[A-Z]{" + minLength + ",}");
    }

    /**
     * Host name ending in one of the given top-level domains, e.g. {@code "secure-login.xyz"}.
     * Entries may be given with or without the leading dot.
     */
    public static RegexMatcher domainSuffix(List<String> topLevelDomains) {
        if (topLevelDomains == null || topLevelDomains.isEmpty()) {
            throw new IllegalArgumentException("Top-level domain list must not be empty");
        }
        StringJoiner alternatives = new StringJoiner("|");
        for (String tld : topLevelDomains) {
            String bare = tld.startsWith(".") ? tld.substring(1) : tld;
            alternatives.add(Pattern.quote(bare.toLowerCase(Locale.ROOT)));
        }
        return of("\\b[a-z0-9-]+\\.(?:" + alternatives + ")(?![a-z0-9-])");
    }

    @Override
    public boolean matches(ScanText text) {
        return pattern.matcher(useOriginal ? text.original() : text.normalized()).find();
    }

    public String pattern() {
        return pattern.pattern();
    }
}
