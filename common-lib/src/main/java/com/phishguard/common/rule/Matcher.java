package com.phishguard.common.rule;

/**
 * Text predicate attached to a {@link Rule}.
 *
 * <p>Variants:
 * <ul>
 *   <li>{@link KeywordSetMatcher}     — whole-token match against a word set</li>
 *   <li>{@link PhraseContainsMatcher} — plain substring containment</li>
 *   <li>{@link RegexMatcher}          — {@link java.util.regex.Pattern} search</li>
 * </ul>
 *
 * <p>Implementations must be immutable and side-effect free; one instance is
 * shared by every concurrent scoring call.
 */
public interface Matcher {

    /**
     * @param text the scanned input; never {@code null}
     * @return {@code true} if the pattern occurs at least once
     */
    boolean matches(ScanText text);
}
