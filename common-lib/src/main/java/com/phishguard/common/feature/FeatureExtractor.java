package com.phishguard.common.feature;

import com.phishguard.common.model.Features;
import com.phishguard.common.rule.ScanText;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Computes the lexical and structural {@link Features} of a text.
 *
 * <ul>
 *   <li><b>keywordScore</b> — tokens are deduplicated first, so a keyword repeated
 *       many times counts once.</li>
 *   <li><b>ngramScore</b>   — each phrase contributes its weight once if it occurs
 *       anywhere in the normalized text.</li>
 *   <li><b>ratios</b>       — counted on the original text over its full length;
 *       0 for empty text.</li>
 * </ul>
 */
public final class FeatureExtractor {

    /** Punctuation replaced by whitespace before tokenizing. */
    private static final Pattern TOKEN_PUNCTUATION = Pattern.compile("[.,!?;:\"']");
    private static final Pattern WHITESPACE        = Pattern.compile("\\s+");

    /** Characters counted by {@code symbolRatio}. */
    static final String SYMBOLS = "!@#$%^&*()_+-=[]{};:'\",.<>/?\\|~`";

    private final FeatureVocabulary vocabulary;

    public FeatureExtractor(FeatureVocabulary vocabulary) {
        if (vocabulary == null) {
            throw new IllegalArgumentException("Vocabulary must not be null");
        }
        this.vocabulary = vocabulary;
    }

    public Features extract(String text) {
        if (text == null || text.isEmpty()) {
            return Features.empty();
        }

        String normalized = ScanText.normalize(text);

        double keywordScore = 0.0;
        List<String> flaggedWords = new ArrayList<>();
        for (String token : tokenize(normalized)) {
            Double weight = vocabulary.keywordWeights().get(token);
            if (weight == null) continue;
            keywordScore += weight;
            if (weight > vocabulary.flagThreshold()) {
                flaggedWords.add(token);
            }
        }

        double ngramScore = 0.0;
        List<String> flaggedNgrams = new ArrayList<>();
        for (Map.Entry<String, Double> ngram : vocabulary.ngramWeights().entrySet()) {
            if (normalized.contains(ngram.getKey())) {
                ngramScore += ngram.getValue();
                flaggedNgrams.add(ngram.getKey());
            }
        }

        int uppercase = 0;
        int symbols   = 0;
        int digits    = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isUpperCase(c))     uppercase++;
            if (SYMBOLS.indexOf(c) >= 0)      symbols++;
            if (Character.isDigit(c))         digits++;
        }
        double length = text.length();

        return new Features(keywordScore, ngramScore,
            uppercase / length, symbols / length, digits / length,
            flaggedWords, flaggedNgrams);
    }

    /**
     * Distinct tokens of an already normalized text, in first-occurrence order.
     */
    static Set<String> tokenize(String normalized) {
        String spaced = TOKEN_PUNCTUATION.matcher(normalized).replaceAll(" ");
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(spaced)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
