package com.phishguard.common.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Signed weight tables used by {@link FeatureExtractor}.
 *
 * <p>Negative weights mark everyday business vocabulary and pull the logit down.
 * Only keywords whose weight is strictly above {@code flagThreshold} are reported
 * as flagged words.
 */
public record FeatureVocabulary(
    Map<String, Double> keywordWeights,
    Map<String, Double> ngramWeights,
    double flagThreshold
) {
    public static final double DEFAULT_FLAG_THRESHOLD = 0.6;

    public FeatureVocabulary {
        keywordWeights = lowerCased(keywordWeights);
        ngramWeights   = lowerCased(ngramWeights);
    }

    public static FeatureVocabulary defaults() {
        return new FeatureVocabulary(defaultKeywords(), defaultNgrams(), DEFAULT_FLAG_THRESHOLD);
    }

    private static Map<String, Double> lowerCased(Map<String, Double> weights) {
        if (weights == null) {
            throw new IllegalArgumentException("Weight table must not be null");
        }
        Map<String, Double> copy = new LinkedHashMap<>();
        weights.forEach((term, weight) -> copy.put(term.toLowerCase(Locale.ROOT), weight));
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, Double> defaultKeywords() {
        Map<String, Double> k = new LinkedHashMap<>();
        // credential and account pressure
        k.put("verify", 0.9);
        k.put("password", 1.0);
        k.put("login", 0.8);
        k.put("credentials", 0.9);
        k.put("ssn", 1.0);
        k.put("account", 0.6);
        k.put("confirm", 0.6);
        k.put("update", 0.4);
        k.put("security", 0.4);
        // urgency and threat
        k.put("urgent", 0.8);
        k.put("immediately", 0.7);
        k.put("suspended", 0.9);
        k.put("locked", 0.8);
        k.put("restricted", 0.8);
        k.put("unauthorized", 0.8);
        k.put("expire", 0.6);
        k.put("expires", 0.6);
        k.put("alert", 0.5);
        k.put("unusual", 0.5);
        // links
        k.put("click", 0.7);
        k.put("link", 0.4);
        // money and rewards
        k.put("bank", 0.5);
        k.put("refund", 0.6);
        k.put("invoice", 0.4);
        k.put("wire", 0.6);
        k.put("bitcoin", 0.8);
        k.put("crypto", 0.7);
        k.put("winner", 0.9);
        k.put("prize", 0.9);
        k.put("lottery", 1.0);
        k.put("congratulations", 0.7);
        k.put("claim", 0.7);
        k.put("free", 0.5);
        k.put("gift", 0.6);
        // tone
        k.put("kindly", 0.6);
        k.put("dear", 0.3);
        k.put("limited", 0.5);
        // benign business vocabulary
        k.put("meeting", -0.6);
        k.put("agenda", -0.5);
        k.put("team", -0.4);
        k.put("thanks", -0.4);
        k.put("thank", -0.3);
        k.put("regards", -0.4);
        k.put("cheers", -0.3);
        k.put("report", -0.5);
        k.put("review", -0.3);
        k.put("project", -0.4);
        k.put("schedule", -0.3);
        k.put("lunch", -0.5);
        k.put("minutes", -0.3);
        k.put("quarterly", -0.3);
        k.put("colleague", -0.3);
        k.put("tomorrow", -0.2);
        return k;
    }

    private static Map<String, Double> defaultNgrams() {
        Map<String, Double> n = new LinkedHashMap<>();
        n.put("verify your", 1.2);
        n.put("confirm your", 0.9);
        n.put("update your", 0.7);
        n.put("your account", 0.8);
        n.put("account will be", 1.1);
        n.put("click here", 1.0);
        n.put("log in", 0.5);
        n.put("act now", 1.0);
        n.put("within 24 hours", 1.0);
        n.put("limited time", 0.7);
        n.put("you have won", 1.4);
        n.put("claim your", 1.0);
        n.put("gift card", 1.1);
        n.put("dear customer", 0.9);
        n.put("social security", 1.2);
        n.put("credit card", 0.8);
        n.put("bit.ly", 1.5);
        n.put("tinyurl", 1.5);
        n.put("goo.gl", 1.5);
        // benign
        n.put("for your review", -0.6);
        n.put("see attached", -0.4);
        n.put("let me know", -0.5);
        n.put("best regards", -0.5);
        n.put("thank you", -0.3);
        n.put("meeting notes", -0.6);
        return n;
    }
}
