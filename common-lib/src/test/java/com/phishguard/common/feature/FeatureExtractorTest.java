package com.phishguard.common.feature;

import com.phishguard.common.model.Features;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractorTest {

    private static final double EPS = 1e-9;

    private final FeatureExtractor extractor = new FeatureExtractor(FeatureVocabulary.defaults());

    // ── keywords ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("keywordScore / flaggedWords")
    class KeywordTests {

        @Test
        @DisplayName("'verify' repeated three times contributes 0.9 once")
        void repeatedKeywordCountsOnce() {
            Features features = extractor.extract("verify verify verify");
            assertEquals(0.9, features.keywordScore(), EPS);
            assertEquals(List.of("verify"), features.flaggedWords());
        }

        @Test
        @DisplayName("punctuation is stripped before deduplication")
        void punctuationStripped() {
            Features features = extractor.extract("Verify, verify! VERIFY?");
            assertEquals(0.9, features.keywordScore(), EPS);
        }

        @Test
        @DisplayName("negative business vocabulary lowers the score")
        void negativeWeights() {
            Features features = extractor.extract("team meeting");
            assertEquals(-1.0, features.keywordScore(), EPS);
            assertTrue(features.flaggedWords().isEmpty());
        }

        @Test
        @DisplayName("weight exactly at the 0.6 threshold is not flagged")
        void thresholdIsStrict() {
            Features features = extractor.extract("account");
            assertEquals(0.6, features.keywordScore(), EPS);
            assertTrue(features.flaggedWords().isEmpty());
        }

        @Test
        @DisplayName("flagged words keep first-occurrence order")
        void flaggedOrder() {
            Features features = extractor.extract("click now, your password is locked. click again");
            assertEquals(List.of("click", "password", "locked"), features.flaggedWords());
        }
    }

    // ── n-grams ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ngramScore / flaggedNgrams")
    class NgramTests {

        @Test
        @DisplayName("phrase counted once however often it occurs")
        void phraseCountedOnce() {
            Features features = extractor.extract("please verify your details, verify your email");
            assertEquals(1.2, features.ngramScore(), EPS);
            assertEquals(List.of("verify your"), features.flaggedNgrams());
        }

        @Test
        @DisplayName("phrases match on the untokenized text, including dots")
        void dottedPhrase() {
            Features features = extractor.extract("go to http://bit.ly/abc");
            assertTrue(features.flaggedNgrams().contains("bit.ly"));
        }

        @Test
        @DisplayName("flaggedNgrams follow table order")
        void tableOrder() {
            FeatureVocabulary vocabulary = new FeatureVocabulary(
                Map.of(), orderedNgrams(), FeatureVocabulary.DEFAULT_FLAG_THRESHOLD);
            Features features = new FeatureExtractor(vocabulary).extract("zeta then alpha");
            assertEquals(List.of("alpha", "zeta"), features.flaggedNgrams());
            assertEquals(3.0, features.ngramScore(), EPS);
        }

        private Map<String, Double> orderedNgrams() {
            Map<String, Double> ngrams = new java.util.LinkedHashMap<>();
            ngrams.put("alpha", 1.0);
            ngrams.put("zeta", 2.0);
            return ngrams;
        }
    }

    // ── ratios ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("character ratios")
    class RatioTests {

        @Test
        @DisplayName("empty text → all ratios 0, no NaN")
        void emptyText() {
            Features features = extractor.extract("");
            assertEquals(0.0, features.uppercaseRatio());
            assertEquals(0.0, features.symbolRatio());
            assertEquals(0.0, features.digitRatio());
            assertEquals(Features.empty(), features);
        }

        @Test
        @DisplayName("ratios count the original text over its full length")
        void ratios() {
            Features features = extractor.extract("ABC123!!");
            assertEquals(3.0 / 8, features.uppercaseRatio(), EPS);
            assertEquals(3.0 / 8, features.digitRatio(), EPS);
            assertEquals(2.0 / 8, features.symbolRatio(), EPS);
        }

        @Test
        @DisplayName("ratios stay within [0, 1]")
        void bounded() {
            Features features = extractor.extract("$$$$");
            assertEquals(1.0, features.symbolRatio(), EPS);
            assertEquals(0.0, features.uppercaseRatio(), EPS);
        }
    }

    @Test
    @DisplayName("tokenize() dedupes and keeps first-occurrence order")
    void tokenize() {
        assertEquals(List.of("b", "a", "c"), List.copyOf(FeatureExtractor.tokenize("b a. b, c a")));
    }
}
