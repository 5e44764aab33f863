package com.phishguard.common.explain;

import com.phishguard.common.heuristic.HeuristicResult;
import com.phishguard.common.ml.ModelResult;
import com.phishguard.common.model.Features;
import com.phishguard.common.model.MatchEvidence;
import com.phishguard.common.model.RiskCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExplanationGeneratorTest {

    private final ExplanationGenerator generator = new ExplanationGenerator();

    private static HeuristicResult heuristic(MatchEvidence... evidence) {
        LinkedHashSet<RiskCategory> categories = new LinkedHashSet<>();
        for (MatchEvidence e : evidence) categories.add(e.category());
        return new HeuristicResult(0.0, 0, List.of(evidence), categories, List.of());
    }

    private static ModelResult model(double score, Features features) {
        return new ModelResult(score, score / 100.0, features);
    }

    private static Features flags(List<String> words, List<String> ngrams, double upper, double symbol) {
        return new Features(0, 0, upper, symbol, 0, words, ngrams);
    }

    // ── short-circuit ─────────────────────────────────────────────────────

    @Test
    @DisplayName("score below 5 → fixed low-risk message even with evidence")
    void lowScoreShortCircuit() {
        HeuristicResult h = heuristic(new MatchEvidence("g", RiskCategory.BAD_GRAMMAR, "typo"));
        assertEquals(ExplanationGenerator.LOW_RISK_MESSAGE,
            generator.generate(4, h, model(3.0, Features.empty())));
    }

    @Test
    @DisplayName("score 5 is explained in full")
    void fiveIsExplained() {
        String text = generator.generate(5, heuristic(), model(3.0, Features.empty()));
        assertTrue(text.startsWith("Overall Assessment: Low Risk (score 5/100)"));
    }

    // ── header and recommendation tiers ───────────────────────────────────

    @Nested
    @DisplayName("tiers")
    class TierTests {

        @Test
        @DisplayName("61 → High Risk header and do-not-click recommendation")
        void high() {
            String text = generator.generate(61, heuristic(), model(0, Features.empty()));
            assertTrue(text.startsWith("Overall Assessment: High Risk (score 61/100)"));
            assertTrue(text.contains("Do NOT click any links"));
        }

        @Test
        @DisplayName("60 and 31 → Medium Risk with caution recommendation")
        void medium() {
            for (int score : new int[] {60, 31}) {
                String text = generator.generate(score, heuristic(), model(0, Features.empty()));
                assertTrue(text.startsWith("Overall Assessment: Medium Risk"), "score " + score);
                assertTrue(text.contains("Proceed with caution"), "score " + score);
            }
        }

        @Test
        @DisplayName("30 → Low Risk with mild caution")
        void low() {
            String text = generator.generate(30, heuristic(), model(0, Features.empty()));
            assertTrue(text.startsWith("Overall Assessment: Low Risk (score 30/100)"));
            assertTrue(text.contains("stay alert"));
        }
    }

    // ── indicators ────────────────────────────────────────────────────────

    @Test
    @DisplayName("reasons are grouped by category in first-encounter order")
    void groupedByCategory() {
        HeuristicResult h = heuristic(
            new MatchEvidence("u1", RiskCategory.URGENCY, "Rushes you."),
            new MatchEvidence("l1", RiskCategory.SUSPICIOUS_LINKS, "Short link."),
            new MatchEvidence("u2", RiskCategory.URGENCY, "Deadline."));

        String text = generator.generate(70, h, model(0, Features.empty()));

        assertTrue(text.contains("- Urgency: Rushes you. Deadline."));
        assertTrue(text.contains("- Suspicious Links: Short link."));
        assertTrue(text.indexOf("- Urgency") < text.indexOf("- Suspicious Links"));
    }

    @Test
    @DisplayName("no evidence → explicit no-indicator line")
    void noEvidence() {
        String text = generator.generate(40, heuristic(), model(80, Features.empty()));
        assertTrue(text.contains("No rule-based indicators matched."));
    }

    @Test
    @DisplayName("low tier without evidence does not claim indicators were found")
    void lowTierWithoutEvidence() {
        String text = generator.generate(6, heuristic(), model(11.9, Features.empty()));

        assertTrue(text.startsWith("Overall Assessment: Low Risk (score 6/100). No strong phishing signals were detected."));
        assertTrue(text.contains("No rule-based indicators matched."));
        assertFalse(text.contains("indicators were found"));
    }

    // ── linguistic cues ───────────────────────────────────────────────────

    @Nested
    @DisplayName("linguistic cues")
    class LinguisticCueTests {

        @Test
        @DisplayName("omitted when nothing is flagged and model score ≤ 20")
        void omitted() {
            String text = generator.generate(40, heuristic(), model(20.0, Features.empty()));
            assertFalse(text.contains("Linguistic Cues"));
        }

        @Test
        @DisplayName("shown when model score > 20 even without flags")
        void shownForModelScore() {
            String text = generator.generate(40, heuristic(), model(20.5, Features.empty()));
            assertTrue(text.contains("Linguistic Cues"));
            assertTrue(text.contains("rates this content at 21% phishing likelihood"));
        }

        @Test
        @DisplayName("at most 3 phrases and 4 keywords are listed")
        void truncation() {
            Features f = flags(
                List.of("w1", "w2", "w3", "w4", "w5", "w6"),
                List.of("p1", "p2", "p3", "p4", "p5"), 0, 0);
            String text = generator.generate(70, heuristic(), model(90, f));

            assertTrue(text.contains("Suspicious phrases: \"p1\", \"p2\", \"p3\""));
            assertFalse(text.contains("\"p4\""));
            assertTrue(text.contains("Flagged keywords: \"w1\", \"w2\", \"w3\", \"w4\""));
            assertFalse(text.contains("\"w5\""));
        }

        @Test
        @DisplayName("uppercase sentence only when ratio > 0.1; symbol sentence only when ratio > 0.05")
        void ratioSentences() {
            String atThresholds = generator.generate(70, heuristic(),
                model(90, flags(List.of("x"), List.of(), 0.1, 0.05)));
            assertFalse(atThresholds.contains("capital letters"));
            assertFalse(atThresholds.contains("symbols and punctuation"));

            String above = generator.generate(70, heuristic(),
                model(90, flags(List.of("x"), List.of(), 0.11, 0.06)));
            assertTrue(above.contains("capital letters"));
            assertTrue(above.contains("symbols and punctuation"));
        }
    }
}
