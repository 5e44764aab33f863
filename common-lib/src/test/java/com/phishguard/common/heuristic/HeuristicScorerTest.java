package com.phishguard.common.heuristic;

import com.phishguard.common.model.MatchEvidence;
import com.phishguard.common.model.RiskCategory;
import com.phishguard.common.rule.CorrelationBonus;
import com.phishguard.common.rule.KeywordSetMatcher;
import com.phishguard.common.rule.Rule;
import com.phishguard.common.rule.RuleTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link HeuristicScorer} against the default
 * rule table and small substituted tables.
 */
class HeuristicScorerTest {

    private final HeuristicScorer scorer = new HeuristicScorer(RuleTable.defaults());

    // ── default rule table ────────────────────────────────────────────────

    @Nested
    @DisplayName("score() — default rules")
    class DefaultRuleTests {

        @Test
        @DisplayName("empty text → 0, no evidence")
        void emptyText() {
            HeuristicResult result = scorer.score("");
            assertEquals(0.0, result.score());
            assertTrue(result.evidence().isEmpty());
            assertTrue(result.matchedCategories().isEmpty());
        }

        @Test
        @DisplayName("text without letters or digits → 0, no evidence")
        void noAlphanumeric() {
            HeuristicResult result = scorer.score("!!! ??? ... @@@");
            assertEquals(0.0, result.score());
            assertTrue(result.evidence().isEmpty());
        }

        @Test
        @DisplayName("rule matching five times contributes its weight once")
        void repeatedMatchCountsOnce() {
            HeuristicResult result = scorer.score("urgent urgent urgent urgent urgent");
            assertEquals(25.0, result.score());
            assertEquals(1, result.evidence().size());
            assertEquals("urgency.immediate-action", result.evidence().get(0).ruleId());
        }

        @Test
        @DisplayName("Urgency + Financial → base weights + 20")
        void urgencyFinancialBonus() {
            HeuristicResult result = scorer.score("This is urgent. Please contact your bank.");
            assertEquals(40, result.baseScore());
            assertEquals(20, result.bonusTotal());
            assertEquals(60.0, result.score());
            assertEquals(List.of(RiskCategory.URGENCY, RiskCategory.FINANCIAL),
                List.copyOf(result.matchedCategories()));
        }

        @Test
        @DisplayName("URGENT verify-account example → Urgency, Authority, Suspicious Links + bonus, capped at 100")
        void urgentVerifyExample() {
            HeuristicResult result = scorer.score(
                "URGENT: verify your account immediately, click here http://bit.ly/x");

            assertTrue(result.matchedCategories().contains(RiskCategory.URGENCY));
            assertTrue(result.matchedCategories().contains(RiskCategory.AUTHORITY));
            assertTrue(result.matchedCategories().contains(RiskCategory.SUSPICIOUS_LINKS));
            assertTrue(result.appliedBonuses().contains(
                new CorrelationBonus(RiskCategory.AUTHORITY, RiskCategory.URGENCY, 20)));
            // 25 urgency + 20 credential request + 30 shortener + 10 click prompt + 5 shouting
            assertEquals(90, result.baseScore());
            assertEquals(100.0, result.score());
        }

        @Test
        @DisplayName("ordinary business mail matches no rule")
        void benignMail() {
            HeuristicResult result = scorer.score("Hi team, attaching the Q3 report for your review. Thanks!");
            assertEquals(0.0, result.score());
            assertTrue(result.evidence().isEmpty());
        }

        @Test
        @DisplayName("domain containing 't.co' is not mistaken for the shortener")
        void shortenerNeedsWordBoundary() {
            HeuristicResult result = scorer.score("see microsoft.com/support for help");
            assertTrue(result.evidence().stream().noneMatch(e -> e.ruleId().equals("links.url-shortener")));
        }

        @Test
        @DisplayName("evidence follows rule-table order")
        void evidenceOrder() {
            HeuristicResult result = scorer.score("You have won a prize! Dear customer, act now.");
            List<String> ids = result.evidence().stream().map(MatchEvidence::ruleId).toList();
            assertEquals(List.of("urgency.immediate-action", "greeting.generic", "reward.prize"), ids);
        }
    }

    // ── substituted tables ────────────────────────────────────────────────

    @Nested
    @DisplayName("score() — substituted rule tables")
    class SubstitutedTableTests {

        private RuleTable table(int weight) {
            return new RuleTable(List.of(
                new Rule("u", RiskCategory.URGENCY,   weight, KeywordSetMatcher.of("alpha"), "urgency"),
                new Rule("f", RiskCategory.FINANCIAL, weight, KeywordSetMatcher.of("beta"),  "financial"),
                new Rule("a", RiskCategory.AUTHORITY, weight, KeywordSetMatcher.of("gamma"), "authority")
            ), RuleTable.defaultBonuses());
        }

        @Test
        @DisplayName("every qualifying pair adds its bonus exactly once")
        void bonusesAppliedOnce() {
            HeuristicResult result = new HeuristicScorer(table(10)).score("alpha beta gamma alpha beta gamma");
            // 30 base + U/F 20 + A/F 25 + A/U 20
            assertEquals(30, result.baseScore());
            assertEquals(65, result.bonusTotal());
            assertEquals(95.0, result.score());
            assertEquals(3, result.appliedBonuses().size());
        }

        @Test
        @DisplayName("base + bonuses above 100 is clamped to 100")
        void clampedTo100() {
            HeuristicResult result = new HeuristicScorer(table(20)).score("alpha beta gamma");
            assertEquals(60, result.baseScore());
            assertEquals(100.0, result.score());
        }

        @Test
        @DisplayName("single category never earns a bonus")
        void singleCategory() {
            HeuristicResult result = new HeuristicScorer(table(10)).score("alpha");
            assertEquals(10.0, result.score());
            assertTrue(result.appliedBonuses().isEmpty());
        }

        @Test
        @DisplayName("empty table scores everything 0")
        void emptyTable() {
            HeuristicScorer empty = new HeuristicScorer(new RuleTable(List.of(), List.of()));
            assertEquals(0.0, empty.score("urgent bank password").score());
        }
    }
}
