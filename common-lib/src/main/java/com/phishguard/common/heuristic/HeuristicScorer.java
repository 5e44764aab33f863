package com.phishguard.common.heuristic;

import com.phishguard.common.model.MatchEvidence;
import com.phishguard.common.model.RiskCategory;
import com.phishguard.common.rule.CorrelationBonus;
import com.phishguard.common.rule.Rule;
import com.phishguard.common.rule.RuleTable;
import com.phishguard.common.rule.ScanText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weighted rule-matching layer.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Text without a single letter or digit scores 0 with no evidence.</li>
 *   <li>For every rule whose matcher fires, add its weight once and record one
 *       {@link MatchEvidence}; repeated occurrences add nothing.</li>
 *   <li>For every {@link CorrelationBonus} whose two categories both matched,
 *       add the bonus once.</li>
 *   <li>{@code score = min(100, base + bonuses)}. All weights are positive, so no
 *       lower clamp is needed.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe. No logging, no I/O.
 */
public final class HeuristicScorer {

    public static final double MAX_SCORE = 100.0;

    private final RuleTable ruleTable;

    public HeuristicScorer(RuleTable ruleTable) {
        if (ruleTable == null) {
            throw new IllegalArgumentException("Rule table must not be null");
        }
        this.ruleTable = ruleTable;
    }

    public HeuristicResult score(String text) {
        return score(ScanText.of(text));
    }

    public HeuristicResult score(ScanText text) {
        if (!text.hasAlphanumeric()) {
            return HeuristicResult.empty();
        }

        int base = 0;
        Map<String, MatchEvidence> evidence = new LinkedHashMap<>();
        Set<RiskCategory> categories = new LinkedHashSet<>();

        for (Rule rule : ruleTable.rules()) {
            if (evidence.containsKey(rule.id()) || !rule.matcher().matches(text)) {
                continue;
            }
            base += rule.weight();
            evidence.put(rule.id(), new MatchEvidence(rule.id(), rule.category(), rule.reason()));
            categories.add(rule.category());
        }

        int bonusTotal = 0;
        List<CorrelationBonus> applied = new ArrayList<>();
        for (CorrelationBonus bonus : ruleTable.bonuses()) {
            if (bonus.appliesTo(categories)) {
                bonusTotal += bonus.bonus();
                applied.add(bonus);
            }
        }

        double score = Math.min(MAX_SCORE, base + bonusTotal);
        return new HeuristicResult(score, base, new ArrayList<>(evidence.values()), categories, applied);
    }
}
