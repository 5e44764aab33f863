package com.phishguard.common.heuristic;

import com.phishguard.common.model.MatchEvidence;
import com.phishguard.common.model.RiskCategory;
import com.phishguard.common.rule.CorrelationBonus;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Output of one {@link HeuristicScorer} pass.
 *
 * <ul>
 *   <li>{@code score}             — min(100, baseScore + bonus total)</li>
 *   <li>{@code baseScore}         — sum of matched rule weights, each rule counted once</li>
 *   <li>{@code evidence}          — one entry per matched rule, in rule-table order</li>
 *   <li>{@code matchedCategories} — distinct categories in first-encounter order</li>
 *   <li>{@code appliedBonuses}    — correlation bonuses that fired</li>
 * </ul>
 */
public record HeuristicResult(
    double score,
    int baseScore,
    List<MatchEvidence> evidence,
    Set<RiskCategory> matchedCategories,
    List<CorrelationBonus> appliedBonuses
) {
    private static final HeuristicResult EMPTY =
        new HeuristicResult(0.0, 0, List.of(), Set.of(), List.of());

    public HeuristicResult {
        evidence          = List.copyOf(evidence);
        matchedCategories = Collections.unmodifiableSet(new LinkedHashSet<>(matchedCategories));
        appliedBonuses    = List.copyOf(appliedBonuses);
    }

    public static HeuristicResult empty() {
        return EMPTY;
    }

    public int bonusTotal() {
        return appliedBonuses.stream().mapToInt(CorrelationBonus::bonus).sum();
    }
}
