package com.phishguard.common.rule;

import com.phishguard.common.model.RiskCategory;

import java.util.Set;

/**
 * Extra score awarded once when both categories matched in the same input.
 */
public record CorrelationBonus(RiskCategory first, RiskCategory second, int bonus) {

    public CorrelationBonus {
        if (first == null || second == null || first == second) {
            throw new IllegalArgumentException("Correlation bonus needs two distinct categories");
        }
        if (bonus < 0) {
            throw new IllegalArgumentException("Correlation bonus must not be negative, got " + bonus);
        }
    }

    public boolean appliesTo(Set<RiskCategory> matched) {
        return matched.contains(first) && matched.contains(second);
    }
}
