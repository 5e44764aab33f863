package com.phishguard.common.rule;

import com.phishguard.common.model.RiskCategory;

/**
 * One weighted heuristic rule. Immutable; ids are unique within a {@link RuleTable}.
 */
public record Rule(
    String id,
    RiskCategory category,
    int weight,
    Matcher matcher,
    String reason
) {
    public Rule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id must not be blank");
        }
        if (category == null || matcher == null) {
            throw new IllegalArgumentException("Rule " + id + " needs a category and a matcher");
        }
        if (weight <= 0) {
            throw new IllegalArgumentException("Rule " + id + " weight must be positive, got " + weight);
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Rule " + id + " needs a reason");
        }
    }
}
