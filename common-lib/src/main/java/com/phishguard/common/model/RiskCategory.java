package com.phishguard.common.model;

/**
 * Closed set of phishing indicator categories a {@link com.phishguard.common.rule.Rule}
 * can be tagged with. Correlation bonuses are keyed on pairs of these.
 */
public enum RiskCategory {
    URGENCY("Urgency"),
    FINANCIAL("Financial"),
    AUTHORITY("Authority"),
    SUSPICIOUS_LINKS("Suspicious Links"),
    GENERIC_GREETING("Generic Greeting"),
    BAD_GRAMMAR("Bad Grammar"),
    UNEXPECTED_REWARD("Unexpected Reward"),
    THREAT("Threat"),
    UNEXPECTED_ATTACHMENT("Unexpected Attachment"),
    PSYCHOLOGICAL_TRICKS("Psychological Tricks");

    private final String displayName;

    RiskCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
