package com.phishguard.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Count of analyses per {@link RiskLabel}, as shown on the dashboard.
 *
 * <p>Buckets are assigned only through {@link RiskLabel#fromScore(int)}.
 */
public record RiskDistribution(
    @JsonProperty("low")    long low,
    @JsonProperty("medium") long medium,
    @JsonProperty("high")   long high
) {
    public static final RiskDistribution EMPTY = new RiskDistribution(0, 0, 0);

    @JsonProperty("total")
    public long total() {
        return low + medium + high;
    }

    /** Returns a new distribution with one more analysis of the given score. */
    public RiskDistribution add(int score) {
        return switch (RiskLabel.fromScore(score)) {
            case LOW    -> new RiskDistribution(low + 1, medium, high);
            case MEDIUM -> new RiskDistribution(low, medium + 1, high);
            case HIGH   -> new RiskDistribution(low, medium, high + 1);
        };
    }

    public static RiskDistribution fromScores(Iterable<Integer> scores) {
        RiskDistribution distribution = EMPTY;
        for (Integer score : scores) {
            if (score != null) {
                distribution = distribution.add(score);
            }
        }
        return distribution;
    }
}
