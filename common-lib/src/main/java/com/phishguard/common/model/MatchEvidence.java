package com.phishguard.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One matched rule. Produced at most once per rule per scoring call.
 */
public record MatchEvidence(
    @JsonProperty("ruleId")   String ruleId,
    @JsonProperty("category") RiskCategory category,
    @JsonProperty("reason")   String reason
) {}
