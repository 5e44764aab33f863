package com.phishguard.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of scoring one text.
 *
 * <p>{@code score} is the rounded final score and drives {@code label}.
 * {@code heuristicScore}, {@code mlScore} and {@code blendedScore} are the
 * unrounded local layer outputs; they are kept even when a remote model verdict
 * replaced the score and explanation.
 */
public record RiskAssessment(
    @JsonProperty("score")             int score,
    @JsonProperty("label")             RiskLabel label,
    @JsonProperty("explanation")       String explanation,
    @JsonProperty("heuristicEvidence") List<MatchEvidence> heuristicEvidence,
    @JsonProperty("mlFeatures")        Features mlFeatures,
    @JsonProperty("heuristicScore")    double heuristicScore,
    @JsonProperty("mlScore")           double mlScore,
    @JsonProperty("blendedScore")      double blendedScore,
    @JsonProperty("source")            AssessmentSource source
) {
    public RiskAssessment {
        heuristicEvidence = heuristicEvidence == null ? List.of() : List.copyOf(heuristicEvidence);
        mlFeatures        = mlFeatures == null ? Features.empty() : mlFeatures;
    }

    /**
     * Returns a copy whose score, label and explanation come from a remote model.
     *
     * @param remoteScore score in [0, 100]; clamped and rounded here
     */
    public RiskAssessment withRemoteVerdict(double remoteScore, String remoteExplanation) {
        int rounded = (int) Math.round(Math.max(0.0, Math.min(100.0, remoteScore)));
        return new RiskAssessment(rounded, RiskLabel.fromScore(rounded), remoteExplanation,
            heuristicEvidence, mlFeatures, heuristicScore, mlScore, blendedScore,
            AssessmentSource.REMOTE_MODEL);
    }
}
