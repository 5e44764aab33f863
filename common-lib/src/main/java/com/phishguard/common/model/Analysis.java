package com.phishguard.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Immutable record of one analysis, appended to the history store.
 *
 * <p>{@code text} is what the user submitted, or a source label such as
 * {@code "[Image Analysis] scan.png"} for OCR input.
 */
public record Analysis(
    @JsonProperty("text")        String text,
    @JsonProperty("score")       int score,
    @JsonProperty("label")       RiskLabel label,
    @JsonProperty("time")        LocalDateTime time,
    @JsonProperty("explanation") String explanation
) {
    public static Analysis of(String text, RiskAssessment assessment, LocalDateTime time) {
        return new Analysis(text, assessment.score(), assessment.label(), time, assessment.explanation());
    }
}
