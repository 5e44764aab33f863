package com.phishguard.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phishguard.common.model.Analysis;
import com.phishguard.common.model.AssessmentSource;
import com.phishguard.common.model.Features;
import com.phishguard.common.model.MatchEvidence;
import com.phishguard.common.model.RiskAssessment;
import com.phishguard.common.model.RiskLabel;

import java.time.LocalDateTime;
import java.util.List;

/**
 * What a caller gets back for one analyzed text: the recorded {@link Analysis}
 * plus the local evidence and features behind it.
 */
public record AnalysisResponse(
    @JsonProperty("text")              String text,
    @JsonProperty("score")             int score,
    @JsonProperty("label")             RiskLabel label,
    @JsonProperty("explanation")       String explanation,
    @JsonProperty("heuristicEvidence") List<MatchEvidence> heuristicEvidence,
    @JsonProperty("mlFeatures")        Features mlFeatures,
    @JsonProperty("source")            AssessmentSource source,
    @JsonProperty("time")              LocalDateTime time
) {
    public static AnalysisResponse of(Analysis analysis, RiskAssessment assessment) {
        return new AnalysisResponse(
            analysis.text(), analysis.score(), analysis.label(), analysis.explanation(),
            assessment.heuristicEvidence(), assessment.mlFeatures(), assessment.source(),
            analysis.time());
    }
}
