package com.phishguard.history.model;

import com.phishguard.common.model.Analysis;
import com.phishguard.common.model.RiskLabel;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted {@link Analysis}. Rows are append-only; {@code id} gives insertion order.
 *
 * Column mapping (R2DBC snake_case convention):
 *   text       → content
 *   analyzedAt → analyzed_at
 *   savedAt    → saved_at
 *
 * label — {@link RiskLabel} enum name
 */
@Data
@NoArgsConstructor
@Table("analysis_history")
public class AnalysisHistory {

    @Id
    private Long id;

    @Column("content")
    private String text;

    private int score;

    private String label;

    private LocalDateTime analyzedAt;

    private String explanation;

    private LocalDateTime savedAt;

    /**
     * Missing label or time are filled in from the score and {@code savedAt}.
     */
    public static AnalysisHistory from(Analysis analysis, LocalDateTime savedAt) {
        AnalysisHistory entity = new AnalysisHistory();
        entity.setText(analysis.text() == null ? "" : analysis.text());
        entity.setScore(analysis.score());
        RiskLabel label = analysis.label() != null ? analysis.label() : RiskLabel.fromScore(analysis.score());
        entity.setLabel(label.name());
        entity.setAnalyzedAt(analysis.time() != null ? analysis.time() : savedAt);
        entity.setExplanation(analysis.explanation());
        entity.setSavedAt(savedAt);
        return entity;
    }

    public Analysis toAnalysis() {
        RiskLabel riskLabel = label != null ? RiskLabel.parse(label) : RiskLabel.fromScore(score);
        return new Analysis(text, score, riskLabel, analyzedAt, explanation);
    }
}
