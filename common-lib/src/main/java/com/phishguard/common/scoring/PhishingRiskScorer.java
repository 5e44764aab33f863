package com.phishguard.common.scoring;

import com.phishguard.common.explain.ExplanationGenerator;
import com.phishguard.common.feature.FeatureExtractor;
import com.phishguard.common.feature.FeatureVocabulary;
import com.phishguard.common.heuristic.HeuristicResult;
import com.phishguard.common.heuristic.HeuristicScorer;
import com.phishguard.common.ml.LinearRiskModel;
import com.phishguard.common.ml.ModelResult;
import com.phishguard.common.ml.ModelWeights;
import com.phishguard.common.model.AssessmentSource;
import com.phishguard.common.model.RiskAssessment;
import com.phishguard.common.model.RiskLabel;
import com.phishguard.common.rule.RuleTable;
import com.phishguard.common.rule.ScanText;

/**
 * Entry point of the scoring core: {@code score(text) → RiskAssessment}.
 *
 * <p>Pipeline:
 * <pre>
 *   text → normalize ─┬→ HeuristicScorer ─────────────────────┐
 *                     └→ FeatureExtractor → LinearRiskModel ──┴→ ScoreBlender → round → label
 *                                                                             └→ ExplanationGenerator
 * </pre>
 *
 * <p>Pure, total and thread-safe: every table is immutable and injected at
 * construction. {@code null} is scored as empty text.
 */
public final class PhishingRiskScorer {

    private final HeuristicScorer heuristicScorer;
    private final LinearRiskModel riskModel;
    private final ScoreBlender blender;
    private final ExplanationGenerator explanationGenerator;

    public PhishingRiskScorer(HeuristicScorer heuristicScorer,
                              LinearRiskModel riskModel,
                              ScoreBlender blender,
                              ExplanationGenerator explanationGenerator) {
        this.heuristicScorer      = heuristicScorer;
        this.riskModel            = riskModel;
        this.blender              = blender;
        this.explanationGenerator = explanationGenerator;
    }

    public static PhishingRiskScorer withDefaults() {
        return create(RuleTable.defaults(), FeatureVocabulary.defaults(), ModelWeights.DEFAULT);
    }

    public static PhishingRiskScorer create(RuleTable rules, FeatureVocabulary vocabulary, ModelWeights weights) {
        return new PhishingRiskScorer(
            new HeuristicScorer(rules),
            new LinearRiskModel(new FeatureExtractor(vocabulary), weights),
            new ScoreBlender(),
            new ExplanationGenerator());
    }

    public RiskAssessment score(String text) {
        String input = text == null ? "" : text;

        HeuristicResult heuristic = heuristicScorer.score(ScanText.of(input));
        ModelResult model = riskModel.evaluate(input);

        double blended = blender.blend(heuristic.score(), model.score());
        int finalScore = (int) Math.round(blended);

        return new RiskAssessment(
            finalScore,
            RiskLabel.fromScore(finalScore),
            explanationGenerator.generate(finalScore, heuristic, model),
            heuristic.evidence(),
            model.features(),
            heuristic.score(),
            model.score(),
            blended,
            AssessmentSource.LOCAL);
    }
}
