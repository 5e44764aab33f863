package com.phishguard.common.scoring;

/**
 * Merges the heuristic and linear-model scores.
 *
 * <pre>
 *   blended = clamp(heuristic × 0.5 + model × 0.5, 0, 100)
 * </pre>
 *
 * <p>The result stays real-valued; rounding happens once, when the
 * {@link com.phishguard.common.model.RiskAssessment} is built.
 */
public final class ScoreBlender {

    public static final double DEFAULT_HEURISTIC_WEIGHT = 0.5;
    public static final double DEFAULT_MODEL_WEIGHT     = 0.5;

    private final double heuristicWeight;
    private final double modelWeight;

    public ScoreBlender() {
        this(DEFAULT_HEURISTIC_WEIGHT, DEFAULT_MODEL_WEIGHT);
    }

    public ScoreBlender(double heuristicWeight, double modelWeight) {
        if (heuristicWeight < 0.0 || modelWeight < 0.0) {
            throw new IllegalArgumentException("Blend weights must not be negative");
        }
        this.heuristicWeight = heuristicWeight;
        this.modelWeight     = modelWeight;
    }

    public double blend(double heuristicScore, double modelScore) {
        double blended = heuristicScore * heuristicWeight + modelScore * modelWeight;
        return Math.max(0.0, Math.min(100.0, blended));
    }
}
