package com.phishguard.common.ml;

import com.phishguard.common.feature.FeatureExtractor;
import com.phishguard.common.model.Features;

/**
 * Hand-authored linear model with a sigmoid activation. Simulates, but does not
 * perform, learned inference: weights are fixed constants.
 *
 * <pre>
 *   probability = 1 / (1 + e^(−clamp(logit, −30, 30)))
 *   score       = min(100, probability × 100)
 * </pre>
 *
 * <p>Empty text is an explicit short-circuit to {@link ModelResult#empty()};
 * the pipeline is not run for it.
 */
public final class LinearRiskModel {

    static final double MAX_ABS_LOGIT = 30.0;

    private final FeatureExtractor extractor;
    private final ModelWeights weights;

    public LinearRiskModel(FeatureExtractor extractor, ModelWeights weights) {
        if (extractor == null || weights == null) {
            throw new IllegalArgumentException("Extractor and weights must not be null");
        }
        this.extractor = extractor;
        this.weights   = weights;
    }

    public ModelResult evaluate(String text) {
        if (text == null || text.isEmpty()) {
            return ModelResult.empty();
        }
        return evaluate(extractor.extract(text));
    }

    public ModelResult evaluate(Features features) {
        double logit = clamp(weights.logit(features), -MAX_ABS_LOGIT, MAX_ABS_LOGIT);
        double probability = sigmoid(logit);
        return new ModelResult(Math.min(100.0, probability * 100.0), probability, features);
    }

    static double sigmoid(double logit) {
        return 1.0 / (1.0 + Math.exp(-logit));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
