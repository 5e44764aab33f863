package com.phishguard.common.ml;

import com.phishguard.common.model.Features;

/**
 * Output of the {@link LinearRiskModel}: a score in [0, 100], the sigmoid
 * probability behind it, and the features it was computed from.
 */
public record ModelResult(double score, double probability, Features features) {

    private static final ModelResult EMPTY = new ModelResult(0.0, 0.0, Features.empty());

    public static ModelResult empty() {
        return EMPTY;
    }
}
