package com.phishguard.common.ml;

import com.phishguard.common.model.Features;

/**
 * Fixed coefficients of the {@link LinearRiskModel}.
 *
 * <pre>
 *   logit = keywordScore·1.2 + ngramScore·1.5 + uppercaseRatio·5.0
 *         + symbolRatio·3.0 + digitRatio·1.5 − 2.0
 * </pre>
 */
public record ModelWeights(
    double keyword,
    double ngram,
    double uppercase,
    double symbol,
    double digit,
    double bias
) {
    public static final ModelWeights DEFAULT = new ModelWeights(1.2, 1.5, 5.0, 3.0, 1.5, -2.0);

    public double logit(Features features) {
        return features.keywordScore()   * keyword
             + features.ngramScore()     * ngram
             + features.uppercaseRatio() * uppercase
             + features.symbolRatio()    * symbol
             + features.digitRatio()     * digit
             + bias;
    }
}
