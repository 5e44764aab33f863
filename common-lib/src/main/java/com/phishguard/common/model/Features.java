package com.phishguard.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Lexical and structural features fed into the linear risk model.
 *
 * <p>The three ratios are in [0, 1]. {@code flaggedWords} keeps first-occurrence
 * order; {@code flaggedNgrams} keeps phrase-table order.
 */
public record Features(
    @JsonProperty("keywordScore")   double keywordScore,
    @JsonProperty("ngramScore")     double ngramScore,
    @JsonProperty("uppercaseRatio") double uppercaseRatio,
    @JsonProperty("symbolRatio")    double symbolRatio,
    @JsonProperty("digitRatio")     double digitRatio,
    @JsonProperty("flaggedWords")   List<String> flaggedWords,
    @JsonProperty("flaggedNgrams")  List<String> flaggedNgrams
) {
    private static final Features EMPTY = new Features(0.0, 0.0, 0.0, 0.0, 0.0, List.of(), List.of());

    public Features {
        flaggedWords  = flaggedWords  == null ? List.of() : List.copyOf(flaggedWords);
        flaggedNgrams = flaggedNgrams == null ? List.of() : List.copyOf(flaggedNgrams);
    }

    public static Features empty() {
        return EMPTY;
    }
}
