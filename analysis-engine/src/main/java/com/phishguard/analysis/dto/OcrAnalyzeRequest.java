package com.phishguard.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Text already extracted from an image by an external OCR step.
 * {@code sourceName} is the image file name and becomes the history entry's text.
 */
public record OcrAnalyzeRequest(
    @JsonProperty("sourceName")    String sourceName,
    @JsonProperty("extractedText") String extractedText
) {}
