package com.phishguard.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BatchAnalyzeRequest(
    @JsonProperty("texts") List<String> texts
) {}
