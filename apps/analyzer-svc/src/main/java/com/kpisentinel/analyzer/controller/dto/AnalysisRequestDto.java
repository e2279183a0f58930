package com.kpisentinel.analyzer.controller.dto;

import jakarta.validation.constraints.Pattern;

public record AnalysisRequestDto(
        @Pattern(regexp = "[A-Za-z_]+", message = "method must be a method name such as ensemble or z_score")
        String method,
        @Pattern(regexp = "[A-Za-z]+", message = "sensitivity must be low, medium or high")
        String sensitivity,
        Boolean enableSeasonality,
        Boolean enableMultivariate
) {
    public boolean enableSeasonalityFlag() {
        return enableSeasonality == null || enableSeasonality;
    }

    public boolean enableMultivariateFlag() {
        return enableMultivariate == null || enableMultivariate;
    }
}
