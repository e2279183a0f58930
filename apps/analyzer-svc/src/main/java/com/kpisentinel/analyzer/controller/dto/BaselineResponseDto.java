package com.kpisentinel.analyzer.controller.dto;

import java.time.Instant;

public record BaselineResponseDto(String metric, double mean, double std, Instant storedAt) {
}
