package com.kpisentinel.analyzer.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kpisentinel.analyzer.observability.RequestContextHolder;
import java.util.Map;

/** Error body; {@code traceId} and {@code endpoint} are omitted outside a request. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponseDto(String code, String message, Map<String, Object> details, String traceId, String endpoint) {

    public ErrorResponseDto {
        details = details == null ? Map.of() : details;
    }

    public static ErrorResponseDto forCurrentRequest(String code, String message, Map<String, Object> details) {
        return new ErrorResponseDto(
                code, message, details, RequestContextHolder.currentTraceId(), RequestContextHolder.currentEndpoint());
    }
}
