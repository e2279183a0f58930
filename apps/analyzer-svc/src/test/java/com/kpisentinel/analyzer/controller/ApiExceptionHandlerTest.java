package com.kpisentinel.analyzer.controller;

import static org.assertj.core.api.Assertions.assertThat;

import com.kpisentinel.analyzer.controller.dto.ErrorResponseDto;
import com.kpisentinel.analyzer.session.AnalysisNotFoundException;
import com.kpisentinel.analyzer.session.SessionChangedException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void missingAnalysisIsConflict() {
        ResponseEntity<ErrorResponseDto> response = handler.handleAnalysisNotFound(new AnalysisNotFoundException("s1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().code()).isEqualTo("NO_ANALYSIS");
        assertThat(response.getBody().details()).containsEntry("sessionId", "s1");
    }

    @Test
    void concurrentSessionChangeIsConflict() {
        ResponseEntity<ErrorResponseDto> response = handler.handleSessionChanged(new SessionChangedException("s9", "stale"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().code()).isEqualTo("SESSION_CHANGED");
        assertThat(response.getBody().details()).containsEntry("sessionId", "s9");
    }

    @Test
    void unrelatedIllegalStateIsInternalError() {
        ResponseEntity<ErrorResponseDto> response =
                handler.handleGeneral(new IllegalStateException("not a single-metric method: ensemble"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().code()).isEqualTo("INTERNAL_ERROR");
    }
}
