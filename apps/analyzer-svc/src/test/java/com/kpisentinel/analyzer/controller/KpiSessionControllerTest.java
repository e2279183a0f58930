package com.kpisentinel.analyzer.controller;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.kpisentinel.analyzer.observability.TraceIdFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class KpiSessionControllerTest {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private static final String SAMPLE_CSV = """
            Date,Sales,Revenue,Customer_Count,Conversion_Rate
            2025-01-01,100,5000,50,2.0
            2025-01-02,105,5250,52,2.1
            2025-01-03,98,4900,49,2.0
            2025-01-04,300,15000,150,2.0
            2025-01-05,102,5100,51,2.0
            2025-01-06,99,4950,50,1.9
            2025-01-07,103,5150,52,2.0
            2025-01-08,101,5050,50,2.0
            2025-01-09,97,4850,49,2.0
            2025-01-10,500,25000,250,2.0
            """;

    @Autowired
    MockMvc mockMvc;

    @Test
    void ingestAnalyzeAndReport() throws Exception {
        mockMvc.perform(post("/sessions/flow/ingest").contentType(TEXT_CSV).content(SAMPLE_CSV)
                        .header(TraceIdFilter.TRACE_HEADER, "trace-flow"))
                .andExpect(status().isOk())
                .andExpect(header().string(TraceIdFilter.TRACE_HEADER, "trace-flow"))
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.rows").value(10))
                .andExpect(jsonPath("$.numericColumns", hasSize(4)))
                .andExpect(jsonPath("$.hasDateColumn").value(true))
                .andExpect(jsonPath("$.traceId").value("trace-flow"));

        mockMvc.perform(post("/sessions/flow/analysis").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"ensemble\",\"sensitivity\":\"medium\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metricsAnalyzed").value(4))
                .andExpect(jsonPath("$.totalAnomalies").value(5))
                .andExpect(jsonPath("$.criticalAnomalies").value(3))
                .andExpect(jsonPath("$.method").value("ensemble"))
                .andExpect(jsonPath("$.sensitivity").value("medium"));

        mockMvc.perform(get("/sessions/flow/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metrics", hasSize(4)))
                .andExpect(jsonPath("$.metrics[0].metricName").value("Sales"))
                .andExpect(jsonPath("$.metrics[0].trend").value("stable"))
                .andExpect(jsonPath("$.metrics[0].anomalies[0].index").value(9))
                .andExpect(jsonPath("$.metrics[0].anomalies[0].severity").value("critical"))
                .andExpect(jsonPath("$.metrics[0].anomalies[0].context.votes").value(3))
                .andExpect(jsonPath("$.metrics[0].correlationWith.Revenue", closeTo(1.0, 1e-9)));

        mockMvc.perform(post("/sessions/flow/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.sessionId").value("flow"))
                .andExpect(jsonPath("$.metadata.rowsAnalyzed").value(10))
                .andExpect(jsonPath("$.metrics", hasSize(4)))
                .andExpect(jsonPath("$.metrics[0].baselineMean").value(160.5))
                .andExpect(jsonPath("$.metrics[0].topAnomalies[0].value").value(500.0))
                .andExpect(jsonPath("$.metrics[0].topAnomalies[0].deviation").value(211.5))
                .andExpect(jsonPath("$.metrics[0].topAnomalies[0].method").value("ensemble"))
                .andExpect(jsonPath("$.metrics[0].topAnomalies[0].confidence").value(1.0));

        mockMvc.perform(get("/baselines/Revenue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mean").value(8025.0));

        mockMvc.perform(get("/traces/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCalls", greaterThan(0)));
    }

    @Test
    void analysisWithoutBodyUsesConfiguredDefaults() throws Exception {
        mockMvc.perform(post("/sessions/defaults/ingest").contentType(MediaType.TEXT_PLAIN).content(SAMPLE_CSV))
                .andExpect(status().isOk());

        mockMvc.perform(post("/sessions/defaults/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.method").value("ensemble"))
                .andExpect(jsonPath("$.sensitivity").value("medium"));
    }

    @Test
    void unknownMethodIsBadRequest() throws Exception {
        mockMvc.perform(post("/sessions/bad-method/ingest").contentType(TEXT_CSV).content(SAMPLE_CSV))
                .andExpect(status().isOk());

        mockMvc.perform(post("/sessions/bad-method/analysis").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"magic\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        mockMvc.perform(post("/sessions/bad-method/analysis").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sensitivity\":\"very-high\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/sessions/bad-method/analysis").contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void missingSessionIsNotFound() throws Exception {
        mockMvc.perform(post("/sessions/never-ingested/analysis"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"))
                .andExpect(jsonPath("$.details.sessionId").value("never-ingested"))
                .andExpect(jsonPath("$.endpoint").value("POST /sessions/never-ingested/analysis"));
    }

    @Test
    void traceparentSuppliesTraceIdWhenNoExplicitHeader() throws Exception {
        mockMvc.perform(get("/baselines/NeverSeen")
                        .header(TraceIdFilter.TRACEPARENT_HEADER, "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01"))
                .andExpect(status().isNotFound())
                .andExpect(header().string(TraceIdFilter.TRACE_HEADER, "4bf92f3577b34da6a3ce929d0e0e4736"))
                .andExpect(jsonPath("$.traceId").value("4bf92f3577b34da6a3ce929d0e0e4736"));
    }

    @Test
    void reportBeforeAnalysisIsConflict() throws Exception {
        mockMvc.perform(post("/sessions/no-analysis/ingest").contentType(TEXT_CSV).content(SAMPLE_CSV))
                .andExpect(status().isOk());

        mockMvc.perform(post("/sessions/no-analysis/report"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("NO_ANALYSIS"))
                .andExpect(jsonPath("$.details.sessionId").value("no-analysis"));
    }

    @Test
    void emptyUploadIsBadRequest() throws Exception {
        mockMvc.perform(post("/sessions/empty/ingest").contentType(TEXT_CSV).content("Date,Sales\n"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void unknownBaselineIsNotFound() throws Exception {
        mockMvc.perform(get("/baselines/NeverSeen"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("BASELINE_NOT_FOUND"));
    }

    @Test
    void tracesCanBeCleared() throws Exception {
        mockMvc.perform(delete("/traces"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/traces"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }
}
