package com.tracelens.controller;

import com.tracelens.exception.EmptyTraceException;
import com.tracelens.exception.InsufficientDataException;
import com.tracelens.model.*;
import com.tracelens.service.TelemetryAnalysisService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TelemetryAnalysisControllerTest {

    private static final String TRACE_JSON = """
            {
              "trace_id": "t-1",
              "spans": [
                {"span_id": "root", "name": "GET /orders",
                 "start_time": "2024-05-01T12:00:00Z", "end_time": "2024-05-01T12:00:00.100Z"}
              ]
            }
            """;

    @Mock
    private TelemetryAnalysisService analysisService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TelemetryAnalysisController(analysisService)).build();
    }

    @Test
    void criticalPathReturnsReport() throws Exception {
        when(analysisService.analyzeCriticalPath(any(TraceRecord.class))).thenReturn(CriticalPathReport.builder()
                .nodes(List.of())
                .criticalPathDurationMs(100.0)
                .totalDurationMs(100.0)
                .totalWorkMs(100.0)
                .parallelismRatio(1.0)
                .parallelismPct(0.0)
                .selfTimes(Map.of("root", 100.0))
                .build());

        mockMvc.perform(post("/api/analysis/critical-path")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TRACE_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.criticalPathDurationMs").value(100.0))
                .andExpect(jsonPath("$.selfTimes.root").value(100.0));

        ArgumentCaptor<TraceRecord> captor = ArgumentCaptor.forClass(TraceRecord.class);
        verify(analysisService).analyzeCriticalPath(captor.capture());
        assertThat(captor.getValue().getTraceId()).isEqualTo("t-1");
        assertThat(captor.getValue().getSpans()).singleElement()
                .satisfies(span -> {
                    assertThat(span.getSpanId()).isEqualTo("root");
                    assertThat(span.getStartTime()).isEqualTo("2024-05-01T12:00:00Z");
                });
    }

    @Test
    void emptyTraceIsBadRequest() throws Exception {
        when(analysisService.assessQuality(any(TraceRecord.class))).thenThrow(new EmptyTraceException("t-1"));

        mockMvc.perform(post("/api/analysis/quality")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TRACE_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid input"))
                .andExpect(jsonPath("$.message").value("Trace t-1 contains no usable spans"));
    }

    @Test
    void insufficientDataIsUnprocessable() throws Exception {
        when(analysisService.analyzeVariability(anyList()))
                .thenThrow(new InsufficientDataException("span variability", 3, 1));

        mockMvc.perform(post("/api/analysis/variability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"traces\": [" + TRACE_JSON + "]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Insufficient data"))
                .andExpect(jsonPath("$.message").value("span variability needs at least 3 samples, got 1"));
    }

    @Test
    void unexpectedFailureIsServerError() throws Exception {
        when(analysisService.analyzeStatistics(any(StatisticsRequest.class)))
                .thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/analysis/statistics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"metric\": \"latency\", \"historical\": [{\"value\": 1.0}]}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Failed to statistics"))
                .andExpect(jsonPath("$.message").value("boom"));
    }

    @Test
    void investigationReportsFailures() throws Exception {
        when(analysisService.investigate(any(InvestigationRequest.class))).thenReturn(InvestigationReport.builder()
                .failures(List.of(new AnalysisFailure("log patterns", "IllegalArgumentException: missing window")))
                .build());

        mockMvc.perform(post("/api/analysis/investigate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"logs\": {}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.failures[0].analysis").value("log patterns"));
    }
}
