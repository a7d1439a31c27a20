package com.tracelens.controller;

import com.tracelens.exception.EmptyTraceException;
import com.tracelens.exception.InsufficientDataException;
import com.tracelens.model.*;
import com.tracelens.service.TelemetryAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.function.Supplier;

/**
 * REST surface over the analysis engine. Callers post the raw records, the engine never fetches data itself.
 *
 * @author kiransahoo
 */
@Slf4j
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
public class TelemetryAnalysisController {

    private final TelemetryAnalysisService analysisService;

    @PostMapping("/compare")
    public ResponseEntity<?> compareTraces(@RequestBody TraceComparisonRequest request) {
        log.info("=== COMPARE REQUEST {} -> {} ===",
                request.getBaseline() != null ? request.getBaseline().getTraceId() : null,
                request.getTarget() != null ? request.getTarget().getTraceId() : null);
        return respond("compare traces",
                () -> analysisService.compareTraces(request.getBaseline(), request.getTarget()));
    }

    @PostMapping("/quality")
    public ResponseEntity<?> assessQuality(@RequestBody TraceRecord trace) {
        return respond("assess trace quality", () -> analysisService.assessQuality(trace));
    }

    @PostMapping("/critical-path")
    public ResponseEntity<?> criticalPath(@RequestBody TraceRecord trace) {
        return respond("critical path", () -> analysisService.analyzeCriticalPath(trace));
    }

    @PostMapping("/anti-patterns")
    public ResponseEntity<?> antiPatterns(@RequestBody TraceRecord trace) {
        return respond("anti-patterns", () -> analysisService.detectAntiPatterns(trace));
    }

    @PostMapping("/statistics")
    public ResponseEntity<?> statistics(@RequestBody StatisticsRequest request) {
        return respond("statistics", () -> analysisService.analyzeStatistics(request));
    }

    @PostMapping("/variability")
    public ResponseEntity<?> variability(@RequestBody VariabilityRequest request) {
        return respond("span variability", () -> analysisService.analyzeVariability(request.getTraces()));
    }

    @PostMapping("/latency-anomalies")
    public ResponseEntity<?> latencyAnomalies(@RequestBody LatencyAnomalyRequest request) {
        return respond("latency anomalies",
                () -> analysisService.detectLatencyAnomalies(request.getBaselines(), request.getTarget()));
    }

    @PostMapping("/logs")
    public ResponseEntity<?> logPatterns(@RequestBody LogAnalysisRequest request) {
        return respond("log patterns", () -> analysisService.analyzeLogs(request));
    }

    @PostMapping("/investigate")
    public ResponseEntity<?> investigate(@RequestBody InvestigationRequest request) {
        return respond("investigate", () -> analysisService.investigate(request));
    }

    private ResponseEntity<?> respond(String operation, Supplier<?> analysis) {
        try {
            return ResponseEntity.ok(analysis.get());
        } catch (EmptyTraceException | IllegalArgumentException e) {
            log.warn("Rejected {} request: {}", operation, e.getMessage());
            return ResponseEntity.badRequest().body(error("Invalid input", e));
        } catch (InsufficientDataException e) {
            log.warn("Not enough data for {}: {}", operation, e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error("Insufficient data", e));
        } catch (Exception e) {
            log.error("Failed to {}", operation, e);
            return ResponseEntity.status(500).body(error("Failed to " + operation, e));
        }
    }

    private static Map<String, String> error(String error, Exception e) {
        return Map.of("error", error, "message", String.valueOf(e.getMessage()));
    }
}
