package com.tracelens.service.stats;

import com.tracelens.config.AnalysisProperties;
import com.tracelens.exception.InsufficientDataException;
import com.tracelens.model.*;
import com.tracelens.service.trace.SpanForest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Looks across several traces of the same operation for spans that are consistently slow,
 * intermittently slow or simply unpredictable, and checks a single trace against that history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpanVariabilityAnalyzer {

    static final double RECURRING_MIN_MEAN_MS = 100.0;
    static final double RECURRING_MAX_CV = 0.3;
    static final double INTERMITTENT_MIN_CV = 0.5;
    static final double INTERMITTENT_MIN_MEAN_MS = 50.0;
    static final double HIGH_VARIANCE_MIN_CV = 0.7;
    static final int HIGH_VARIANCE_MIN_OCCURRENCES = 3;
    // Spans this short are never reported as latency anomalies
    static final double MIN_ANOMALY_DURATION_MS = 50.0;

    private final StatisticalAnomalyEngine statisticsEngine;
    private final AnalysisProperties properties;

    public VariabilityReport analyzePatterns(List<SpanForest> traces) {
        int minSamples = properties.getStatistics().getMinSamples();
        if (traces.size() < minSamples) {
            throw new InsufficientDataException("span variability", minSamples, traces.size());
        }

        Map<String, List<Double>> durationsByName = new LinkedHashMap<>();
        List<Double> traceDurations = new ArrayList<>();
        for (SpanForest trace : traces) {
            traceDurations.add(trace.getTotalDurationMs());
            for (Span span : trace.getSpans()) {
                if (!span.isTemporal()) continue;
                durationsByName.computeIfAbsent(span.getName(), k -> new ArrayList<>()).add(span.getDurationMs());
            }
        }

        List<SpanVariabilityPattern> patterns = new ArrayList<>();
        for (Map.Entry<String, List<Double>> entry : durationsByName.entrySet()) {
            List<Double> durations = entry.getValue();
            if (durations.size() < 2) continue;

            double mean = StatisticalAnomalyEngine.mean(durations);
            double stdDev = StatisticalAnomalyEngine.sampleStdDev(durations);
            double cv = mean > 0 ? stdDev / mean : 0.0;
            String name = entry.getKey();

            if (mean > RECURRING_MIN_MEAN_MS && cv < RECURRING_MAX_CV) {
                patterns.add(pattern(name, SpanPatternType.RECURRING_SLOWDOWN, durations, mean, stdDev, cv,
                        String.format("Consistently slow: %.1fms on average, %.0f%% consistent", mean, (1 - cv) * 100)));
            }
            if (cv > INTERMITTENT_MIN_CV && mean > INTERMITTENT_MIN_MEAN_MS) {
                patterns.add(pattern(name, SpanPatternType.INTERMITTENT, durations, mean, stdDev, cv,
                        String.format("Sometimes fast, sometimes slow: %.1fms to %.1fms",
                                Collections.min(durations), Collections.max(durations))));
            }
            if (cv > HIGH_VARIANCE_MIN_CV && durations.size() >= HIGH_VARIANCE_MIN_OCCURRENCES) {
                patterns.add(pattern(name, SpanPatternType.HIGH_VARIANCE, durations, mean, stdDev, cv,
                        String.format("Unpredictable performance (CV %.2f)", cv)));
            }
        }
        patterns.sort(Comparator.comparing(SpanVariabilityPattern::getType)
                .thenComparing(Comparator.comparingDouble(
                        (SpanVariabilityPattern p) -> p.getMeanMs() * p.getOccurrences()).reversed()));

        List<String> notes = new ArrayList<>();
        TrendResult trend = null;
        DistributionSummary summary = null;
        try {
            summary = statisticsEngine.summarize(traceDurations);
            trend = statisticsEngine.detectTrend(traceDurations);
        } catch (InsufficientDataException e) {
            notes.add("trace duration statistics skipped: " + e.getMessage());
        }

        log.info("Span variability over {} traces: {} patterns", traces.size(), patterns.size());
        return VariabilityReport.builder()
                .traceCount(traces.size())
                .durationSummary(summary)
                .durationTrend(trend)
                .patterns(patterns)
                .notes(notes)
                .build();
    }

    public LatencyAnomalyReport detectLatencyAnomalies(List<SpanForest> baselines, SpanForest target) {
        List<Double> baselineDurations = baselines.stream()
                .map(SpanForest::getTotalDurationMs)
                .collect(Collectors.toList());
        ZScoreResult traceZ = statisticsEngine.zScore(baselineDurations, List.of(target.getTotalDurationMs()));

        Map<String, List<Double>> baselineByName = new HashMap<>();
        for (SpanForest trace : baselines) {
            for (Span span : trace.getSpans()) {
                if (span.isTemporal()) {
                    baselineByName.computeIfAbsent(span.getName(), k -> new ArrayList<>()).add(span.getDurationMs());
                }
            }
        }

        double threshold = properties.getStatistics().getZScoreThreshold();
        List<SpanLatencyAnomaly> anomalies = new ArrayList<>();
        for (Span span : target.getSpans()) {
            List<Double> history = baselineByName.get(span.getName());
            if (!span.isTemporal() || history == null) continue;

            double duration = span.getDurationMs();
            double mean = StatisticalAnomalyEngine.mean(history);
            double stdDev = StatisticalAnomalyEngine.sampleStdDev(history);
            double z;
            if (stdDev > 0) {
                z = (duration - mean) / stdDev;
            } else if (duration == mean) {
                z = 0.0;
            } else {
                z = duration > mean ? StatisticalAnomalyEngine.DEGENERATE_Z_SCORE
                        : -StatisticalAnomalyEngine.DEGENERATE_Z_SCORE;
            }

            if (Math.abs(z) > threshold && duration > MIN_ANOMALY_DURATION_MS) {
                anomalies.add(SpanLatencyAnomaly.builder()
                        .spanId(span.getSpanId())
                        .spanName(span.getName())
                        .durationMs(duration)
                        .baselineMeanMs(mean)
                        .baselineStdDevMs(stdDev)
                        .zScore(z)
                        .severity(Math.abs(z) > 2 * threshold ? Impact.HIGH : Impact.MEDIUM)
                        .build());
            }
        }
        anomalies.sort((a1, a2) -> Double.compare(Math.abs(a2.getZScore()), Math.abs(a1.getZScore())));

        return LatencyAnomalyReport.builder()
                .targetTraceId(target.getTraceId())
                .targetDurationMs(target.getTotalDurationMs())
                .traceZScore(traceZ)
                .anomalousSpans(anomalies)
                .build();
    }

    private SpanVariabilityPattern pattern(String name, SpanPatternType type, List<Double> durations,
                                           double mean, double stdDev, double cv, String description) {
        return SpanVariabilityPattern.builder()
                .spanName(name)
                .type(type)
                .occurrences(durations.size())
                .meanMs(mean)
                .stdDevMs(stdDev)
                .coefficientOfVariation(cv)
                .description(description)
                .build();
    }
}
