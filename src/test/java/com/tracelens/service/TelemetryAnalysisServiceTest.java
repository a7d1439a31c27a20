package com.tracelens.service;

import com.tracelens.config.AnalysisProperties;
import com.tracelens.exception.EmptyTraceException;
import com.tracelens.exception.InsufficientDataException;
import com.tracelens.model.*;
import com.tracelens.service.cache.NoOpAnalysisCache;
import com.tracelens.service.log.LogPatternComparator;
import com.tracelens.service.log.LogPatternService;
import com.tracelens.service.stats.SpanVariabilityAnalyzer;
import com.tracelens.service.stats.StatisticalAnomalyEngine;
import com.tracelens.service.trace.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static com.tracelens.TraceFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TelemetryAnalysisServiceTest {

    private AnalysisProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AnalysisProperties();
    }

    private TelemetryAnalysisService service(AntiPatternDetector detector, Executor executor) {
        StatisticalAnomalyEngine statisticsEngine = new StatisticalAnomalyEngine(properties);
        return new TelemetryAnalysisService(
                new TraceNormalizer(),
                new CriticalPathAnalyzer(),
                detector,
                new TraceComparator(properties),
                new RootCauseScorer(properties),
                statisticsEngine,
                new SpanVariabilityAnalyzer(statisticsEngine, properties),
                new LogPatternService(new LogPatternComparator(properties), new NoOpAnalysisCache<>(), properties),
                executor,
                properties);
    }

    private TelemetryAnalysisService service() {
        return service(new AntiPatternDetector(properties), Runnable::run);
    }

    private static TraceRecord baselineTrace() {
        return trace("baseline",
                span("root", null, "GET /orders", 0, 100),
                span("db", "root", "SELECT orders", 10, 40),
                span("render", "root", "render", 40, 90));
    }

    private static TraceRecord slowTargetTrace() {
        return trace("target",
                span("root", null, "GET /orders", 0, 300),
                span("db", "root", "SELECT orders", 10, 240),
                span("render", "root", "render", 240, 290));
    }

    private static List<String> failedAnalyses(List<AnalysisFailure> failures) {
        return failures.stream().map(AnalysisFailure::getAnalysis).collect(Collectors.toList());
    }

    @Test
    void comparisonCombinesEveryAnalysis() {
        ComparisonReport report = service().compareTraces(baselineTrace(), slowTargetTrace());

        assertThat(report.getFailures()).isEmpty();
        assertThat(report.getDurationDiffMs()).isEqualTo(200.0);
        assertThat(report.getDurationDiffPercent()).isEqualTo(200.0);
        assertThat(report.getDiff().getMatchStrategy()).isEqualTo(MatchStrategy.SPAN_ID);
        assertThat(report.getTargetCriticalPath().contains("db")).isTrue();
        assertThat(report.getAntiPatterns()).isEmpty();
        assertThat(report.getRootCauseCandidates()).isNotEmpty();
        RootCauseCandidate top = report.getRootCauseCandidates().get(0);
        assertThat(top.getSpanId()).isEqualTo("db");
        assertThat(top.isLikelyRootCause()).isTrue();
        assertThat(report.getTargetQuality().isValid()).isTrue();
    }

    @Test
    void failingAnalysisDoesNotSinkTheReport() {
        AntiPatternDetector detector = mock(AntiPatternDetector.class);
        when(detector.detect(any())).thenThrow(new IllegalStateException("detector broke"));

        ComparisonReport report = service(detector, Runnable::run).compareTraces(baselineTrace(), slowTargetTrace());

        assertThat(report.getAntiPatterns()).isNull();
        assertThat(report.getDiff()).isNotNull();
        assertThat(report.getRootCauseCandidates()).isNotEmpty();
        assertThat(report.getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.getAnalysis()).isEqualTo("anti-patterns");
            assertThat(failure.getReason()).contains("detector broke");
        });
    }

    @Test
    void analysesThatMissTheDeadlineAreReportedAsTimedOut() {
        properties.getExecutor().setTimeout(Duration.ofMillis(50));
        Executor neverRuns = task -> { };

        ComparisonReport report = service(new AntiPatternDetector(properties), neverRuns)
                .compareTraces(baselineTrace(), slowTargetTrace());

        assertThat(report.getDiff()).isNull();
        assertThat(report.getRootCauseCandidates()).isNull();
        assertThat(failedAnalyses(report.getFailures())).containsExactly(
                "baseline critical path", "target critical path", "anti-patterns", "trace diff", "root cause");
        assertThat(report.getFailures().get(0).getReason()).startsWith("timed out");
    }

    @Test
    void rejectedTaskIsRecordedWhileSubmittedAnalysesComplete() {
        AtomicInteger submitted = new AtomicInteger();
        Executor saturatesOnThirdTask = task -> {
            if (submitted.incrementAndGet() == 3) {
                throw new RejectedExecutionException("pool saturated");
            }
            task.run();
        };

        ComparisonReport report = service(new AntiPatternDetector(properties), saturatesOnThirdTask)
                .compareTraces(baselineTrace(), slowTargetTrace());

        assertThat(report.getAntiPatterns()).isNull();
        assertThat(report.getTargetCriticalPath()).isNotNull();
        assertThat(report.getDiff()).isNotNull();
        assertThat(report.getRootCauseCandidates()).isNotEmpty();
        assertThat(report.getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.getAnalysis()).isEqualTo("anti-patterns");
            assertThat(failure.getReason()).isEqualTo("RejectedExecutionException: pool saturated");
        });
    }

    @Test
    void investigationSurvivesSaturatedExecutor() {
        Executor rejectsEverything = task -> {
            throw new RejectedExecutionException("pool saturated");
        };
        InvestigationRequest request = InvestigationRequest.builder()
                .statistics(StatisticsRequest.builder()
                        .metric("latency")
                        .historical(List.of(MetricSample.of(1), MetricSample.of(2), MetricSample.of(3)))
                        .current(List.of(MetricSample.of(2)))
                        .build())
                .logs(LogAnalysisRequest.builder().build())
                .build();

        InvestigationReport report = service(new AntiPatternDetector(properties), rejectsEverything)
                .investigate(request);

        assertThat(report.getStatistics()).isNull();
        assertThat(report.getLogs()).isNull();
        assertThat(failedAnalyses(report.getFailures())).containsExactly("statistics", "log patterns");
    }

    @Test
    void emptyTraceIsRejectedBeforeAnyAnalysis() {
        assertThatThrownBy(() -> service().compareTraces(trace("empty"), slowTargetTrace()))
                .isInstanceOf(EmptyTraceException.class);
    }

    @Test
    void investigationKeepsPartialResults() {
        InvestigationRequest request = InvestigationRequest.builder()
                .traces(TraceComparisonRequest.builder()
                        .baseline(trace("empty"))
                        .target(slowTargetTrace())
                        .build())
                .statistics(StatisticsRequest.builder()
                        .metric("latency")
                        .historical(List.of(MetricSample.of(100), MetricSample.of(102), MetricSample.of(98),
                                MetricSample.of(101)))
                        .current(List.of(MetricSample.of(180), MetricSample.of(175)))
                        .build())
                .logs(LogAnalysisRequest.builder().build())
                .build();

        InvestigationReport report = service().investigate(request);

        assertThat(report.getComparison()).isNull();
        assertThat(report.getStatistics()).isNotNull();
        assertThat(report.getStatistics().getZScore().isAnomalous()).isTrue();
        assertThat(report.getLogs()).isNull();
        assertThat(failedAnalyses(report.getFailures()))
                .containsExactlyInAnyOrder("trace comparison", "log patterns");
    }

    @Test
    void investigationSkipsMissingParts() {
        InvestigationReport report = service().investigate(InvestigationRequest.builder()
                .traces(TraceComparisonRequest.builder()
                        .baseline(baselineTrace())
                        .target(slowTargetTrace())
                        .build())
                .build());

        assertThat(report.getComparison()).isNotNull();
        assertThat(report.getStatistics()).isNull();
        assertThat(report.getLogs()).isNull();
        assertThat(report.getFailures()).isEmpty();
    }

    @Test
    void variabilityNeedsEnoughTraces() {
        assertThatThrownBy(() -> service().analyzeVariability(List.of(baselineTrace())))
                .isInstanceOf(InsufficientDataException.class);
    }
}
