package com.tracelens.service;

import com.tracelens.config.AnalysisProperties;
import com.tracelens.model.*;
import com.tracelens.service.log.LogPatternService;
import com.tracelens.service.stats.SpanVariabilityAnalyzer;
import com.tracelens.service.stats.StatisticalAnomalyEngine;
import com.tracelens.service.trace.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point for every analysis. Independent analyses run concurrently on the analysis executor;
 * one that fails or times out is recorded on the report while the others still complete.
 *
 * @author kiransahoo
 */
@Slf4j
@Service
public class TelemetryAnalysisService {

    private final TraceNormalizer normalizer;
    private final CriticalPathAnalyzer criticalPathAnalyzer;
    private final AntiPatternDetector antiPatternDetector;
    private final TraceComparator traceComparator;
    private final RootCauseScorer rootCauseScorer;
    private final StatisticalAnomalyEngine statisticsEngine;
    private final SpanVariabilityAnalyzer variabilityAnalyzer;
    private final LogPatternService logPatternService;
    private final Executor executor;
    private final AnalysisProperties properties;

    public TelemetryAnalysisService(TraceNormalizer normalizer,
                                    CriticalPathAnalyzer criticalPathAnalyzer,
                                    AntiPatternDetector antiPatternDetector,
                                    TraceComparator traceComparator,
                                    RootCauseScorer rootCauseScorer,
                                    StatisticalAnomalyEngine statisticsEngine,
                                    SpanVariabilityAnalyzer variabilityAnalyzer,
                                    LogPatternService logPatternService,
                                    @Qualifier("analysisExecutor") Executor executor,
                                    AnalysisProperties properties) {
        this.normalizer = normalizer;
        this.criticalPathAnalyzer = criticalPathAnalyzer;
        this.antiPatternDetector = antiPatternDetector;
        this.traceComparator = traceComparator;
        this.rootCauseScorer = rootCauseScorer;
        this.statisticsEngine = statisticsEngine;
        this.variabilityAnalyzer = variabilityAnalyzer;
        this.logPatternService = logPatternService;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * Diffs the target trace against the baseline. Throws {@link com.tracelens.exception.EmptyTraceException}
     * when either trace has no usable spans; every other problem ends up in the report.
     */
    public ComparisonReport compareTraces(TraceRecord baselineTrace, TraceRecord targetTrace) {
        SpanForest baseline = normalizer.normalize(baselineTrace);
        SpanForest target = normalizer.normalize(targetTrace);
        long deadline = deadline();
        List<AnalysisFailure> failures = new ArrayList<>();

        CompletableFuture<CriticalPathReport> baselinePathFuture =
                submit(() -> criticalPathAnalyzer.analyze(baseline));
        CompletableFuture<CriticalPathReport> targetPathFuture =
                submit(() -> criticalPathAnalyzer.analyze(target));
        CompletableFuture<List<AntiPatternFinding>> antiPatternFuture =
                submit(() -> antiPatternDetector.detect(target));
        CompletableFuture<TraceDiff> diffFuture =
                submit(() -> traceComparator.compare(baseline, target));

        CriticalPathReport baselinePath = await(baselinePathFuture, "baseline critical path", failures, deadline);
        CriticalPathReport targetPath = await(targetPathFuture, "target critical path", failures, deadline);
        List<AntiPatternFinding> antiPatterns = await(antiPatternFuture, "anti-patterns", failures, deadline);
        TraceDiff diff = await(diffFuture, "trace diff", failures, deadline);

        List<RootCauseCandidate> candidates = null;
        if (diff != null && targetPath != null) {
            try {
                candidates = rootCauseScorer.score(diff.getLatencyDiffs(), target, targetPath);
            } catch (RuntimeException e) {
                log.warn("Root-cause scoring failed: {}", e.getMessage(), e);
                failures.add(new AnalysisFailure("root cause", describe(e)));
            }
        } else {
            failures.add(new AnalysisFailure("root cause", "skipped: trace diff or target critical path unavailable"));
        }

        double baselineDuration = baseline.getTotalDurationMs();
        double targetDuration = target.getTotalDurationMs();
        double durationDiff = targetDuration - baselineDuration;

        log.info("Comparison {} -> {} done: {}ms -> {}ms, {} failures",
                baseline.getTraceId(), target.getTraceId(), baselineDuration, targetDuration, failures.size());

        return ComparisonReport.builder()
                .baselineTraceId(baseline.getTraceId())
                .targetTraceId(target.getTraceId())
                .baselineDurationMs(baselineDuration)
                .targetDurationMs(targetDuration)
                .durationDiffMs(durationDiff)
                .durationDiffPercent(baselineDuration > 0 ? durationDiff / baselineDuration * 100 : 0.0)
                .diff(diff)
                .baselineCriticalPath(baselinePath)
                .targetCriticalPath(targetPath)
                .antiPatterns(antiPatterns)
                .rootCauseCandidates(candidates)
                .baselineQuality(baseline.getQuality())
                .targetQuality(target.getQuality())
                .failures(failures)
                .build();
    }

    public DataQualityReport assessQuality(TraceRecord trace) {
        return normalizer.normalize(trace).getQuality();
    }

    public CriticalPathReport analyzeCriticalPath(TraceRecord trace) {
        return criticalPathAnalyzer.analyze(normalizer.normalize(trace));
    }

    public List<AntiPatternFinding> detectAntiPatterns(TraceRecord trace) {
        return antiPatternDetector.detect(normalizer.normalize(trace));
    }

    public StatisticsReport analyzeStatistics(StatisticsRequest request) {
        return statisticsEngine.analyze(request);
    }

    public VariabilityReport analyzeVariability(List<TraceRecord> traces) {
        return variabilityAnalyzer.analyzePatterns(normalizeAll(traces));
    }

    public LatencyAnomalyReport detectLatencyAnomalies(List<TraceRecord> baselines, TraceRecord target) {
        return variabilityAnalyzer.detectLatencyAnomalies(normalizeAll(baselines), normalizer.normalize(target));
    }

    public LogReport analyzeLogs(LogAnalysisRequest request) {
        return logPatternService.analyze(request);
    }

    /**
     * Runs whatever parts of the request are present side by side and returns the results that finished
     * before the timeout.
     */
    public InvestigationReport investigate(InvestigationRequest request) {
        long deadline = deadline();
        List<AnalysisFailure> failures = new ArrayList<>();

        CompletableFuture<StatisticsReport> statisticsFuture = request.getStatistics() != null
                ? submit(() -> analyzeStatistics(request.getStatistics()))
                : null;
        CompletableFuture<LogReport> logsFuture = request.getLogs() != null
                ? submit(() -> analyzeLogs(request.getLogs()))
                : null;

        // The comparison fans out on the executor itself, so it runs on the calling thread
        ComparisonReport comparison = null;
        if (request.getTraces() != null) {
            try {
                comparison = compareTraces(request.getTraces().getBaseline(), request.getTraces().getTarget());
            } catch (RuntimeException e) {
                log.warn("Analysis 'trace comparison' failed: {}", e.getMessage());
                failures.add(new AnalysisFailure("trace comparison", describe(e)));
            }
        }
        StatisticsReport statistics = statisticsFuture != null
                ? await(statisticsFuture, "statistics", failures, deadline) : null;
        LogReport logs = logsFuture != null
                ? await(logsFuture, "log patterns", failures, deadline) : null;

        log.info("Investigation finished with {} failures", failures.size());
        return InvestigationReport.builder()
                .comparison(comparison)
                .statistics(statistics)
                .logs(logs)
                .failures(failures)
                .build();
    }

    private List<SpanForest> normalizeAll(List<TraceRecord> traces) {
        if (traces == null) {
            return List.of();
        }
        return traces.stream().map(normalizer::normalize).collect(Collectors.toList());
    }

    // A saturated pool fails only this analysis; await() records it like any other failure
    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Analysis executor rejected a task: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> T await(CompletableFuture<T> future, String analysis, List<AnalysisFailure> failures, long deadline) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Analysis '{}' timed out", analysis);
            failures.add(new AnalysisFailure(analysis, "timed out after " + properties.getExecutor().getTimeout()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Analysis '{}' failed: {}", analysis, cause.getMessage(), cause);
            failures.add(new AnalysisFailure(analysis, describe(cause)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failures.add(new AnalysisFailure(analysis, "interrupted"));
        }
        return null;
    }

    private long deadline() {
        return System.nanoTime() + properties.getExecutor().getTimeout().toNanos();
    }

    private static String describe(Throwable error) {
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
