package com.tracelens.service.trace;

import com.tracelens.config.AnalysisProperties;
import com.tracelens.model.CriticalPathReport;
import com.tracelens.model.LatencyDiff;
import com.tracelens.model.RootCauseCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ranks latency regressions by how likely they are to cause the slowdown. Deeper spans, spans on the
 * target's critical path and spans whose own work explains the regression score higher.
 *
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RootCauseScorer {

    static final double DEPTH_STEP = 0.1;
    static final double MAX_DEPTH_FACTOR = 1.5;
    static final double CRITICAL_PATH_MULTIPLIER = 2.0;
    static final double SELF_TIME_MULTIPLIER = 1.3;
    static final double SELF_TIME_SHARE = 0.3;

    private final AnalysisProperties properties;

    public List<RootCauseCandidate> score(List<LatencyDiff> latencyDiffs, SpanForest target,
                                          CriticalPathReport targetCriticalPath) {
        List<RootCauseCandidate> candidates = new ArrayList<>();
        for (LatencyDiff diff : latencyDiffs) {
            if (!diff.isRegression()) continue;

            int position = target.positionOf(diff.getTargetSpanId());
            int depth = position >= 0 ? Math.max(0, target.depthOf(position)) : 0;
            double selfTime = targetCriticalPath.getSelfTimes().getOrDefault(diff.getTargetSpanId(), 0.0);
            boolean onCriticalPath = targetCriticalPath.contains(diff.getTargetSpanId());

            candidates.add(RootCauseCandidate.builder()
                    .spanId(diff.getSpanId())
                    .spanName(diff.getSpanName())
                    .baselineMs(diff.getBaselineMs())
                    .targetMs(diff.getTargetMs())
                    .diffMs(diff.getDiffMs())
                    .diffPercent(diff.getDiffPercent())
                    .onCriticalPath(onCriticalPath)
                    .selfTimeMs(selfTime)
                    .depth(depth)
                    .confidenceScore(confidence(diff.getDiffMs(), depth, onCriticalPath, selfTime))
                    .build());
        }

        candidates.sort(Comparator.comparingDouble(RootCauseCandidate::getConfidenceScore).reversed()
                .thenComparing(RootCauseCandidate::isOnCriticalPath, Comparator.reverseOrder())
                .thenComparing(Comparator.comparingDouble(RootCauseCandidate::getDiffMs).reversed())
                .thenComparing(RootCauseCandidate::getSpanId));

        AnalysisProperties.RootCause cfg = properties.getRootCause();
        List<RootCauseCandidate> ranked = new ArrayList<>();
        for (int i = 0; i < candidates.size() && i < cfg.getMaxCandidates(); i++) {
            RootCauseCandidate candidate = candidates.get(i);
            ranked.add(candidate.toBuilder()
                    .rank(i + 1)
                    .likelyRootCause(i == 0 || isLikely(candidate, cfg))
                    .build());
        }

        if (!ranked.isEmpty()) {
            log.info("Top root-cause candidate in trace {}: {} (+{}ms, score {})", target.getTraceId(),
                    ranked.get(0).getSpanName(), ranked.get(0).getDiffMs(), ranked.get(0).getConfidenceScore());
        }
        log.debug("Root-cause ranking: {}", ranked.stream()
                .map(c -> c.getSpanName() + "=" + c.getConfidenceScore())
                .collect(Collectors.joining(", ")));
        return ranked;
    }

    public double confidence(double diffMs, int depth, boolean onCriticalPath, double selfTimeMs) {
        double depthFactor = Math.min(1.0 + depth * DEPTH_STEP, MAX_DEPTH_FACTOR);
        double criticalPathMultiplier = onCriticalPath ? CRITICAL_PATH_MULTIPLIER : 1.0;
        double selfTimeMultiplier = selfTimeMs > SELF_TIME_SHARE * diffMs ? SELF_TIME_MULTIPLIER : 1.0;
        return diffMs * depthFactor * criticalPathMultiplier * selfTimeMultiplier;
    }

    // Beyond the top candidate, a high score alone is not enough: the span must block and own the delay
    private boolean isLikely(RootCauseCandidate candidate, AnalysisProperties.RootCause cfg) {
        return candidate.getConfidenceScore() > cfg.getLikelyScoreCutoff()
                && candidate.isOnCriticalPath()
                && candidate.getSelfTimeMs() > SELF_TIME_SHARE * candidate.getDiffMs();
    }
}
