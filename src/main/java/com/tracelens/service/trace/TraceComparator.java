package com.tracelens.service.trace;

import com.tracelens.config.AnalysisProperties;
import com.tracelens.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Span-level diff of a baseline trace against a target trace.
 *
 * <p>Spans are matched by span id when the two traces share enough ids (both were captured with stable
 * ids), otherwise by name plus ordinal occurrence, where occurrences are ordered by start time.
 *
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TraceComparator {

    private final AnalysisProperties properties;

    public TraceDiff compare(SpanForest baseline, SpanForest target) {
        MatchStrategy strategy = chooseStrategy(baseline, target);
        int[] matchOf = strategy == MatchStrategy.SPAN_ID
                ? matchById(baseline, target)
                : matchByNameAndOrdinal(baseline, target);

        double noiseFloor = properties.getComparison().getNoiseFloorMs();
        List<LatencyDiff> latencyDiffs = new ArrayList<>();
        List<ErrorDiff> errorDiffs = new ArrayList<>();
        List<StructureDiff> structureDiffs = new ArrayList<>();
        boolean[] targetMatched = new boolean[target.size()];
        int matched = 0;

        for (int b = 0; b < baseline.size(); b++) {
            Span base = baseline.span(b);
            int t = matchOf[b];
            if (t < 0) {
                structureDiffs.add(StructureDiff.builder()
                        .spanId(base.getSpanId())
                        .spanName(base.getName())
                        .change(StructureChange.REMOVED)
                        .depth(baseline.depthOf(b))
                        .diffMs(-base.getDurationMs())
                        .diffPercent(-100.0)
                        .build());
                continue;
            }
            matched++;
            targetMatched[t] = true;
            Span other = target.span(t);
            boolean timed = base.isTemporal() && other.isTemporal();
            double diffMs = timed ? other.getDurationMs() - base.getDurationMs() : 0.0;
            double diffPercent = timed ? percentChange(base.getDurationMs(), diffMs) : 0.0;

            if (timed && Math.abs(diffMs) > noiseFloor) {
                latencyDiffs.add(LatencyDiff.builder()
                        .spanId(base.getSpanId())
                        .spanName(base.getName())
                        .targetSpanId(other.getSpanId())
                        .baselineMs(base.getDurationMs())
                        .targetMs(other.getDurationMs())
                        .diffMs(diffMs)
                        .diffPercent(diffPercent)
                        .build());
            }
            if (base.getStatus() != other.getStatus()) {
                errorDiffs.add(ErrorDiff.builder()
                        .spanId(base.getSpanId())
                        .spanName(base.getName())
                        .targetSpanId(other.getSpanId())
                        .baselineStatus(base.getStatus())
                        .targetStatus(other.getStatus())
                        .change(other.isError() ? ErrorChange.NEW_ERROR : ErrorChange.RESOLVED_ERROR)
                        .diffMs(diffMs)
                        .diffPercent(diffPercent)
                        .build());
            }
        }

        for (int t = 0; t < target.size(); t++) {
            if (targetMatched[t]) continue;
            Span added = target.span(t);
            structureDiffs.add(StructureDiff.builder()
                    .spanId(added.getSpanId())
                    .spanName(added.getName())
                    .change(StructureChange.ADDED)
                    .depth(target.depthOf(t))
                    .diffMs(added.getDurationMs())
                    .diffPercent(100.0)
                    .build());
        }

        latencyDiffs.sort((d1, d2) -> Double.compare(Math.abs(d2.getDiffMs()), Math.abs(d1.getDiffMs())));

        long added = structureDiffs.stream().filter(d -> d.getChange() == StructureChange.ADDED).count();
        StructureSummary summary = StructureSummary.builder()
                .baselineSpanCount(baseline.size())
                .targetSpanCount(target.size())
                .addedCount((int) added)
                .removedCount(structureDiffs.size() - (int) added)
                .baselineMaxDepth(baseline.getMaxDepth())
                .targetMaxDepth(target.getMaxDepth())
                .depthChange(target.getMaxDepth() - baseline.getMaxDepth())
                .build();

        log.info("Compared {} -> {} by {}: {} matched, {} latency, {} error, {} structure diffs",
                baseline.getTraceId(), target.getTraceId(), strategy, matched,
                latencyDiffs.size(), errorDiffs.size(), structureDiffs.size());

        return TraceDiff.builder()
                .matchStrategy(strategy)
                .matchedCount(matched)
                .latencyDiffs(latencyDiffs)
                .errorDiffs(errorDiffs)
                .structureDiffs(structureDiffs)
                .structure(summary)
                .baselineDurationMs(baseline.getTotalDurationMs())
                .targetDurationMs(target.getTotalDurationMs())
                .build();
    }

    MatchStrategy chooseStrategy(SpanForest baseline, SpanForest target) {
        int shared = 0;
        for (Span span : baseline.getSpans()) {
            if (target.positionOf(span.getSpanId()) >= 0) {
                shared++;
            }
        }
        int smaller = Math.min(baseline.size(), target.size());
        double required = properties.getComparison().getStableIdOverlapRatio() * smaller;
        return shared > 0 && shared >= required ? MatchStrategy.SPAN_ID : MatchStrategy.NAME_AND_ORDINAL;
    }

    private int[] matchById(SpanForest baseline, SpanForest target) {
        int[] matchOf = new int[baseline.size()];
        for (int b = 0; b < baseline.size(); b++) {
            matchOf[b] = target.positionOf(baseline.span(b).getSpanId());
        }
        return matchOf;
    }

    private int[] matchByNameAndOrdinal(SpanForest baseline, SpanForest target) {
        Map<String, List<Span>> baselineByName = occurrencesByName(baseline);
        Map<String, List<Span>> targetByName = occurrencesByName(target);

        int[] matchOf = new int[baseline.size()];
        Arrays.fill(matchOf, -1);
        for (Map.Entry<String, List<Span>> entry : baselineByName.entrySet()) {
            List<Span> candidates = targetByName.getOrDefault(entry.getKey(), List.of());
            List<Span> occurrences = entry.getValue();
            for (int k = 0; k < occurrences.size() && k < candidates.size(); k++) {
                matchOf[occurrences.get(k).getIndex()] = candidates.get(k).getIndex();
            }
        }
        return matchOf;
    }

    private Map<String, List<Span>> occurrencesByName(SpanForest forest) {
        Comparator<Span> byStart = Comparator
                .comparing((Span s) -> s.isTemporal() ? 0 : 1)
                .thenComparing(s -> s.getStart() != null ? s.getStart() : Instant.MAX)
                .thenComparingInt(Span::getIndex);

        Map<String, List<Span>> byName = new LinkedHashMap<>();
        for (Span span : forest.getSpans()) {
            byName.computeIfAbsent(span.getName(), k -> new ArrayList<>()).add(span);
        }
        byName.values().forEach(list -> list.sort(byStart));
        return byName;
    }

    private static double percentChange(double baselineMs, double diffMs) {
        return baselineMs > 0 ? diffMs / baselineMs * 100 : 0.0;
    }
}
