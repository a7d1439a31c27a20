package com.tracelens.service.trace;

import com.tracelens.model.CriticalPathNode;
import com.tracelens.model.CriticalPathReport;
import com.tracelens.model.Span;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Computes per-span self-time and the critical path of a span forest.
 *
 * <p>A span only takes part when it has valid timestamps, is not clock-skewed against its parent and
 * its parent takes part too. Self-time is the span's duration minus the merged coverage of its
 * participating children.
 *
 * <p>The critical path is built bottom-up. Under each span the blocking children are the heaviest set
 * of mutually non-overlapping children (weighted interval scheduling on chain value); a child that
 * overlaps a selected sibling ran concurrently and contributes nothing. When selecting and skipping a
 * child give the same total, the child is selected, so among children finishing together with equal
 * chains the one listed later in the trace wins.
 *
 * @author kiransahoo
 */
@Slf4j
@Service
public class CriticalPathAnalyzer {

    private static final double NANOS_PER_MS = 1_000_000.0;

    public CriticalPathReport analyze(SpanForest forest) {
        int n = forest.size();
        boolean[] eligible = resolveEligibility(forest);
        long[] selfNanos = computeSelfTimes(forest, eligible);

        // chain[i] = self time of i plus the best chain value its blocking children add
        long[] chain = new long[n];
        List<List<Integer>> selected = new ArrayList<>(Collections.nCopies(n, List.of()));
        List<Integer> order = forest.getBfsOrder();
        for (int k = order.size() - 1; k >= 0; k--) {
            int position = order.get(k);
            if (!eligible[position]) continue;
            Selection selection = selectBlocking(forest, eligibleOnly(forest.childrenOf(position), eligible), chain);
            chain[position] = selfNanos[position] + selection.value;
            selected.set(position, selection.chosen);
        }
        Selection top = selectBlocking(forest, eligibleOnly(forest.getRoots(), eligible), chain);

        double criticalPathMs = top.value / NANOS_PER_MS;
        double totalDurationMs = forest.getTotalDurationMs();
        long totalWorkNanos = 0;
        Map<String, Double> selfTimes = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            if (!eligible[i]) continue;
            totalWorkNanos += selfNanos[i];
            selfTimes.put(forest.span(i).getSpanId(), selfNanos[i] / NANOS_PER_MS);
        }
        double totalWorkMs = totalWorkNanos / NANOS_PER_MS;

        List<CriticalPathNode> nodes = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        pushReversed(stack, top.chosen);
        while (!stack.isEmpty()) {
            int position = stack.pop();
            Span span = forest.span(position);
            double selfMs = selfNanos[position] / NANOS_PER_MS;
            nodes.add(CriticalPathNode.builder()
                    .spanId(span.getSpanId())
                    .name(span.getName())
                    .durationMs(span.getDurationMs())
                    .selfTimeMs(selfMs)
                    .depth(forest.depthOf(position))
                    .contributionPct(totalDurationMs > 0 ? selfMs / totalDurationMs * 100 : 0.0)
                    .blockingContributionPct(criticalPathMs > 0 ? selfMs / criticalPathMs * 100 : 0.0)
                    .build());
            pushReversed(stack, selected.get(position));
        }

        CriticalPathNode bottleneck = nodes.stream()
                .max(Comparator.comparingDouble(CriticalPathNode::getSelfTimeMs))
                .orElse(null);

        double parallelismRatio = criticalPathMs > 0 ? Math.max(1.0, totalWorkMs / criticalPathMs) : 1.0;
        double parallelismPct = totalDurationMs > 0
                ? Math.max(0.0, (1.0 - criticalPathMs / totalDurationMs) * 100) : 0.0;

        log.debug("Critical path of trace {}: {} nodes, {}ms of {}ms, parallelism ratio {}",
                forest.getTraceId(), nodes.size(), criticalPathMs, totalDurationMs, parallelismRatio);

        return CriticalPathReport.builder()
                .nodes(nodes)
                .criticalPathDurationMs(criticalPathMs)
                .totalDurationMs(totalDurationMs)
                .totalWorkMs(totalWorkMs)
                .parallelismRatio(parallelismRatio)
                .parallelismPct(parallelismPct)
                .bottleneck(bottleneck)
                .selfTimes(selfTimes)
                .build();
    }

    /**
     * Self-time in milliseconds for every span that takes part in temporal analysis.
     */
    public Map<String, Double> selfTimes(SpanForest forest) {
        boolean[] eligible = resolveEligibility(forest);
        long[] selfNanos = computeSelfTimes(forest, eligible);
        Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < forest.size(); i++) {
            if (eligible[i]) {
                result.put(forest.span(i).getSpanId(), selfNanos[i] / NANOS_PER_MS);
            }
        }
        return result;
    }

    private boolean[] resolveEligibility(SpanForest forest) {
        boolean[] eligible = new boolean[forest.size()];
        for (int position : forest.getBfsOrder()) {
            Span span = forest.span(position);
            int parent = forest.parentOf(position);
            if (parent < 0) {
                eligible[position] = span.isTemporal();
            } else {
                eligible[position] = eligible[parent] && span.isTemporal() && !forest.isClockSkewed(position);
            }
        }
        return eligible;
    }

    private long[] computeSelfTimes(SpanForest forest, boolean[] eligible) {
        long[] self = new long[forest.size()];
        for (int position = 0; position < forest.size(); position++) {
            if (!eligible[position]) continue;
            Span span = forest.span(position);
            long duration = nanos(span, false) - nanos(span, true);
            long covered = mergedCoverage(forest, eligibleOnly(forest.childrenOf(position), eligible));
            self[position] = Math.max(0L, duration - covered);
        }
        return self;
    }

    private long mergedCoverage(SpanForest forest, List<Integer> children) {
        if (children.isEmpty()) {
            return 0L;
        }
        List<long[]> intervals = new ArrayList<>(children.size());
        for (int child : children) {
            Span span = forest.span(child);
            intervals.add(new long[]{nanos(span, true), nanos(span, false)});
        }
        intervals.sort(Comparator.comparingLong(a -> a[0]));

        long covered = 0L;
        long currentStart = intervals.get(0)[0];
        long currentEnd = intervals.get(0)[1];
        for (int i = 1; i < intervals.size(); i++) {
            long[] next = intervals.get(i);
            if (next[0] <= currentEnd) {
                currentEnd = Math.max(currentEnd, next[1]);
            } else {
                covered += currentEnd - currentStart;
                currentStart = next[0];
                currentEnd = next[1];
            }
        }
        return covered + (currentEnd - currentStart);
    }

    /**
     * Weighted interval scheduling over sibling spans: the non-overlapping subset with the largest total
     * chain value. Touching intervals do not overlap.
     */
    private Selection selectBlocking(SpanForest forest, List<Integer> candidates, long[] chain) {
        if (candidates.isEmpty()) {
            return new Selection(0L, List.of());
        }
        List<Integer> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.<Integer>comparingLong(p -> nanos(forest.span(p), false))
                .thenComparingLong(p -> nanos(forest.span(p), true))
                .thenComparingInt(p -> p));

        int m = sorted.size();
        long[] ends = new long[m];
        for (int j = 0; j < m; j++) {
            ends[j] = nanos(forest.span(sorted.get(j)), false);
        }

        long[] best = new long[m + 1];
        int[] predecessor = new int[m];
        boolean[] taken = new boolean[m];
        for (int j = 0; j < m; j++) {
            int position = sorted.get(j);
            predecessor[j] = lastEndingBy(ends, j, nanos(forest.span(position), true));
            long take = chain[position] + best[predecessor[j] + 1];
            long skip = best[j];
            taken[j] = take >= skip;
            best[j + 1] = taken[j] ? take : skip;
        }

        LinkedList<Integer> chosen = new LinkedList<>();
        int j = m - 1;
        while (j >= 0) {
            if (taken[j]) {
                chosen.addFirst(sorted.get(j));
                j = predecessor[j];
            } else {
                j--;
            }
        }
        return new Selection(best[m], chosen);
    }

    // Largest index below limit whose end is at or before the given start, or -1
    private int lastEndingBy(long[] ends, int limit, long start) {
        int lo = 0;
        int hi = limit - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (ends[mid] <= start) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return found;
    }

    private static List<Integer> eligibleOnly(List<Integer> positions, boolean[] eligible) {
        List<Integer> result = new ArrayList<>(positions.size());
        for (int position : positions) {
            if (eligible[position]) {
                result.add(position);
            }
        }
        return result;
    }

    private static void pushReversed(Deque<Integer> stack, List<Integer> positions) {
        for (int i = positions.size() - 1; i >= 0; i--) {
            stack.push(positions.get(i));
        }
    }

    private static long nanos(Span span, boolean start) {
        return SpanForest.toNanos(start ? span.getStart() : span.getEnd());
    }

    private static final class Selection {
        final long value;
        final List<Integer> chosen;

        Selection(long value, List<Integer> chosen) {
            this.value = value;
            this.chosen = chosen;
        }
    }
}
