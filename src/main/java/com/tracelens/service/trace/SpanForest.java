package com.tracelens.service.trace;

import com.tracelens.model.DataQualityReport;
import com.tracelens.model.Span;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Validated span forest of one trace. Spans live in a flat arena and refer to each other by arena
 * position, so traversals never chase object references.
 */
public final class SpanForest {

    private final String traceId;
    private final List<Span> spans;
    private final Map<String, Integer> positions;
    private final int[] parents;
    private final List<List<Integer>> children;
    private final List<Integer> roots;
    private final List<Integer> bfsOrder;
    private final int[] depths;
    private final boolean[] clockSkewed;
    private final DataQualityReport quality;

    SpanForest(String traceId, List<Span> spans, Map<String, Integer> positions, int[] parents,
               List<List<Integer>> children, List<Integer> roots, List<Integer> bfsOrder,
               int[] depths, boolean[] clockSkewed, DataQualityReport quality) {
        this.traceId = traceId;
        this.spans = Collections.unmodifiableList(spans);
        this.positions = Collections.unmodifiableMap(positions);
        this.parents = parents;
        this.children = children;
        this.roots = Collections.unmodifiableList(roots);
        this.bfsOrder = Collections.unmodifiableList(bfsOrder);
        this.depths = depths;
        this.clockSkewed = clockSkewed;
        this.quality = quality;
    }

    public String getTraceId() {
        return traceId;
    }

    public List<Span> getSpans() {
        return spans;
    }

    public int size() {
        return spans.size();
    }

    public Span span(int position) {
        return spans.get(position);
    }

    /**
     * Arena position of the span, or -1 when the id is unknown.
     */
    public int positionOf(String spanId) {
        Integer position = positions.get(spanId);
        return position != null ? position : -1;
    }

    /**
     * Arena position of the parent, or -1 for roots (including orphans).
     */
    public int parentOf(int position) {
        return parents[position];
    }

    public List<Integer> childrenOf(int position) {
        return Collections.unmodifiableList(children.get(position));
    }

    public List<Integer> getRoots() {
        return roots;
    }

    /**
     * Reachable spans, parents before children.
     */
    public List<Integer> getBfsOrder() {
        return bfsOrder;
    }

    /**
     * Depth below the root (roots are 0), or -1 when the span is unreachable.
     */
    public int depthOf(int position) {
        return depths[position];
    }

    public boolean isReachable(int position) {
        return depths[position] >= 0;
    }

    public boolean isClockSkewed(int position) {
        return clockSkewed[position];
    }

    public int getMaxDepth() {
        int max = 0;
        for (int d : depths) {
            max = Math.max(max, d);
        }
        return max;
    }

    public DataQualityReport getQuality() {
        return quality;
    }

    /**
     * Wall-clock extent of the trace: latest end minus earliest start over temporal roots.
     */
    public double getTotalDurationMs() {
        long minStart = Long.MAX_VALUE;
        long maxEnd = Long.MIN_VALUE;
        for (int root : roots) {
            Span span = spans.get(root);
            if (!span.isTemporal()) continue;
            minStart = Math.min(minStart, toNanos(span.getStart()));
            maxEnd = Math.max(maxEnd, toNanos(span.getEnd()));
        }
        if (minStart == Long.MAX_VALUE) {
            return 0.0;
        }
        return (maxEnd - minStart) / 1_000_000.0;
    }

    static long toNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }
}
