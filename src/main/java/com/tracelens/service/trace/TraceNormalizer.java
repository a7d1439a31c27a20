package com.tracelens.service.trace;

import com.tracelens.exception.EmptyTraceException;
import com.tracelens.model.DataQualityIssue;
import com.tracelens.model.DataQualityReport;
import com.tracelens.model.IssueKind;
import com.tracelens.model.Span;
import com.tracelens.model.SpanRecord;
import com.tracelens.model.SpanStatus;
import com.tracelens.model.TraceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * Turns a flat list of span records into a {@link SpanForest}, collecting data-quality issues on the way.
 * Only an empty trace is fatal; every other defect is reported and the affected span is kept or dropped.
 *
 * @author kiransahoo
 */
@Slf4j
@Service
public class TraceNormalizer {

    public SpanForest normalize(TraceRecord trace) {
        String traceId = trace != null ? trace.getTraceId() : null;
        if (trace == null || trace.getSpans() == null || trace.getSpans().isEmpty()) {
            throw new EmptyTraceException(traceId);
        }

        List<DataQualityIssue> issues = new ArrayList<>();
        List<Span> spans = new ArrayList<>();
        Map<String, Integer> positions = new HashMap<>();

        for (SpanRecord record : trace.getSpans()) {
            if (record == null || isBlank(record.getSpanId())) {
                issues.add(issue(IssueKind.MALFORMED_SPAN, null,
                        "Span without an id dropped" + (record != null && record.getName() != null
                                ? " (" + record.getName() + ")" : "")));
                continue;
            }
            String spanId = record.getSpanId();
            if (positions.containsKey(spanId)) {
                issues.add(issue(IssueKind.MALFORMED_SPAN, spanId, "Duplicate span id, later copy dropped"));
                continue;
            }

            Instant start = parseTimestamp(record.getStartTime());
            Instant end = parseTimestamp(record.getEndTime());
            boolean temporal = true;
            if (start == null || end == null) {
                issues.add(issue(IssueKind.MALFORMED_SPAN, spanId,
                        String.format("Missing or unparseable timestamp (start=%s, end=%s)",
                                record.getStartTime(), record.getEndTime())));
                temporal = false;
            } else if (end.isBefore(start)) {
                issues.add(issue(IssueKind.NEGATIVE_DURATION, spanId,
                        String.format("End %s precedes start %s", end, start)));
                temporal = false;
            }

            int position = spans.size();
            positions.put(spanId, position);
            spans.add(Span.builder()
                    .index(position)
                    .spanId(spanId)
                    .parentSpanId(isBlank(record.getParentSpanId()) ? null : record.getParentSpanId())
                    .name(record.getName() != null ? record.getName() : "unknown")
                    .start(start)
                    .end(end)
                    .status(SpanStatus.resolve(record.getStatus(), record.getAttributes()))
                    .attributes(record.getAttributes() != null ? record.getAttributes() : Map.of())
                    .temporal(temporal)
                    .build());
        }

        if (spans.isEmpty()) {
            throw new EmptyTraceException(traceId);
        }

        int n = spans.size();
        int[] parents = new int[n];
        Arrays.fill(parents, -1);
        List<List<Integer>> children = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            children.add(new ArrayList<>());
        }
        List<Integer> roots = new ArrayList<>();

        for (Span span : spans) {
            String parentId = span.getParentSpanId();
            if (parentId == null) {
                roots.add(span.getIndex());
                continue;
            }
            Integer parent = positions.get(parentId);
            if (parent == null) {
                issues.add(issue(IssueKind.ORPHANED_SPAN, span.getSpanId(),
                        "Parent " + parentId + " not found, treated as root"));
                roots.add(span.getIndex());
            } else {
                parents[span.getIndex()] = parent;
                children.get(parent).add(span.getIndex());
            }
        }

        // Breadth-first from the roots; whatever stays unvisited hangs off a parent cycle
        int[] depths = new int[n];
        Arrays.fill(depths, -1);
        List<Integer> bfsOrder = new ArrayList<>(n);
        Deque<Integer> queue = new ArrayDeque<>();
        for (int root : roots) {
            depths[root] = 0;
            queue.add(root);
        }
        while (!queue.isEmpty()) {
            int current = queue.poll();
            bfsOrder.add(current);
            for (int child : children.get(current)) {
                if (depths[child] < 0) {
                    depths[child] = depths[current] + 1;
                    queue.add(child);
                }
            }
        }
        for (int i = 0; i < n; i++) {
            if (depths[i] < 0) {
                issues.add(issue(IssueKind.CYCLIC_REFERENCE, spans.get(i).getSpanId(),
                        "Span is part of or below a parent cycle, excluded from traversal"));
            }
        }

        boolean[] clockSkewed = new boolean[n];
        for (int position : bfsOrder) {
            int parent = parents[position];
            if (parent < 0) continue;
            Span child = spans.get(position);
            Span parentSpan = spans.get(parent);
            if (!child.isTemporal() || !parentSpan.isTemporal()) continue;
            if (child.getStart().isBefore(parentSpan.getStart()) || child.getEnd().isAfter(parentSpan.getEnd())) {
                clockSkewed[position] = true;
                issues.add(issue(IssueKind.CLOCK_SKEW, child.getSpanId(),
                        String.format("Interval [%s, %s] falls outside parent %s [%s, %s]",
                                child.getStart(), child.getEnd(), parentSpan.getSpanId(),
                                parentSpan.getStart(), parentSpan.getEnd())));
            }
        }

        DataQualityReport quality = DataQualityReport.of(traceId, issues);
        if (!quality.isValid()) {
            log.debug("Trace {} has {} data-quality issues: {}", traceId, issues.size(), issues);
        }
        log.info("Normalized trace {}: {} spans, {} roots, {} issues", traceId, n, roots.size(), issues.size());

        return new SpanForest(traceId, spans, positions, parents, children, roots, bfsOrder,
                depths, clockSkewed, quality);
    }

    static Instant parseTimestamp(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value.trim(),
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private static DataQualityIssue issue(IssueKind kind, String spanId, String message) {
        return DataQualityIssue.builder()
                .kind(kind)
                .spanId(spanId)
                .message(message)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
