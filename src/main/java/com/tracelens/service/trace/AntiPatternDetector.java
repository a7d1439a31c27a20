package com.tracelens.service.trace;

import com.tracelens.config.AnalysisProperties;
import com.tracelens.model.AntiPatternFinding;
import com.tracelens.model.CascadingTimeoutFinding;
import com.tracelens.model.ConnectionPoolFinding;
import com.tracelens.model.Impact;
import com.tracelens.model.NPlusOneFinding;
import com.tracelens.model.RetryStormFinding;
import com.tracelens.model.SerialChainFinding;
import com.tracelens.model.Span;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Detects trace anti-patterns: repeated sibling calls (N+1), serial chains of back-to-back spans, retry storms,
 * timeouts cascading up the call tree and slow connection-pool acquires.
 * Clock-skewed spans still count here; spans without timestamps only count toward N+1 and retry groups
 * and toward explicitly marked timeouts.
 *
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AntiPatternDetector {

    static final List<String> RETRY_INDICATORS = List.of("retry", "attempt", "backoff", "reconnect");
    static final List<String> TIMEOUT_INDICATORS =
            List.of("timeout", "deadline", "exceeded", "timed out", "context deadline");
    static final List<String> CONNECTION_INDICATORS = List.of("connection", "pool", "acquire", "checkout", "wait");

    private final AnalysisProperties properties;

    public List<AntiPatternFinding> detect(SpanForest forest) {
        List<NPlusOneFinding> nPlusOne = detectNPlusOne(forest);
        List<AntiPatternFinding> findings = new ArrayList<>(nPlusOne);
        findings.addAll(detectSerialChains(forest));

        // A same-parent repeat is already reported as N+1 unless its name says it is a retry
        Set<String> repeatedNames = nPlusOne.stream()
                .flatMap(f -> f.getSpanNames().stream())
                .collect(Collectors.toSet());
        detectRetryStorms(forest).stream()
                .filter(f -> !repeatedNames.contains(f.getSpanNames().get(0))
                        || containsAny(f.getSpanNames().get(0), RETRY_INDICATORS))
                .forEach(findings::add);
        findings.addAll(detectCascadingTimeouts(forest));
        findings.addAll(detectConnectionPoolIssues(forest));

        findings.sort((f1, f2) -> {
            int impactCompare = f2.getImpact().getWeight() - f1.getImpact().getWeight();
            if (impactCompare != 0) return impactCompare;
            return Double.compare(f2.getTotalDurationMs(), f1.getTotalDurationMs());
        });

        log.info("Trace {}: {} anti-pattern findings", forest.getTraceId(), findings.size());
        return findings;
    }

    public List<NPlusOneFinding> detectNPlusOne(SpanForest forest) {
        AnalysisProperties.NPlusOne cfg = properties.getAntiPattern().getRepeatedSiblings();

        // Siblings keyed by parent position then name; roots share the virtual parent -1
        Map<Integer, Map<String, List<Span>>> byParent = new LinkedHashMap<>();
        for (Span span : forest.getSpans()) {
            byParent.computeIfAbsent(forest.parentOf(span.getIndex()), k -> new LinkedHashMap<>())
                    .computeIfAbsent(span.getName(), k -> new ArrayList<>())
                    .add(span);
        }

        List<NPlusOneFinding> findings = new ArrayList<>();
        for (Map.Entry<Integer, Map<String, List<Span>>> parentEntry : byParent.entrySet()) {
            int parent = parentEntry.getKey();
            for (Map.Entry<String, List<Span>> entry : parentEntry.getValue().entrySet()) {
                List<Span> group = entry.getValue();
                if (group.size() < cfg.getMinCount()) continue;

                double total = group.stream().mapToDouble(Span::getDurationMs).sum();
                if (total <= cfg.getMinTotalMs()) continue;

                String name = entry.getKey();
                findings.add(NPlusOneFinding.builder()
                        .parentSpanId(parent >= 0 ? forest.span(parent).getSpanId() : null)
                        .spanNames(List.of(name))
                        .count(group.size())
                        .totalDurationMs(total)
                        .avgDurationMs(total / group.size())
                        .impact(total > cfg.getHighImpactMs() ? Impact.HIGH : Impact.MEDIUM)
                        .recommendation(nPlusOneRecommendation(name, group.size()))
                        .build());
                log.debug("N+1 candidate '{}' x{} ({}ms) under {}", name, group.size(), total, parent);
            }
        }
        return findings;
    }

    public List<SerialChainFinding> detectSerialChains(SpanForest forest) {
        AnalysisProperties.SerialChain cfg = properties.getAntiPattern().getSerialChain();

        List<Span> ordered = forest.getSpans().stream()
                .filter(Span::isTemporal)
                .sorted(Comparator.comparing(Span::getStart).thenComparingInt(Span::getIndex))
                .collect(Collectors.toList());

        List<SerialChainFinding> findings = new ArrayList<>();
        List<Span> run = new ArrayList<>();
        for (Span span : ordered) {
            if (run.isEmpty()) {
                run.add(span);
                continue;
            }
            Span previous = run.get(run.size() - 1);
            double gapMs = (SpanForest.toNanos(span.getStart()) - SpanForest.toNanos(previous.getEnd())) / 1_000_000.0;
            boolean nested = isParentChild(forest, previous, span);
            if (!nested && gapMs >= 0 && gapMs < cfg.getMaxGapMs()) {
                run.add(span);
            } else {
                flushChain(run, cfg, findings);
                run = new ArrayList<>();
                run.add(span);
            }
        }
        flushChain(run, cfg, findings);
        return findings;
    }

    /**
     * Groups spans by name across the whole trace. A group is a storm when enough of its calls follow each other
     * within the configured gap, or when the operation name itself marks a retry.
     */
    public List<RetryStormFinding> detectRetryStorms(SpanForest forest) {
        AnalysisProperties.RetryStorm cfg = properties.getAntiPattern().getRetryStorm();

        Map<String, List<Span>> byName = new LinkedHashMap<>();
        for (Span span : forest.getSpans()) {
            byName.computeIfAbsent(span.getName(), k -> new ArrayList<>()).add(span);
        }

        List<RetryStormFinding> findings = new ArrayList<>();
        for (Map.Entry<String, List<Span>> entry : byName.entrySet()) {
            String name = entry.getKey();
            List<Span> group = entry.getValue();
            boolean retryNamed = containsAny(name, RETRY_INDICATORS);
            if (group.size() < cfg.getMinRetries() && !retryNamed) continue;

            List<Span> ordered = group.stream()
                    .sorted(Comparator.comparing(Span::getStart, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                            .thenComparingInt(Span::getIndex))
                    .collect(Collectors.toList());

            int sequential = 1;
            for (int i = 1; i < ordered.size(); i++) {
                Span previous = ordered.get(i - 1);
                Span current = ordered.get(i);
                if (previous.getEnd() == null || current.getStart() == null) continue;
                double gapMs = (SpanForest.toNanos(current.getStart()) - SpanForest.toNanos(previous.getEnd())) / 1_000_000.0;
                if (gapMs >= 0 && gapMs < cfg.getMaxGapMs()) {
                    sequential++;
                }
            }
            if (sequential < cfg.getMinRetries() && !retryNamed) continue;

            boolean backoff = hasBackoff(ordered, cfg.getBackoffFactor());
            findings.add(RetryStormFinding.builder()
                    .spanIds(ordered.stream().map(Span::getSpanId).collect(Collectors.toList()))
                    .spanNames(List.of(name))
                    .count(group.size())
                    .sequentialCount(sequential)
                    .totalDurationMs(group.stream().mapToDouble(Span::getDurationMs).sum())
                    .exponentialBackoff(backoff)
                    .impact(group.size() >= cfg.getHighImpactCount() ? Impact.HIGH : Impact.MEDIUM)
                    .recommendation(retryStormRecommendation(name, group.size(), backoff))
                    .build());
            log.debug("Retry storm candidate '{}' x{} ({} sequential)", name, group.size(), sequential);
        }
        return findings;
    }

    /**
     * Follows every timed-out span up through its ancestors. Chains contained in a longer chain are dropped.
     */
    public List<CascadingTimeoutFinding> detectCascadingTimeouts(SpanForest forest) {
        AnalysisProperties.CascadingTimeout cfg = properties.getAntiPattern().getCascadingTimeout();

        boolean[] timedOut = new boolean[forest.size()];
        for (Span span : forest.getSpans()) {
            timedOut[span.getIndex()] = isExplicitTimeout(span) || span.getDurationMs() >= cfg.getTimeoutThresholdMs();
        }

        List<List<Integer>> chains = new ArrayList<>();
        for (Span span : forest.getSpans()) {
            if (!timedOut[span.getIndex()]) continue;
            List<Integer> chain = new ArrayList<>();
            chain.add(span.getIndex());
            int current = forest.parentOf(span.getIndex());
            for (int steps = 0; current >= 0 && steps < forest.size(); steps++) {
                if (timedOut[current]) {
                    chain.add(current);
                }
                current = forest.parentOf(current);
            }
            if (chain.size() >= cfg.getMinChainLength()) {
                chains.add(chain);
            }
        }
        chains.sort(Comparator.comparingInt((List<Integer> c) -> c.size()).reversed());

        List<Set<Integer>> kept = new ArrayList<>();
        List<CascadingTimeoutFinding> findings = new ArrayList<>();
        for (List<Integer> chain : chains) {
            Set<Integer> members = new HashSet<>(chain);
            if (kept.stream().anyMatch(k -> k.containsAll(members))) continue;
            kept.add(members);

            List<Span> spans = chain.stream().map(forest::span).collect(Collectors.toList());
            findings.add(CascadingTimeoutFinding.builder()
                    .spanIds(spans.stream().map(Span::getSpanId).collect(Collectors.toList()))
                    .spanNames(spans.stream().map(Span::getName).collect(Collectors.toList()))
                    .count(spans.size())
                    .totalDurationMs(spans.stream().mapToDouble(Span::getDurationMs).sum())
                    .originSpanName(spans.get(0).getName())
                    .impact(Impact.CRITICAL)
                    .recommendation(String.format("Timeout in '%s' cascaded up %d levels of callers - propagate "
                            + "deadlines and keep child timeouts shorter than their parent's",
                            spans.get(0).getName(), spans.size() - 1))
                    .build());
        }
        if (!findings.isEmpty()) {
            log.debug("Trace {}: {} cascading timeout chains", forest.getTraceId(), findings.size());
        }
        return findings;
    }

    public List<ConnectionPoolFinding> detectConnectionPoolIssues(SpanForest forest) {
        double threshold = properties.getAntiPattern().getConnectionPool().getWaitThresholdMs();

        List<Span> slow = forest.getSpans().stream()
                .filter(span -> containsAny(span.getName(), CONNECTION_INDICATORS))
                .filter(span -> span.isTemporal() && span.getDurationMs() >= threshold)
                .collect(Collectors.toList());
        double totalWait = slow.stream().mapToDouble(Span::getDurationMs).sum();
        boolean exhausted = !slow.isEmpty() && totalWait >= threshold * 3;

        List<ConnectionPoolFinding> findings = new ArrayList<>();
        for (Span span : slow) {
            double wait = span.getDurationMs();
            Impact impact = wait >= threshold * 5 ? Impact.HIGH : wait >= threshold * 2 ? Impact.MEDIUM : Impact.LOW;
            findings.add(ConnectionPoolFinding.builder()
                    .spanIds(List.of(span.getSpanId()))
                    .spanNames(List.of(span.getName()))
                    .count(1)
                    .totalDurationMs(wait)
                    .waitDurationMs(wait)
                    .poolSize(attribute(span, "pool.size", "db.pool_size"))
                    .activeConnections(attribute(span, "pool.active", "db.active_connections"))
                    .waitingRequests(attribute(span, "pool.waiting", "db.waiting_requests"))
                    .impact(impact)
                    .recommendation(connectionPoolRecommendation(span.getName(), wait, exhausted, totalWait))
                    .build());
        }
        return findings;
    }

    private void flushChain(List<Span> run, AnalysisProperties.SerialChain cfg, List<SerialChainFinding> findings) {
        if (run.size() < cfg.getMinLength()) return;

        double total = run.stream().mapToDouble(Span::getDurationMs).sum();
        if (total <= cfg.getMinTotalMs()) return;

        double longest = run.stream().mapToDouble(Span::getDurationMs).max().orElse(0);
        List<String> names = run.stream().map(Span::getName).collect(Collectors.toList());
        findings.add(SerialChainFinding.builder()
                .spanIds(run.stream().map(Span::getSpanId).collect(Collectors.toList()))
                .spanNames(names)
                .count(run.size())
                .totalDurationMs(total)
                .potentialSavingsMs(total - longest)
                .impact(total > cfg.getHighImpactMs() ? Impact.HIGH : Impact.MEDIUM)
                .recommendation(serialChainRecommendation(names, total - longest))
                .build());
    }

    private boolean isParentChild(SpanForest forest, Span a, Span b) {
        return forest.parentOf(b.getIndex()) == a.getIndex() || forest.parentOf(a.getIndex()) == b.getIndex();
    }

    private String nPlusOneRecommendation(String name, int count) {
        return switch (OperationType.classify(name)) {
            case DATABASE -> String.format(
                    "'%s' runs %d times under the same parent - batch the queries or use a join / IN clause", name, count);
            case HTTP -> String.format(
                    "'%s' is called %d times in a row - use a bulk endpoint or fetch the items in one request", name, count);
            case CACHE -> String.format(
                    "'%s' is hit %d times individually - use a multi-get / pipelined lookup", name, count);
            case MESSAGING -> String.format(
                    "'%s' is sent %d times separately - publish in batches", name, count);
            case OTHER -> String.format(
                    "'%s' repeats %d times under the same parent - consider batching or caching the result", name, count);
        };
    }

    private String serialChainRecommendation(List<String> names, double savingsMs) {
        Set<OperationType> types = names.stream().map(OperationType::classify).collect(Collectors.toSet());
        String base = String.format("%d operations run back-to-back - parallelize the independent calls "
                + "(up to %.1fms could be saved)", names.size(), savingsMs);
        if (types.contains(OperationType.HTTP)) {
            return base + "; issue the downstream HTTP calls concurrently";
        }
        if (types.contains(OperationType.DATABASE)) {
            return base + "; combine or run the queries concurrently";
        }
        return base;
    }

    private boolean hasBackoff(List<Span> ordered, double factor) {
        if (ordered.size() < 3) return false;
        for (int i = 0; i < ordered.size() - 1; i++) {
            if (ordered.get(i).getDurationMs() > ordered.get(i + 1).getDurationMs() * factor) {
                return false;
            }
        }
        return true;
    }

    private boolean isExplicitTimeout(Span span) {
        if (containsAny(span.getName(), TIMEOUT_INDICATORS)) return true;
        Map<String, Object> attributes = span.getAttributes();
        if (attributes == null || attributes.isEmpty()) return false;
        if ("timeout".equals(String.valueOf(attributes.get("error.type")))) return true;
        String labels = attributes.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
        return containsAny(labels, TIMEOUT_INDICATORS);
    }

    private static String attribute(Span span, String... keys) {
        if (span.getAttributes() == null) return null;
        for (String key : keys) {
            Object value = span.getAttributes().get(key);
            if (value != null) {
                return value.toString();
            }
        }
        return null;
    }

    static boolean containsAny(String text, List<String> indicators) {
        if (text == null) return false;
        String lower = text.toLowerCase();
        return indicators.stream().anyMatch(lower::contains);
    }

    private String retryStormRecommendation(String name, int count, boolean backoff) {
        String base = String.format("'%s' was attempted %d times in quick succession - check the health of the "
                + "downstream service and add a circuit breaker if there is none", name, count);
        return backoff ? base : base + "; retry with exponential backoff and jitter";
    }

    private String connectionPoolRecommendation(String name, double waitMs, boolean exhausted, double totalWaitMs) {
        String base = String.format("'%s' waited %.1fms for a connection - increase the pool size or shorten "
                + "connection hold times and make sure connections are released", name, waitMs);
        if (exhausted) {
            return base + String.format("; %.1fms of total wait in this trace suggests the pool is exhausted", totalWaitMs);
        }
        return base;
    }
}
