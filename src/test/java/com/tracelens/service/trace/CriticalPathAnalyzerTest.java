package com.tracelens.service.trace;

import com.tracelens.model.CriticalPathNode;
import com.tracelens.model.CriticalPathReport;
import com.tracelens.model.TraceRecord;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static com.tracelens.TraceFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CriticalPathAnalyzerTest {

    private final TraceNormalizer normalizer = new TraceNormalizer();
    private final CriticalPathAnalyzer analyzer = new CriticalPathAnalyzer();

    private CriticalPathReport analyze(TraceRecord trace) {
        return analyzer.analyze(normalizer.normalize(trace));
    }

    @Test
    void serialChildrenFormTheWholePath() {
        CriticalPathReport report = analyze(trace("t",
                span("root", null, "root", 0, 100),
                span("a", "root", "a", 0, 30),
                span("b", "root", "b", 30, 60),
                span("c", "root", "c", 60, 100)));

        assertThat(report.getNodes()).extracting(CriticalPathNode::getSpanId)
                .containsExactly("root", "a", "b", "c");
        assertThat(report.getCriticalPathDurationMs()).isEqualTo(100.0);
        assertThat(report.getTotalWorkMs()).isEqualTo(100.0);
        assertThat(report.getParallelismRatio()).isEqualTo(1.0);
        assertThat(report.getParallelismPct()).isEqualTo(0.0);
        assertThat(report.getSelfTimes()).containsEntry("root", 0.0).containsEntry("c", 40.0);
    }

    @Test
    void concurrentChildrenRaiseParallelismRatio() {
        CriticalPathReport report = analyze(trace("t",
                span("root", null, "root", 0, 100),
                span("a", "root", "fetch.users", 0, 80),
                span("b", "root", "fetch.orders", 10, 90)));

        // children cover [0, 90], leaving 10ms of own work on the root
        assertThat(report.getSelfTimes().get("root")).isEqualTo(10.0);
        assertThat(report.getCriticalPathDurationMs()).isEqualTo(90.0);
        assertThat(report.getTotalWorkMs()).isEqualTo(170.0);
        assertThat(report.getParallelismRatio()).isGreaterThan(1.0);
        assertThat(report.getParallelismPct()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void laterListedChildWinsWhenChainsTie() {
        CriticalPathReport report = analyze(trace("t",
                span("root", null, "root", 0, 100),
                span("first", "root", "replica-1", 10, 90),
                span("second", "root", "replica-2", 10, 90)));

        assertThat(report.getNodes()).extracting(CriticalPathNode::getSpanId)
                .containsExactly("root", "second");
    }

    @Test
    void longerChainBeatsLaterEndingChild() {
        // x then y back to back outweigh the single long z that ends last
        CriticalPathReport report = analyze(trace("t",
                span("root", null, "root", 0, 100),
                span("x", "root", "x", 0, 50),
                span("y", "root", "y", 50, 95),
                span("z", "root", "z", 20, 100)));

        assertThat(report.getNodes()).extracting(CriticalPathNode::getSpanId)
                .containsExactly("root", "x", "y");
        assertThat(report.getCriticalPathDurationMs()).isEqualTo(95.0);
    }

    @Test
    void selfTimeNeverNegativeWithFullyOverlappingChildren() {
        CriticalPathReport report = analyze(trace("t",
                span("root", null, "root", 0, 50),
                span("a", "root", "a", 0, 50),
                span("b", "root", "b", 0, 50),
                span("c", "root", "c", 10, 40)));

        assertThat(report.getSelfTimes().values()).allMatch(v -> v >= 0.0);
        assertThat(report.getSelfTimes().get("root")).isEqualTo(0.0);
    }

    @Test
    void nestedChildrenAreSubtractedOnlyFromDirectParent() {
        CriticalPathReport report = analyze(trace("t",
                span("root", null, "root", 0, 100),
                span("a", "root", "a", 10, 60),
                span("a1", "a", "a1", 20, 30)));

        assertThat(report.getSelfTimes().get("a")).isEqualTo(40.0);
        assertThat(report.getSelfTimes().get("root")).isEqualTo(50.0);
        assertThat(report.getCriticalPathDurationMs()).isEqualTo(100.0);
    }

    @Test
    void pathIsBoundedByTotalDurationAndMaxSelfTime() {
        CriticalPathReport report = analyze(trace("t",
                span("r1", null, "gateway", 0, 120),
                span("r2", null, "async.worker", 60, 200),
                span("a", "r1", "auth", 5, 25),
                span("b", "r1", "db.query", 20, 90),
                span("c", "r1", "cache.get", 30, 35),
                span("d", "r2", "kafka.publish", 70, 190),
                span("e", "d", "serialize", 75, 80)));

        double maxSelf = report.getSelfTimes().values().stream().mapToDouble(Double::doubleValue).max().orElse(0);
        assertThat(report.getCriticalPathDurationMs()).isLessThanOrEqualTo(report.getTotalDurationMs());
        assertThat(report.getCriticalPathDurationMs()).isGreaterThanOrEqualTo(maxSelf);
        assertThat(report.getParallelismRatio()).isGreaterThanOrEqualTo(1.0);
        assertThat(report.getTotalDurationMs()).isEqualTo(200.0);
    }

    @Test
    void clockSkewedAndUntimedSpansAreExcluded() {
        CriticalPathReport report = analyze(trace("t",
                span("root", null, "root", 0, 100),
                span("skewed", "root", "skewed", 50, 150),
                span("under", "skewed", "under", 60, 70),
                untimedSpan("untimed", "root", "untimed")));

        assertThat(report.getSelfTimes()).containsOnlyKeys("root");
        assertThat(report.getSelfTimes().get("root")).isEqualTo(100.0);
        assertThat(report.getNodes()).extracting(CriticalPathNode::getSpanId).containsExactly("root");
    }

    @Test
    void reportsBottleneckAndContributions() {
        CriticalPathReport report = analyze(trace("t",
                span("root", null, "root", 0, 200),
                span("a", "root", "a", 0, 50),
                span("b", "root", "b", 50, 200)));

        assertThat(report.getBottleneck().getSpanId()).isEqualTo("b");
        CriticalPathNode b = report.getNodes().stream()
                .filter(n -> n.getSpanId().equals("b"))
                .collect(Collectors.toList()).get(0);
        assertThat(b.getContributionPct()).isCloseTo(75.0, within(1e-9));
        assertThat(b.getBlockingContributionPct()).isCloseTo(75.0, within(1e-9));
        assertThat(b.getDepth()).isEqualTo(1);
    }

    @Test
    void trackedTimesKeepSubMillisecondPrecision() {
        TraceRecord trace = trace("t", span("root", null, "root", 0, 10));
        trace.getSpans().get(0).setEndTime("2024-05-01T12:00:00.010500Z");

        CriticalPathReport report = analyze(trace);

        assertThat(report.getCriticalPathDurationMs()).isCloseTo(10.5, within(1e-9));
    }
}
