package com.tracelens.service.trace;

import com.tracelens.config.AnalysisProperties;
import com.tracelens.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.tracelens.TraceFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RootCauseScorerTest {

    private final TraceNormalizer normalizer = new TraceNormalizer();
    private AnalysisProperties properties;
    private RootCauseScorer scorer;

    @BeforeEach
    void setUp() {
        properties = new AnalysisProperties();
        scorer = new RootCauseScorer(properties);
    }

    @Test
    void criticalPathDoublesTheScore() {
        double onPath = scorer.confidence(100, 1, true, 0);
        double offPath = scorer.confidence(100, 1, false, 0);

        assertThat(onPath).isGreaterThan(offPath);
        assertThat(onPath).isCloseTo(220.0, within(1e-9));
    }

    @Test
    void depthFactorIsCapped() {
        assertThat(scorer.confidence(100, 0, false, 0)).isCloseTo(100.0, within(1e-9));
        assertThat(scorer.confidence(100, 3, false, 0)).isCloseTo(130.0, within(1e-9));
        assertThat(scorer.confidence(100, 12, false, 0)).isCloseTo(150.0, within(1e-9));
    }

    @Test
    void selfTimeMultiplierNeedsMoreThanThirtyPercentOfTheDiff() {
        assertThat(scorer.confidence(100, 0, false, 30)).isCloseTo(100.0, within(1e-9));
        assertThat(scorer.confidence(100, 0, false, 31)).isCloseTo(130.0, within(1e-9));
    }

    @Test
    void regressedLeafOnCriticalPathIsTheLikelyRootCause() {
        TraceRecord baselineTrace = trace("baseline",
                span("root", null, "GET /checkout", 0, 100),
                span("svc", "root", "CheckoutService.process", 0, 100),
                span("a", "svc", "inventory.check", 0, 33),
                span("b", "svc", "pricing.compute", 33, 66),
                span("c", "svc", "tax.lookup", 66, 99));
        TraceRecord targetTrace = trace("target",
                span("root", null, "GET /checkout", 0, 400),
                span("svc", "root", "CheckoutService.process", 0, 400),
                span("a", "svc", "inventory.check", 0, 33),
                span("b", "svc", "pricing.compute", 33, 366),
                span("c", "svc", "tax.lookup", 366, 399));
        SpanForest baseline = normalizer.normalize(baselineTrace);
        SpanForest target = normalizer.normalize(targetTrace);
        CriticalPathReport targetPath = new CriticalPathAnalyzer().analyze(target);
        TraceDiff diff = new TraceComparator(properties).compare(baseline, target);

        List<RootCauseCandidate> candidates = scorer.score(diff.getLatencyDiffs(), target, targetPath);

        assertThat(baseline.getTotalDurationMs()).isEqualTo(100.0);
        assertThat(candidates).extracting(RootCauseCandidate::getSpanId).containsExactly("b", "svc", "root");
        RootCauseCandidate top = candidates.get(0);
        assertThat(top.isLikelyRootCause()).isTrue();
        assertThat(top.isOnCriticalPath()).isTrue();
        assertThat(top.getDepth()).isEqualTo(2);
        assertThat(top.getRank()).isEqualTo(1);
        assertThat(top.getConfidenceScore()).isCloseTo(300 * 1.2 * 2.0 * 1.3, within(1e-6));
        assertThat(top.getConfidenceScore())
                .isGreaterThan(candidates.get(1).getConfidenceScore());
        // The parents regressed by the same amount but did no extra work themselves
        assertThat(candidates.get(1).isLikelyRootCause()).isFalse();
        assertThat(candidates.get(2).isLikelyRootCause()).isFalse();
    }

    @Test
    void tiesPreferCriticalPathThenLargerDiff() {
        SpanForest target = normalizer.normalize(trace("target",
                span("x", null, "x", 0, 300),
                span("y", null, "y", 400, 500)));
        CriticalPathReport path = CriticalPathReport.builder()
                .nodes(List.of(CriticalPathNode.builder().spanId("y").name("y").build()))
                .selfTimes(Map.of("x", 0.0, "y", 0.0))
                .build();
        List<LatencyDiff> diffs = List.of(
                latency("x", 200),
                latency("y", 100));

        List<RootCauseCandidate> candidates = scorer.score(diffs, target, path);

        assertThat(candidates.get(0).getConfidenceScore()).isEqualTo(candidates.get(1).getConfidenceScore());
        assertThat(candidates).extracting(RootCauseCandidate::getSpanId).containsExactly("y", "x");
    }

    @Test
    void improvementsAreNotCandidatesAndOutputIsLimited() {
        properties.getRootCause().setMaxCandidates(2);
        SpanForest target = normalizer.normalize(trace("target",
                span("a", null, "a", 0, 100),
                span("b", null, "b", 100, 200),
                span("c", null, "c", 200, 300),
                span("d", null, "d", 300, 400)));
        CriticalPathReport path = new CriticalPathAnalyzer().analyze(target);
        List<LatencyDiff> diffs = List.of(latency("a", 50), latency("b", 40), latency("c", 30), latency("d", -80));

        List<RootCauseCandidate> candidates = scorer.score(diffs, target, path);

        assertThat(candidates).extracting(RootCauseCandidate::getSpanId).containsExactly("a", "b");
        assertThat(candidates.get(1).getRank()).isEqualTo(2);
    }

    private static LatencyDiff latency(String spanId, double diffMs) {
        return LatencyDiff.builder()
                .spanId(spanId)
                .spanName(spanId)
                .targetSpanId(spanId)
                .baselineMs(100)
                .targetMs(100 + diffMs)
                .diffMs(diffMs)
                .diffPercent(diffMs)
                .build();
    }
}
