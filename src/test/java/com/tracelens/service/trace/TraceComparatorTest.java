package com.tracelens.service.trace;

import com.tracelens.config.AnalysisProperties;
import com.tracelens.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.tracelens.TraceFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TraceComparatorTest {

    private final TraceNormalizer normalizer = new TraceNormalizer();
    private TraceComparator comparator;

    @BeforeEach
    void setUp() {
        comparator = new TraceComparator(new AnalysisProperties());
    }

    @Test
    void matchesByStableSpanIds() {
        SpanForest baseline = normalizer.normalize(trace("base",
                span("root", null, "root", 0, 100),
                span("db", "root", "db.query", 10, 40),
                span("cache", "root", "cache.get", 40, 45)));
        SpanForest target = normalizer.normalize(trace("target",
                span("root", null, "root", 0, 150),
                span("db", "root", "db.query", 10, 100),
                span("cache", "root", "cache.get", 100, 105)));

        TraceDiff diff = comparator.compare(baseline, target);

        assertThat(diff.getMatchStrategy()).isEqualTo(MatchStrategy.SPAN_ID);
        assertThat(diff.getMatchedCount()).isEqualTo(3);
        assertThat(diff.getLatencyDiffs()).extracting(LatencyDiff::getSpanId).containsExactly("db", "root");
        LatencyDiff db = diff.getLatencyDiffs().get(0);
        assertThat(db.getDiffMs()).isEqualTo(60.0);
        assertThat(db.getDiffPercent()).isCloseTo(200.0, within(1e-9));
        assertThat(db.isRegression()).isTrue();
        assertThat(diff.getStructureDiffs()).isEmpty();
    }

    @Test
    void differencesWithinNoiseFloorAreIgnored() {
        SpanForest baseline = normalizer.normalize(trace("base", span("root", null, "root", 0, 100)));
        SpanForest target = normalizer.normalize(trace("target", span("root", null, "root", 0, 101)));

        assertThat(comparator.compare(baseline, target).getLatencyDiffs()).isEmpty();
    }

    @Test
    void reportsStatusChanges() {
        SpanForest baseline = normalizer.normalize(trace("base",
                span("root", null, "root", 0, 100),
                span("pay", "root", "payment.charge", 10, 50),
                errorSpan("retry", "root", "retry", 50, 60)));
        SpanForest target = normalizer.normalize(trace("target",
                span("root", null, "root", 0, 100),
                errorSpan("pay", "root", "payment.charge", 10, 50),
                span("retry", "root", "retry", 50, 60)));

        TraceDiff diff = comparator.compare(baseline, target);

        assertThat(diff.getErrorDiffs()).hasSize(2);
        assertThat(diff.getErrorDiffs().get(0).getSpanId()).isEqualTo("pay");
        assertThat(diff.getErrorDiffs().get(0).getChange()).isEqualTo(ErrorChange.NEW_ERROR);
        assertThat(diff.getErrorDiffs().get(1).getChange()).isEqualTo(ErrorChange.RESOLVED_ERROR);
        assertThat(diff.getLatencyDiffs()).isEmpty();
    }

    @Test
    void reportsAddedAndRemovedSpans() {
        SpanForest baseline = normalizer.normalize(trace("base",
                span("root", null, "root", 0, 100),
                span("legacy", "root", "legacy.lookup", 10, 30)));
        SpanForest target = normalizer.normalize(trace("target",
                span("root", null, "root", 0, 100),
                span("new", "root", "feature.flags", 10, 20),
                span("deep", "new", "flags.fetch", 12, 18)));

        TraceDiff diff = comparator.compare(baseline, target);

        assertThat(diff.getStructureDiffs()).hasSize(3);
        StructureDiff removed = diff.getStructureDiffs().get(0);
        assertThat(removed.getChange()).isEqualTo(StructureChange.REMOVED);
        assertThat(removed.getDiffMs()).isEqualTo(-20.0);
        assertThat(removed.getDiffPercent()).isEqualTo(-100.0);
        StructureDiff added = diff.getStructureDiffs().get(1);
        assertThat(added.getChange()).isEqualTo(StructureChange.ADDED);
        assertThat(added.getSpanId()).isEqualTo("new");
        assertThat(added.getDiffMs()).isEqualTo(10.0);
        assertThat(diff.getStructure().getAddedCount()).isEqualTo(2);
        assertThat(diff.getStructure().getRemovedCount()).isEqualTo(1);
        assertThat(diff.getStructure().getDepthChange()).isEqualTo(1);
    }

    @Test
    void fallsBackToNameAndOrdinalWithoutStableIds() {
        SpanForest baseline = normalizer.normalize(trace("base",
                span("b-root", null, "root", 0, 200),
                span("b-2", "b-root", "db.query", 60, 90),
                span("b-1", "b-root", "db.query", 10, 40)));
        SpanForest target = normalizer.normalize(trace("target",
                span("t-root", null, "root", 0, 250),
                span("t-1", "t-root", "db.query", 10, 40),
                span("t-2", "t-root", "db.query", 60, 140)));

        TraceDiff diff = comparator.compare(baseline, target);

        assertThat(diff.getMatchStrategy()).isEqualTo(MatchStrategy.NAME_AND_ORDINAL);
        assertThat(diff.getMatchedCount()).isEqualTo(3);
        assertThat(diff.getStructureDiffs()).isEmpty();
        LatencyDiff second = diff.getLatencyDiffs().stream()
                .filter(d -> d.getSpanId().equals("b-2"))
                .findFirst().orElseThrow();
        assertThat(second.getTargetSpanId()).isEqualTo("t-2");
        assertThat(second.getDiffMs()).isEqualTo(50.0);
    }

    @Test
    void untimedSpansMatchButProduceNoLatencyDiff() {
        SpanForest baseline = normalizer.normalize(trace("base",
                span("root", null, "root", 0, 100),
                untimedSpan("x", "root", "x")));
        SpanForest target = normalizer.normalize(trace("target",
                span("root", null, "root", 0, 100),
                span("x", "root", "x", 10, 90)));

        TraceDiff diff = comparator.compare(baseline, target);

        assertThat(diff.getMatchedCount()).isEqualTo(2);
        assertThat(diff.getLatencyDiffs()).isEmpty();
    }
}
