package com.tracelens.service.log;

import com.tracelens.config.AnalysisProperties;
import com.tracelens.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Compares template frequencies of a baseline window with a comparison window.
 *
 * <p>Each window is mined on its own, so a comparison template is matched to the most compatible baseline
 * template of the same length. Counts are normalized by each window's volume before they are compared.
 *
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogPatternComparator {

    static final int MEDIUM_ALERT_NEW_PATTERNS = 5;
    static final double MEDIUM_ALERT_INCREASE_PCT = 200.0;

    private final AnalysisProperties properties;

    public LogReport compare(LogPatternSet baseline, LogPatternSet comparison) {
        AnalysisProperties.Logs cfg = properties.getLogs();
        double baselineTotal = Math.max(1, baseline.getTotalRecords());
        double comparisonTotal = Math.max(1, comparison.getTotalRecords());
        double threshold = comparison.getSimilarityThreshold();

        List<PatternShift> emergent = new ArrayList<>();
        List<PatternShift> increased = new ArrayList<>();
        List<PatternShift> decreased = new ArrayList<>();
        Set<Integer> matchedBaseline = new HashSet<>();
        int stable = 0;

        for (LogPattern pattern : comparison.getPatterns()) {
            LogPattern match = findCounterpart(pattern, baseline, threshold);
            double comparisonRate = pattern.getCount() / comparisonTotal;

            if (match == null) {
                emergent.add(shift(ShiftType.NEW, pattern, null, 0, 0.0, comparisonRate, 100.0));
                continue;
            }
            matchedBaseline.add(match.getClusterId());

            double baselineRate = match.getCount() / baselineTotal;
            double change = baselineRate > 0 ? (comparisonRate - baselineRate) / baselineRate
                    : (comparisonRate > 0 ? 1.0 : 0.0);
            PatternShift shift = shift(null, pattern, match, match.getCount(), baselineRate, comparisonRate,
                    change * 100);

            if (baselineRate < cfg.getNegligibleShare() && change > cfg.getSignificanceThreshold()) {
                shift.setType(ShiftType.NEW);
                emergent.add(shift);
            } else if (change > cfg.getSignificanceThreshold()) {
                shift.setType(ShiftType.INCREASED);
                increased.add(shift);
            } else if (change < -cfg.getSignificanceThreshold()) {
                shift.setType(ShiftType.DECREASED);
                decreased.add(shift);
            } else {
                stable++;
            }
        }

        List<PatternShift> disappeared = baseline.getPatterns().stream()
                .filter(p -> !matchedBaseline.contains(p.getClusterId()))
                .map(p -> shift(ShiftType.DISAPPEARED, p, p, p.getCount(), p.getCount() / baselineTotal, 0.0, -100.0))
                .sorted(Comparator.comparingInt(PatternShift::getBaselineCount).reversed())
                .collect(Collectors.toList());

        emergent.sort(Comparator.comparingInt(PatternShift::getComparisonCount).reversed()
                .thenComparing(s -> LogPattern.severityWeight(s.getPattern().getDominantSeverity()),
                        Comparator.reverseOrder())
                .thenComparingInt(s -> s.getPattern().getClusterId()));
        Comparator<PatternShift> byChange = Comparator.comparingDouble((PatternShift s) -> Math.abs(s.getChangePct()))
                .reversed();
        increased.sort(byChange);
        decreased.sort(byChange);

        AlertLevel alertLevel = alertLevel(emergent, increased);
        log.info("Log comparison: {} new, {} increased, {} decreased, {} disappeared, {} stable -> {}",
                emergent.size(), increased.size(), decreased.size(), disappeared.size(), stable, alertLevel);

        return LogReport.builder()
                .patterns(limit(comparison.getPatternsByCount(), cfg.getMaxPatterns()))
                .newPatterns(emergent)
                .increasedPatterns(increased)
                .decreasedPatterns(decreased)
                .disappearedPatterns(disappeared)
                .stableCount(stable)
                .baselineSummary(summarize(baseline))
                .comparisonSummary(summarize(comparison))
                .alertLevel(alertLevel)
                .build();
    }

    public PatternSummary summarize(LogPatternSet set) {
        Map<String, Integer> severities = new TreeMap<>();
        for (LogPattern pattern : set.getPatterns()) {
            pattern.getSeverityCounts().forEach((severity, count) -> severities.merge(severity, count, Integer::sum));
        }
        List<LogPattern> byCount = set.getPatternsByCount();
        return PatternSummary.builder()
                .totalRecords(set.getTotalRecords())
                .patternCount(set.size())
                .severityDistribution(severities)
                .topPatterns(limit(byCount, properties.getLogs().getMaxPatterns()))
                .errorPatterns(byCount.stream().filter(LogPattern::hasErrorSeverity).collect(Collectors.toList()))
                .build();
    }

    /**
     * Baseline pattern with the same token count whose template agrees best on the positions fixed in both,
     * ties going to the lowest cluster id.
     */
    LogPattern findCounterpart(LogPattern pattern, LogPatternSet baseline, double threshold) {
        List<String> tokens = Arrays.asList(pattern.getTemplate().split(" ", -1));
        LogPattern best = null;
        double bestSimilarity = -1;
        for (LogPattern candidate : baseline.getPatterns()) {
            if (candidate.getTokenCount() != pattern.getTokenCount()) continue;
            if (candidate.getTemplate().equals(pattern.getTemplate())) {
                return candidate;
            }
            double similarity = templateSimilarity(
                    Arrays.asList(candidate.getTemplate().split(" ", -1)), tokens);
            if (similarity >= threshold && similarity > bestSimilarity) {
                best = candidate;
                bestSimilarity = similarity;
            }
        }
        return best;
    }

    static double templateSimilarity(List<String> left, List<String> right) {
        if (left.size() != right.size()) {
            return 0.0;
        }
        int fixed = 0;
        int matches = 0;
        for (int i = 0; i < left.size(); i++) {
            if (LogTokenizer.WILDCARD.equals(left.get(i)) || LogTokenizer.WILDCARD.equals(right.get(i))) continue;
            fixed++;
            if (left.get(i).equals(right.get(i))) {
                matches++;
            }
        }
        return fixed == 0 ? 1.0 : (double) matches / fixed;
    }

    private AlertLevel alertLevel(List<PatternShift> emergent, List<PatternShift> increased) {
        if (emergent.stream().anyMatch(s -> s.getPattern().hasErrorSeverity())) {
            return AlertLevel.HIGH;
        }
        if (emergent.size() > MEDIUM_ALERT_NEW_PATTERNS
                || increased.stream().anyMatch(s -> s.getChangePct() > MEDIUM_ALERT_INCREASE_PCT)) {
            return AlertLevel.MEDIUM;
        }
        return AlertLevel.LOW;
    }

    private static PatternShift shift(ShiftType type, LogPattern pattern, LogPattern baselinePattern, int baselineCount,
                                      double baselineRate, double comparisonRate, double changePct) {
        return PatternShift.builder()
                .type(type)
                .pattern(pattern)
                .baselineTemplate(baselinePattern != null ? baselinePattern.getTemplate() : null)
                .baselineCount(baselineCount)
                .comparisonCount(type == ShiftType.DISAPPEARED ? 0 : pattern.getCount())
                .baselineRate(baselineRate)
                .comparisonRate(comparisonRate)
                .changePct(changePct)
                .build();
    }

    private static <T> List<T> limit(List<T> items, int max) {
        return items.size() > max ? new ArrayList<>(items.subList(0, max)) : items;
    }
}
