package com.tracelens.service.stats;

import com.tracelens.config.AnalysisProperties;
import com.tracelens.exception.InsufficientDataException;
import com.tracelens.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Percentiles, z-score anomalies, trend detection and outliers over numeric samples.
 *
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatisticalAnomalyEngine {

    // z-score reported when the historical data has no spread but the means differ
    static final double DEGENERATE_Z_SCORE = 100.0;

    private final AnalysisProperties properties;

    /**
     * Runs every analysis the samples allow. Analyses short of data are skipped with a note.
     */
    public StatisticsReport analyze(StatisticsRequest request) {
        List<MetricSample> historical = request.getHistorical() != null ? request.getHistorical() : List.of();
        List<MetricSample> current = request.getCurrent() != null ? request.getCurrent() : List.of();
        List<String> notes = new ArrayList<>();

        List<MetricSample> population = new ArrayList<>(historical);
        population.addAll(current);

        DistributionSummary summary = null;
        List<Outlier> outliers = null;
        try {
            summary = summarize(values(population));
            outliers = detectOutliers(population);
        } catch (InsufficientDataException e) {
            notes.add("distribution skipped: " + e.getMessage());
        }

        ZScoreResult zScore = null;
        if (!current.isEmpty()) {
            try {
                zScore = zScore(values(historical), values(current));
            } catch (InsufficientDataException e) {
                notes.add("z-score skipped: " + e.getMessage());
            }
        } else {
            notes.add("z-score skipped: no current samples");
        }

        TrendResult trend = null;
        try {
            List<Double> series = request.getBucketSeconds() != null && request.getBucketSeconds() > 0
                    ? bucketize(population, Duration.ofSeconds(request.getBucketSeconds()))
                    : orderedValues(population);
            trend = detectTrend(series);
        } catch (InsufficientDataException e) {
            notes.add("trend skipped: " + e.getMessage());
        }

        if (!notes.isEmpty()) {
            log.warn("Statistics for {} incomplete: {}", request.getMetric(), notes);
        }

        return StatisticsReport.builder()
                .metric(request.getMetric())
                .summary(summary)
                .zScore(zScore)
                .trend(trend)
                .outliers(outliers)
                .notes(notes)
                .build();
    }

    public DistributionSummary summarize(List<Double> values) {
        requireSamples("distribution", values.size());
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);

        return DistributionSummary.builder()
                .count(sorted.size())
                .mean(mean(sorted))
                .stdDev(sampleStdDev(sorted))
                .min(sorted.get(0))
                .max(sorted.get(sorted.size() - 1))
                .p50(percentile(sorted, 50))
                .p90(percentile(sorted, 90))
                .p95(percentile(sorted, 95))
                .p99(percentile(sorted, 99))
                .build();
    }

    /**
     * z = (current mean - historical mean) / historical sample standard deviation.
     */
    public ZScoreResult zScore(List<Double> historical, List<Double> current) {
        requireSamples("z-score", historical.size());
        if (current.isEmpty()) {
            throw new InsufficientDataException("z-score (current)", 1, 0);
        }
        double historicalMean = mean(historical);
        double historicalStdDev = sampleStdDev(historical);
        double currentMean = mean(current);
        double delta = currentMean - historicalMean;

        double z;
        if (historicalStdDev > 0) {
            z = delta / historicalStdDev;
        } else if (delta == 0) {
            z = 0.0;
        } else {
            z = delta > 0 ? DEGENERATE_Z_SCORE : -DEGENERATE_Z_SCORE;
        }

        return ZScoreResult.builder()
                .currentMean(currentMean)
                .historicalMean(historicalMean)
                .historicalStdDev(historicalStdDev)
                .zScore(z)
                .anomalous(Math.abs(z) > properties.getStatistics().getZScoreThreshold())
                .build();
    }

    /**
     * Compares the mean of the first half of an ordered series (the first n/2 values) with the rest.
     */
    public TrendResult detectTrend(List<Double> series) {
        requireSamples("trend", series.size());
        int mid = series.size() / 2;
        double firstMean = mean(series.subList(0, mid));
        double secondMean = mean(series.subList(mid, series.size()));
        double pctChange = firstMean != 0 ? (secondMean - firstMean) / firstMean * 100 : 0.0;

        double threshold = properties.getStatistics().getTrendThresholdPct();
        Trend trend;
        if (pctChange > threshold) {
            trend = Trend.DEGRADING;
        } else if (pctChange < -threshold) {
            trend = Trend.IMPROVING;
        } else {
            trend = Trend.STABLE;
        }

        return TrendResult.builder()
                .trend(trend)
                .firstHalfMean(firstMean)
                .secondHalfMean(secondMean)
                .pctChange(pctChange)
                .points(series.size())
                .build();
    }

    /**
     * Points whose population z-score exceeds the outlier threshold.
     */
    public List<Outlier> detectOutliers(List<MetricSample> samples) {
        requireSamples("outliers", samples.size());
        List<Double> values = values(samples);
        double mean = mean(values);
        double stdDev = sampleStdDev(values);
        if (stdDev == 0) {
            return List.of();
        }

        double sigma = properties.getStatistics().getOutlierSigma();
        List<Outlier> outliers = new ArrayList<>();
        for (int i = 0; i < samples.size(); i++) {
            double z = (values.get(i) - mean) / stdDev;
            if (Math.abs(z) > sigma) {
                outliers.add(Outlier.builder()
                        .index(i)
                        .value(values.get(i))
                        .timestamp(samples.get(i).getTimestamp())
                        .zScore(z)
                        .direction(z > 0 ? Outlier.Direction.HIGH : Outlier.Direction.LOW)
                        .build());
            }
        }
        return outliers;
    }

    /**
     * Orders samples by timestamp and averages them per fixed-width bucket. Samples without a timestamp
     * are ignored.
     */
    public List<Double> bucketize(List<MetricSample> samples, Duration bucket) {
        long width = bucket.toMillis();
        TreeMap<Long, List<Double>> buckets = new TreeMap<>();
        for (MetricSample sample : samples) {
            if (sample.getTimestamp() == null) continue;
            long key = Math.floorDiv(sample.getTimestamp().toEpochMilli(), width);
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(sample.getValue());
        }
        return buckets.values().stream()
                .map(StatisticalAnomalyEngine::mean)
                .collect(Collectors.toList());
    }

    /**
     * Linear interpolation between the closest ranks of an ascending list.
     */
    public static double percentile(List<Double> sortedValues, double percentile) {
        if (sortedValues.isEmpty()) return 0;
        if (sortedValues.size() == 1) return sortedValues.get(0);

        double position = (percentile / 100.0) * (sortedValues.size() - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);

        if (lower == upper) {
            return sortedValues.get(lower);
        }

        double lowerValue = sortedValues.get(lower);
        double upperValue = sortedValues.get(upper);
        double fraction = position - lower;

        return lowerValue + fraction * (upperValue - lowerValue);
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    static double sampleStdDev(List<Double> values) {
        if (values.size() < 2) return 0;
        double mean = mean(values);
        double sumSquares = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum();
        return Math.sqrt(sumSquares / (values.size() - 1));
    }

    private void requireSamples(String analysis, int count) {
        int required = properties.getStatistics().getMinSamples();
        if (count < required) {
            throw new InsufficientDataException(analysis, required, count);
        }
    }

    private static List<Double> values(List<MetricSample> samples) {
        return samples.stream().map(MetricSample::getValue).collect(Collectors.toList());
    }

    // Timestamped samples in time order, untimed ones after them in arrival order
    private static List<Double> orderedValues(List<MetricSample> samples) {
        List<MetricSample> ordered = new ArrayList<>(samples);
        ordered.sort(Comparator.comparing(MetricSample::getTimestamp,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return values(ordered);
    }
}
