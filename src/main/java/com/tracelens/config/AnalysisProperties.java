package com.tracelens.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Thresholds and tuning knobs for every analyzer, bound from {@code tracelens.*}.
 */
@Data
@ConfigurationProperties(prefix = "tracelens")
public class AnalysisProperties {

    private Comparison comparison = new Comparison();
    private RootCause rootCause = new RootCause();
    private AntiPattern antiPattern = new AntiPattern();
    private Statistics statistics = new Statistics();
    private Logs logs = new Logs();
    private Cache cache = new Cache();
    private Executor executor = new Executor();

    @Data
    public static class Comparison {
        // Latency differences at or below this are treated as noise
        private double noiseFloorMs = 1.0;
        // Share of the smaller trace whose span ids must appear in both traces to match by id
        private double stableIdOverlapRatio = 0.5;
    }

    @Data
    public static class RootCause {
        private double likelyScoreCutoff = 500.0;
        private int maxCandidates = 10;
    }

    @Data
    public static class AntiPattern {
        private NPlusOne repeatedSiblings = new NPlusOne();
        private SerialChain serialChain = new SerialChain();
        private RetryStorm retryStorm = new RetryStorm();
        private CascadingTimeout cascadingTimeout = new CascadingTimeout();
        private ConnectionPool connectionPool = new ConnectionPool();
    }

    @Data
    public static class NPlusOne {
        private int minCount = 3;
        private double minTotalMs = 50.0;
        private double highImpactMs = 200.0;
    }

    @Data
    public static class SerialChain {
        private int minLength = 3;
        private double maxGapMs = 10.0;
        private double minTotalMs = 100.0;
        private double highImpactMs = 500.0;
    }

    @Data
    public static class RetryStorm {
        // Same-name calls needed, unless the name itself says retry
        private int minRetries = 3;
        private double maxGapMs = 1000.0;
        private int highImpactCount = 5;
        private double backoffFactor = 1.5;
    }

    @Data
    public static class CascadingTimeout {
        // Spans at least this long count as timed out even without a timeout marker
        private double timeoutThresholdMs = 1000.0;
        private int minChainLength = 2;
    }

    @Data
    public static class ConnectionPool {
        private double waitThresholdMs = 100.0;
    }

    @Data
    public static class Statistics {
        private int minSamples = 3;
        private double zScoreThreshold = 2.0;
        private double trendThresholdPct = 15.0;
        private double outlierSigma = 3.0;
    }

    @Data
    public static class Logs {
        private double similarityThreshold = 0.5;
        private int maxSamples = 3;
        private double significanceThreshold = 0.5;
        private double negligibleShare = 0.01;
        private int maxPatterns = 30;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(5);
        private long maximumSize = 256;
    }

    @Data
    public static class Executor {
        private int poolSize = 4;
        private int queueCapacity = 100;
        private Duration timeout = Duration.ofSeconds(30);
    }
}
