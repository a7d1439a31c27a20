package com.tracelens.service.log;

import com.tracelens.model.LogRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Incremental log template miner. Lines are masked, then merged into the most similar cluster of the
 * same token count or start a new one. Not thread-safe: build one per window.
 */
@Slf4j
public class LogTemplateMiner {

    private final double similarityThreshold;
    private final int maxSamples;
    private final List<LogCluster> clusters = new ArrayList<>();
    private final Map<Integer, List<LogCluster>> clustersByLength = new HashMap<>();
    // Masked line -> cluster it was merged into, so identical lines always land together
    private final Map<String, Integer> signatureIndex = new HashMap<>();
    private int totalRecords;

    public LogTemplateMiner(double similarityThreshold, int maxSamples) {
        if (similarityThreshold < 0 || similarityThreshold > 1) {
            throw new IllegalArgumentException("similarityThreshold must be within [0, 1]: " + similarityThreshold);
        }
        this.similarityThreshold = similarityThreshold;
        this.maxSamples = maxSamples;
    }

    public int add(LogRecord record) {
        return add(record.getMessage(), record.getSeverity(), record.getTimestamp());
    }

    /**
     * Adds one line and returns the id of the cluster it joined.
     */
    public int add(String message, String severity, Instant timestamp) {
        List<String> tokens = LogTokenizer.tokenize(message);
        String signature = LogTokenizer.signature(tokens);
        totalRecords++;

        LogCluster target;
        Integer known = signatureIndex.get(signature);
        if (known != null) {
            target = clusters.get(known - 1);
        } else {
            target = bestMatch(tokens);
            if (target == null) {
                target = new LogCluster(clusters.size() + 1, tokens);
                clusters.add(target);
                clustersByLength.computeIfAbsent(tokens.size(), k -> new ArrayList<>()).add(target);
                log.trace("New log cluster {}: {}", target.getId(), signature);
            }
            signatureIndex.put(signature, target.getId());
        }

        target.absorb(tokens, message, normalizeSeverity(severity), timestamp, maxSamples);
        return target.getId();
    }

    public void addAll(Collection<LogRecord> records) {
        for (LogRecord record : records) {
            add(record);
        }
    }

    public int getClusterCount() {
        return clusters.size();
    }

    /**
     * Immutable snapshot of the clusters mined so far.
     */
    public LogPatternSet freeze() {
        List<List<String>> templates = new ArrayList<>(clusters.size());
        for (LogCluster cluster : clusters) {
            templates.add(List.copyOf(cluster.getTemplate()));
        }
        return new LogPatternSet(
                clusters.stream().map(LogCluster::toPattern).collect(Collectors.toList()),
                templates,
                Map.copyOf(signatureIndex),
                similarityThreshold,
                totalRecords);
    }

    private LogCluster bestMatch(List<String> tokens) {
        LogCluster best = null;
        double bestSimilarity = -1;
        for (LogCluster cluster : clustersByLength.getOrDefault(tokens.size(), List.of())) {
            double similarity = LogCluster.similarity(cluster.getTemplate(), tokens);
            // Clusters are visited in id order, so strict > keeps the lowest id on ties
            if (similarity >= similarityThreshold && similarity > bestSimilarity) {
                best = cluster;
                bestSimilarity = similarity;
            }
        }
        return best;
    }

    static String normalizeSeverity(String severity) {
        if (severity == null || severity.isBlank()) {
            return "DEFAULT";
        }
        String upper = severity.trim().toUpperCase(Locale.ROOT);
        return switch (upper) {
            case "WARN" -> "WARNING";
            case "FATAL" -> "CRITICAL";
            case "ERR" -> "ERROR";
            default -> upper;
        };
    }
}
