package com.tracelens.service.log;

import com.tracelens.model.LogPattern;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Frozen result of mining one window. Assigning lines never changes the set, so the same line always
 * gets the same cluster id.
 */
public final class LogPatternSet {

    private final List<LogPattern> patterns;
    private final List<List<String>> templates;
    private final Map<String, Integer> signatureIndex;
    private final double similarityThreshold;
    private final int totalRecords;

    LogPatternSet(List<LogPattern> patterns, List<List<String>> templates, Map<String, Integer> signatureIndex,
                  double similarityThreshold, int totalRecords) {
        this.patterns = List.copyOf(patterns);
        this.templates = List.copyOf(templates);
        this.signatureIndex = signatureIndex;
        this.similarityThreshold = similarityThreshold;
        this.totalRecords = totalRecords;
    }

    /**
     * Cluster id for the message, or -1 when no cluster is similar enough.
     */
    public int assign(String message) {
        List<String> tokens = LogTokenizer.tokenize(message);
        Integer known = signatureIndex.get(LogTokenizer.signature(tokens));
        if (known != null) {
            return known;
        }
        int best = -1;
        double bestSimilarity = -1;
        for (int i = 0; i < templates.size(); i++) {
            List<String> template = templates.get(i);
            if (template.size() != tokens.size()) continue;
            double similarity = LogCluster.similarity(template, tokens);
            if (similarity >= similarityThreshold && similarity > bestSimilarity) {
                best = i + 1;
                bestSimilarity = similarity;
            }
        }
        return best;
    }

    /**
     * Patterns in cluster id order.
     */
    public List<LogPattern> getPatterns() {
        return patterns;
    }

    public List<LogPattern> getPatternsByCount() {
        return patterns.stream()
                .sorted(Comparator.comparingInt(LogPattern::getCount).reversed()
                        .thenComparingInt(LogPattern::getClusterId))
                .collect(Collectors.toList());
    }

    public LogPattern getPattern(int clusterId) {
        return patterns.get(clusterId - 1);
    }

    public int getTotalRecords() {
        return totalRecords;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public int size() {
        return patterns.size();
    }
}
