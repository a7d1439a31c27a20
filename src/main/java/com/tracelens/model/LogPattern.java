package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
public class LogPattern {
    private int clusterId;
    // Stable short hash of the template text
    private String templateId;
    private String template;
    private int tokenCount;
    private int count;
    private Map<String, Integer> severityCounts;
    private List<String> sampleMessages;
    private Instant firstSeen;
    private Instant lastSeen;

    /**
     * Most frequent severity, preferring the more severe level on ties.
     */
    public String getDominantSeverity() {
        if (severityCounts == null || severityCounts.isEmpty()) {
            return "DEFAULT";
        }
        String best = null;
        int bestCount = -1;
        for (Map.Entry<String, Integer> e : severityCounts.entrySet()) {
            int c = e.getValue();
            if (c > bestCount || (c == bestCount && severityWeight(e.getKey()) > severityWeight(best))) {
                best = e.getKey();
                bestCount = c;
            }
        }
        return best;
    }

    public boolean hasErrorSeverity() {
        return severityCounts != null && severityCounts.keySet().stream()
                .anyMatch(s -> severityWeight(s) >= severityWeight("ERROR"));
    }

    public static int severityWeight(String severity) {
        if (severity == null) return 0;
        return switch (severity) {
            case "EMERGENCY" -> 40;
            case "ALERT" -> 30;
            case "CRITICAL" -> 20;
            case "ERROR" -> 10;
            case "WARNING" -> 5;
            case "NOTICE" -> 3;
            case "INFO" -> 2;
            case "DEBUG" -> 1;
            default -> 0;
        };
    }
}
