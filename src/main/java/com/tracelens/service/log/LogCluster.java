package com.tracelens.service.log;

import com.tracelens.model.LogPattern;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable cluster state while mining. Only ever touched by the miner that owns it.
 */
class LogCluster {

    private static final int MAX_SAMPLE_LENGTH = 200;

    private final int id;
    private final List<String> template;
    private final Map<String, Integer> severityCounts = new LinkedHashMap<>();
    private final List<String> samples = new ArrayList<>();
    private int count;
    private Instant firstSeen;
    private Instant lastSeen;

    LogCluster(int id, List<String> tokens) {
        this.id = id;
        this.template = new ArrayList<>(tokens);
    }

    int getId() {
        return id;
    }

    List<String> getTemplate() {
        return template;
    }

    /**
     * Widens every position where the line disagrees with the template.
     */
    void absorb(List<String> tokens, String message, String severity, Instant timestamp, int maxSamples) {
        for (int i = 0; i < template.size(); i++) {
            if (!template.get(i).equals(tokens.get(i))) {
                template.set(i, LogTokenizer.WILDCARD);
            }
        }
        count++;
        severityCounts.merge(severity, 1, Integer::sum);
        if (samples.size() < maxSamples && message != null) {
            samples.add(message.length() > MAX_SAMPLE_LENGTH ? message.substring(0, MAX_SAMPLE_LENGTH) : message);
        }
        if (timestamp != null) {
            if (firstSeen == null || timestamp.isBefore(firstSeen)) firstSeen = timestamp;
            if (lastSeen == null || timestamp.isAfter(lastSeen)) lastSeen = timestamp;
        }
    }

    LogPattern toPattern() {
        String text = String.join(" ", template);
        return LogPattern.builder()
                .clusterId(id)
                .templateId(templateId(text))
                .template(text)
                .tokenCount(template.size())
                .count(count)
                .severityCounts(Map.copyOf(severityCounts))
                .sampleMessages(List.copyOf(samples))
                .firstSeen(firstSeen)
                .lastSeen(lastSeen)
                .build();
    }

    static String templateId(String template) {
        return DigestUtils.md5DigestAsHex(template.getBytes(StandardCharsets.UTF_8)).substring(0, 8);
    }

    /**
     * Share of the template's fixed positions the line agrees with; 1.0 for an all-wildcard template.
     */
    static double similarity(List<String> template, List<String> tokens) {
        int fixed = 0;
        int matches = 0;
        for (int i = 0; i < template.size(); i++) {
            String expected = template.get(i);
            if (LogTokenizer.WILDCARD.equals(expected)) continue;
            fixed++;
            if (expected.equals(tokens.get(i))) {
                matches++;
            }
        }
        return fixed == 0 ? 1.0 : (double) matches / fixed;
    }
}
