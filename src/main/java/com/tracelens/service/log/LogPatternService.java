package com.tracelens.service.log;

import com.tracelens.config.AnalysisProperties;
import com.tracelens.model.LogAnalysisRequest;
import com.tracelens.model.LogRecord;
import com.tracelens.model.LogReport;
import com.tracelens.model.LogWindow;
import com.tracelens.service.cache.AnalysisCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Mines log windows into pattern sets and compares them. Windows carrying an id are cached under their
 * id, bounds and content.
 *
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogPatternService {

    private final LogPatternComparator comparator;
    private final AnalysisCache<String, LogPatternSet> cache;
    private final AnalysisProperties properties;

    public LogReport analyze(LogAnalysisRequest request) {
        if (request.getBaseline() == null || request.getComparison() == null) {
            throw new IllegalArgumentException("Both a baseline and a comparison log window are required");
        }
        LogPatternSet baseline = mine(request.getBaseline());
        LogPatternSet comparison = mine(request.getComparison());
        return comparator.compare(baseline, comparison);
    }

    public LogPatternSet mine(LogWindow window) {
        AnalysisProperties.Logs cfg = properties.getLogs();
        List<LogRecord> records = window.getRecords() != null ? window.getRecords() : List.of();
        String key = window.getWindowId() != null ? cacheKey(window, records, cfg) : null;
        if (key != null) {
            Optional<LogPatternSet> cached = cache.get(key);
            if (cached.isPresent()) {
                log.debug("Log patterns for window {} served from cache", window.getWindowId());
                return cached.get();
            }
        }

        LogTemplateMiner miner = new LogTemplateMiner(cfg.getSimilarityThreshold(), cfg.getMaxSamples());
        miner.addAll(records);
        LogPatternSet patterns = miner.freeze();
        log.info("Mined {} log records of window {} [{} - {}] into {} patterns",
                patterns.getTotalRecords(), window.getWindowId() != null ? window.getWindowId() : "<anonymous>",
                window.getStart(), window.getEnd(), patterns.size());

        if (key != null) {
            cache.put(key, patterns);
        }
        return patterns;
    }

    /**
     * Window id and bounds plus a digest of the records and mining settings, so a reused id with different
     * content never hits a stale entry.
     */
    static String cacheKey(LogWindow window, List<LogRecord> records, AnalysisProperties.Logs cfg) {
        ByteArrayOutputStream content = new ByteArrayOutputStream();
        append(content, cfg.getSimilarityThreshold() + "/" + cfg.getMaxSamples());
        for (LogRecord record : records) {
            append(content, String.valueOf(record.getTimestamp()));
            append(content, String.valueOf(record.getSeverity()));
            append(content, String.valueOf(record.getMessage()));
        }
        return window.getWindowId() + "|" + window.getStart() + "|" + window.getEnd() + "|" + records.size()
                + "|" + DigestUtils.md5DigestAsHex(content.toByteArray());
    }

    // NUL separator keeps field boundaries from shifting between records
    private static void append(ByteArrayOutputStream content, String value) {
        content.writeBytes(value.getBytes(StandardCharsets.UTF_8));
        content.write(0);
    }
}
