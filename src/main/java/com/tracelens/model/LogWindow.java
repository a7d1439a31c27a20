package com.tracelens.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * A batch of log records from one time window. Windows carrying an id are cached after mining.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogWindow {
    private String windowId;
    private Instant start;
    private Instant end;
    private List<LogRecord> records;
}
