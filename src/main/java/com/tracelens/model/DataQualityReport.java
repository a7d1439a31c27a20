package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DataQualityReport {
    private String traceId;
    private boolean valid;
    private int issueCount;
    private List<DataQualityIssue> issues;

    public static DataQualityReport of(String traceId, List<DataQualityIssue> issues) {
        return DataQualityReport.builder()
                .traceId(traceId)
                .valid(issues.isEmpty())
                .issueCount(issues.size())
                .issues(List.copyOf(issues))
                .build();
    }

    public long count(IssueKind kind) {
        return issues.stream().filter(i -> i.getKind() == kind).count();
    }
}
