package com.tracelens.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogAnalysisRequest {
    private LogWindow baseline;
    private LogWindow comparison;
}
