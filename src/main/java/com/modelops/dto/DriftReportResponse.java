package com.modelops.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.modelops.monitoring.DriftAssessment;
import com.modelops.monitoring.ReportFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DriftReportResponse {
    String reportPath;
    ReportFormat format;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    int highDriftCount;
    DriftAssessment assessment;
}
