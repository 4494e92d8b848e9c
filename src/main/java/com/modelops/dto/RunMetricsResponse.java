package com.modelops.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class RunMetricsResponse {
    String runId;
    Map<String, Double> metrics;
}
