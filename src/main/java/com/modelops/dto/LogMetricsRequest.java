package com.modelops.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class LogMetricsRequest {
    @NotEmpty
    Map<String, Double> metrics;
}
