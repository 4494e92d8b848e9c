package com.modelops.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class RecordPredictionRequest {
    @NotNull
    Map<String, Object> features;
    @Min(0)
    @Max(1)
    int prediction;
    String modelVersion;
    @PositiveOrZero
    double latencySeconds;
}
