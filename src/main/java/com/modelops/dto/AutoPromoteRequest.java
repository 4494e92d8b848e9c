package com.modelops.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AutoPromoteRequest {
    @NotBlank
    String runId;
    @NotBlank
    String metricName;
    @Builder.Default
    boolean higherIsBetter = true;
    /** Optional; required only when the run is registered under more than one model. */
    String modelName;
}
