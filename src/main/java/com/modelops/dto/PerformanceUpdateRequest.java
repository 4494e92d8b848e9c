package com.modelops.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PerformanceUpdateRequest {
    @Builder.Default
    @NotBlank
    String metric = "auc";
    @NotNull
    Double value;
}
