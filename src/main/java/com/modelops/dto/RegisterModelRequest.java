package com.modelops.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class RegisterModelRequest {
    @NotBlank
    @Size(max = 128)
    String runId;

    /** When absent the metrics previously logged for {@code runId} are used. */
    Map<String, Double> metrics;
}
