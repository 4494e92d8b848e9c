package com.modelops.dto;

import com.modelops.entity.ModelStage;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class StageChangeRequest {
    @NotNull
    ModelStage stage;
}
