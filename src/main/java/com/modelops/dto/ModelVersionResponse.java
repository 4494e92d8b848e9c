package com.modelops.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.modelops.entity.ModelStage;
import com.modelops.entity.ModelVersionRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class ModelVersionResponse {
    String name;
    int version;
    String runId;
    ModelStage stage;
    Map<String, Double> metrics;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant updatedAt;

    public static ModelVersionResponse from(ModelVersionRecord record) {
        return ModelVersionResponse.builder()
            .name(record.getName())
            .version(record.getVersion())
            .runId(record.getRunId())
            .stage(record.getStage())
            .metrics(new LinkedHashMap<>(record.getMetrics()))
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .build();
    }
}
