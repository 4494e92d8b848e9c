package com.modelops.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.modelops.service.PromotionDecision;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PromotionResponse {
    String modelName;
    String runId;
    int candidateVersion;
    Integer previousProductionVersion;
    String metricName;
    boolean higherIsBetter;
    Double candidateValue;
    Double productionValue;
    PromotionDecision.Reason reason;
    boolean promoted;
    int attempts;

    /** The new production version on a win, empty otherwise. */
    @JsonIgnore
    public Optional<Integer> promotedVersion() {
        return promoted ? Optional.of(candidateVersion) : Optional.empty();
    }
}
