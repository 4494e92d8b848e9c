package com.modelops.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.modelops.service.StageTransition;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransitionResponse {
    ModelVersionResponse promoted;
    ModelVersionResponse demoted;

    public static TransitionResponse from(StageTransition transition) {
        return TransitionResponse.builder()
            .promoted(ModelVersionResponse.from(transition.getPromoted()))
            .demoted(transition.getDemoted().map(ModelVersionResponse::from).orElse(null))
            .build();
    }
}
