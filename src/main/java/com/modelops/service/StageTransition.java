package com.modelops.service;

import com.modelops.entity.ModelVersionRecord;
import lombok.Getter;

import java.util.Optional;

/**
 * Result of a production transition: the promoted version and, when one existed, the version it
 * displaced (now {@code Archived}).
 */
public final class StageTransition {

    @Getter
    private final ModelVersionRecord promoted;
    private final ModelVersionRecord demoted;

    public StageTransition(ModelVersionRecord promoted, ModelVersionRecord demoted) {
        this.promoted = promoted;
        this.demoted = demoted;
    }

    public Optional<ModelVersionRecord> getDemoted() {
        return Optional.ofNullable(demoted);
    }
}
