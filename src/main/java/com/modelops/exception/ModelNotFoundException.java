package com.modelops.exception;

import com.modelops.entity.ModelStage;

public class ModelNotFoundException extends ModelOpsException {
    public ModelNotFoundException(String message) {
        super("MODEL_NOT_FOUND", message);
    }

    public static ModelNotFoundException model(String name) {
        return new ModelNotFoundException("Registered model '" + name + "' not found.");
    }

    public static ModelNotFoundException version(String name, int version) {
        return new ModelNotFoundException("Model '" + name + "' has no version " + version + ".");
    }

    public static ModelNotFoundException stage(String name, ModelStage stage) {
        return new ModelNotFoundException("Model '" + name + "' has no version in stage " + stage.getLabel() + ".");
    }

    public static ModelNotFoundException run(String runId) {
        return new ModelNotFoundException("No model version or metrics registered for run '" + runId + "'.");
    }
}
