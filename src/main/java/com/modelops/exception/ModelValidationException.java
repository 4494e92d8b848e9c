package com.modelops.exception;

public class ModelValidationException extends ModelOpsException {
    public ModelValidationException(String message) {
        super("MODEL_VALIDATION_ERROR", message);
    }
}
