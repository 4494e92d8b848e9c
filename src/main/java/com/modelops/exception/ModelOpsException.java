package com.modelops.exception;

import lombok.Getter;

@Getter
public abstract class ModelOpsException extends RuntimeException {
    private final String errorCode;
    protected ModelOpsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected ModelOpsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
