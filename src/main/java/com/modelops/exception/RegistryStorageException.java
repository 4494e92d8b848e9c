package com.modelops.exception;

public class RegistryStorageException extends ModelOpsException {
    public RegistryStorageException(String message, Throwable cause) {
        super("STORAGE_ERROR", message, cause);
    }
}
