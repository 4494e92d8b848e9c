package com.modelops.exception;

/**
 * A mutation of a registered model could not be serialized against concurrent writers.
 * Callers must re-read the registry state and retry the whole decision, not just the write.
 */
public class ConcurrentTransitionException extends ModelOpsException {
    public ConcurrentTransitionException(String message) {
        super("CONCURRENT_MODIFICATION", message);
    }
    public ConcurrentTransitionException(String message, Throwable cause) {
        super("CONCURRENT_MODIFICATION", message, cause);
    }
}
