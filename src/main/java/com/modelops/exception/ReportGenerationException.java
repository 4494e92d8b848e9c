package com.modelops.exception;

public class ReportGenerationException extends ModelOpsException {
    public ReportGenerationException(String message, Throwable cause) {
        super("REPORT_GENERATION_ERROR", message, cause);
    }
}
