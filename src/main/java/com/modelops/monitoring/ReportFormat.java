package com.modelops.monitoring;

import com.modelops.exception.ModelValidationException;

public enum ReportFormat {
    HTML("html"),
    JSON("json");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static ReportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return HTML;
        }
        for (ReportFormat format : values()) {
            if (format.extension.equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw new ModelValidationException("Unsupported report format '" + value + "'; expected html or json");
    }
}
