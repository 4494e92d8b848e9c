package com.modelops.service;

import com.modelops.exception.ModelValidationException;

import java.util.Map;

/**
 * Input checks shared by the registry and the run metrics store. Lengths mirror the column sizes
 * of the entities, so oversized values are rejected before they reach the database.
 */
final class MetricValidation {

    static final int MAX_NAME_LENGTH = 128;
    static final int MAX_RUN_ID_LENGTH = 128;
    static final int MAX_METRIC_NAME_LENGTH = 100;

    private MetricValidation() {
    }

    static void requireIdentifier(String value, String label, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ModelValidationException(label + " must not be blank");
        }
        if (value.length() > maxLength) {
            throw new ModelValidationException(String.format(
                "%s must be at most %d characters, got %d", label, maxLength, value.length()));
        }
    }

    static void requireMetrics(Map<String, Double> metrics, String owner) {
        if (metrics == null || metrics.isEmpty()) {
            throw new ModelValidationException("Metrics for " + owner + " must not be empty");
        }
        metrics.forEach((name, value) -> {
            if (name == null || name.isBlank()) {
                throw new ModelValidationException("Metric names for " + owner + " must not be blank");
            }
            if (name.length() > MAX_METRIC_NAME_LENGTH) {
                throw new ModelValidationException(String.format(
                    "Metric name '%s...' for %s must be at most %d characters, got %d",
                    name.substring(0, 20), owner, MAX_METRIC_NAME_LENGTH, name.length()));
            }
            if (value == null || value.isNaN() || value.isInfinite()) {
                throw new ModelValidationException(
                    "Metric '" + name + "' for " + owner + " must be a finite number, got " + value);
            }
        });
    }
}
