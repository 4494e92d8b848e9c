package com.modelops.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelops.exception.ModelValidationException;
import lombok.Getter;

import java.util.Arrays;

@Getter
public enum ModelStage {
    NONE("None"),
    PRODUCTION("Production"),
    ARCHIVED("Archived");

    private final String label;

    ModelStage(String label) {
        this.label = label;
    }

    @JsonValue
    public String toJson() {
        return label;
    }

    @JsonCreator
    public static ModelStage fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new ModelValidationException("Stage must be one of None, Production, Archived");
        }
        return Arrays.stream(values())
            .filter(s -> s.label.equalsIgnoreCase(value.trim()) || s.name().equalsIgnoreCase(value.trim()))
            .findFirst()
            .orElseThrow(() -> new ModelValidationException(
                "Unknown stage '" + value + "'; expected one of None, Production, Archived"));
    }
}
