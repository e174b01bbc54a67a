package com.sandy.aiot.vision.alerting.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert severity, most urgent first.
 */
public enum Severity {
    CRITICAL, HIGH, MEDIUM, LOW, INFO;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup; returns null for null/blank/unknown input so callers decide the error.
     */
    @JsonCreator
    public static Severity fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        try {
            return Severity.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
