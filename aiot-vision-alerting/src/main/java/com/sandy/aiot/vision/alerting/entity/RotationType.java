package com.sandy.aiot.vision.alerting.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * On-call rotation period. The length is expressed in calendar days of the schedule's timezone.
 */
public enum RotationType {
    WEEKLY(7), DAILY(1);

    private final int periodDays;

    RotationType(int periodDays) {
        this.periodDays = periodDays;
    }

    public int getPeriodDays() {
        return periodDays;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RotationType fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        try {
            return RotationType.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
