package com.sandy.aiot.vision.alerting.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NotificationChannel {
    EMAIL, SMS, VOICE, WEBHOOK;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationChannel fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        try {
            return NotificationChannel.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
