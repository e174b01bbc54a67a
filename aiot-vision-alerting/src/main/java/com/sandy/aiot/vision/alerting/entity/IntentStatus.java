package com.sandy.aiot.vision.alerting.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Notification intent lifecycle: PENDING until handed to the dispatcher, then DISPATCHED or FAILED;
 * DELIVERED / UNDELIVERABLE come back from the dispatch collaborator's acknowledgement.
 */
public enum IntentStatus {
    PENDING, DISPATCHED, FAILED, DELIVERED, UNDELIVERABLE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IntentStatus fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        try {
            return IntentStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
