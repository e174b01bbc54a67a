package com.sandy.aiot.vision.alerting.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Alert lifecycle states together with the allowed transition table.
 * <pre>
 * new           -> acknowledged | investigating | resolved
 * acknowledged  -> investigating | resolved
 * investigating -> resolved
 * resolved      -> (terminal)
 * </pre>
 */
public enum AlertState {
    NEW, ACKNOWLEDGED, INVESTIGATING, RESOLVED;

    public Set<AlertState> allowedTargets() {
        switch (this) {
            case NEW:
                return EnumSet.of(ACKNOWLEDGED, INVESTIGATING, RESOLVED);
            case ACKNOWLEDGED:
                return EnumSet.of(INVESTIGATING, RESOLVED);
            case INVESTIGATING:
                return EnumSet.of(RESOLVED);
            default:
                return EnumSet.noneOf(AlertState.class);
        }
    }

    public boolean canTransitionTo(AlertState target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == RESOLVED;
    }

    /** States that count as a human response for TTA purposes. */
    public boolean isHumanResponse() {
        return this == ACKNOWLEDGED || this == INVESTIGATING;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertState fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        try {
            return AlertState.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
