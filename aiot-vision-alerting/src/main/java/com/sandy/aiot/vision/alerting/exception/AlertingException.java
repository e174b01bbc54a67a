package com.sandy.aiot.vision.alerting.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class AlertingException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> detail;

    public AlertingException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public AlertingException(ErrorKind kind, String message, Map<String, Object> detail) {
        this(kind, message, detail, null);
    }

    public AlertingException(ErrorKind kind, String message, Map<String, Object> detail, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.detail = detail == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    public static AlertingException validation(String message) {
        return new AlertingException(ErrorKind.VALIDATION, message);
    }

    public static AlertingException notFound(String what, Object id) {
        return new AlertingException(ErrorKind.NOT_FOUND, what + " " + id + " not found", Map.of("id", String.valueOf(id)));
    }

    public static AlertingException invalidSchedule(String message) {
        return new AlertingException(ErrorKind.INVALID_SCHEDULE, message);
    }
}
