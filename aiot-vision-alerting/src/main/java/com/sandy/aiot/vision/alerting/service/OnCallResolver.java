package com.sandy.aiot.vision.alerting.service;

import com.sandy.aiot.vision.alerting.entity.OnCallOverride;
import com.sandy.aiot.vision.alerting.entity.OnCallSchedule;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.vo.OnCallAssignmentVO;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Pure rotation math: no store access, no clock. Days are counted on the calendar of the schedule's
 * timezone, so a rotation keeps its local hand-over time across DST changes.
 */
@Component
public class OnCallResolver {

    public OnCallAssignmentVO resolve(OnCallSchedule schedule, Instant at) {
        if (!schedule.isEnabled()) {
            throw AlertingException.invalidSchedule("Schedule " + schedule.getName() + " is disabled");
        }
        ZoneId zone = zoneOf(schedule.getTimezone());

        List<OnCallOverride> overrides = schedule.getOverrides();
        if (overrides != null) {
            for (OnCallOverride o : overrides) {
                if (o.covers(at)) {
                    return OnCallAssignmentVO.builder()
                            .scheduleId(schedule.getId())
                            .scheduleName(schedule.getName())
                            .timezone(zone.getId())
                            .userId(o.getUserId())
                            .userOrder(null)
                            .shiftStart(o.getStart().atZone(zone).toOffsetDateTime())
                            .shiftEnd(o.getEnd().atZone(zone).toOffsetDateTime())
                            .override(true)
                            .overrideReason(o.getReason())
                            .build();
                }
            }
        }

        List<String> users = schedule.getUsers();
        if (users == null || users.isEmpty()) {
            throw AlertingException.invalidSchedule("Schedule " + schedule.getName() + " has no users");
        }
        if (schedule.getRotationType() == null || schedule.getRotationStart() == null) {
            throw AlertingException.invalidSchedule("Schedule " + schedule.getName() + " has no rotation configured");
        }

        ZonedDateTime start = schedule.getRotationStart().atZone(zone);
        ZonedDateTime t = at.atZone(zone);
        long days = ChronoUnit.DAYS.between(start, t);
        // between() truncates toward zero; floor it for instants before the rotation start
        if (start.plusDays(days).isAfter(t)) {
            days--;
        }
        int periodDays = schedule.getRotationType().getPeriodDays();
        long period = Math.floorDiv(days, periodDays);
        int index = (int) Math.floorMod(period, (long) users.size());

        ZonedDateTime shiftStart = start.plusDays(period * periodDays);
        ZonedDateTime shiftEnd = start.plusDays((period + 1) * periodDays).minusSeconds(1);
        return OnCallAssignmentVO.builder()
                .scheduleId(schedule.getId())
                .scheduleName(schedule.getName())
                .timezone(zone.getId())
                .userId(users.get(index))
                .userOrder(index + 1)
                .shiftStart(shiftStart.toOffsetDateTime())
                .shiftEnd(shiftEnd.toOffsetDateTime())
                .override(false)
                .build();
    }

    public static ZoneId zoneOf(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw AlertingException.invalidSchedule("timezone is required");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw AlertingException.invalidSchedule("Unknown timezone: " + timezone);
        }
    }

    /**
     * Parses an ISO-8601 date-time. Text without an offset is a wall-clock time in {@code zone}.
     */
    public static Instant parseInstant(String text, ZoneId zone, String field) {
        if (text == null || text.isBlank()) {
            throw AlertingException.validation(field + " is required");
        }
        String v = text.trim();
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to a local date-time
        }
        try {
            return LocalDateTime.parse(v).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw AlertingException.validation(field + " is not an ISO-8601 date-time: " + text);
        }
    }
}
