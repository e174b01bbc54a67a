package com.sandy.aiot.vision.alerting.service;

import com.sandy.aiot.vision.alerting.entity.OnCallOverride;
import com.sandy.aiot.vision.alerting.entity.OnCallSchedule;
import com.sandy.aiot.vision.alerting.entity.RotationType;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.exception.ErrorKind;
import com.sandy.aiot.vision.alerting.repository.OnCallScheduleRepository;
import com.sandy.aiot.vision.alerting.vo.OnCallAssignmentVO;
import com.sandy.aiot.vision.alerting.vo.OverrideReq;
import com.sandy.aiot.vision.alerting.vo.ScheduleReq;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * On-call schedule administration and lookups. Schedules are addressed by numeric id or by unique name.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OnCallService {

    private final OnCallScheduleRepository scheduleRepository;
    private final OnCallResolver resolver;
    private final StoreTransactions storeTransactions;
    private final Clock clock;

    public OnCallAssignmentVO current(String scheduleRef) {
        return at(scheduleRef, clock.instant());
    }

    public OnCallAssignmentVO at(String scheduleRef, Instant instant) {
        OnCallSchedule schedule = get(scheduleRef);
        return resolver.resolve(schedule, instant);
    }

    /** As {@link #at} but accepts local ISO text interpreted in the schedule's timezone. */
    public OnCallAssignmentVO at(String scheduleRef, String instantText) {
        OnCallSchedule schedule = get(scheduleRef);
        ZoneId zone = OnCallResolver.zoneOf(schedule.getTimezone());
        Instant instant = instantText == null || instantText.isBlank()
                ? clock.instant()
                : OnCallResolver.parseInstant(instantText, zone, "instant");
        return resolver.resolve(schedule, instant);
    }

    public OnCallSchedule get(String scheduleRef) {
        if (scheduleRef == null || scheduleRef.isBlank()) {
            throw AlertingException.validation("schedule_id is required");
        }
        return storeTransactions.read("oncall_get", () -> find(scheduleRef.trim())
                .orElseThrow(() -> AlertingException.notFound("On-call schedule", scheduleRef)));
    }

    public List<OnCallSchedule> list(boolean enabledOnly) {
        return storeTransactions.read("oncall_list", () -> enabledOnly
                ? scheduleRepository.findByEnabledTrueOrderByNameAsc()
                : scheduleRepository.findAllByOrderByNameAsc());
    }

    public OnCallSchedule create(ScheduleReq req) {
        if (req.getName() == null || req.getName().isBlank()) {
            throw AlertingException.validation("name is required");
        }
        ZoneId zone = OnCallResolver.zoneOf(req.getTimezone() == null ? "UTC" : req.getTimezone());
        RotationType rotation = req.getRotationType() == null ? RotationType.WEEKLY : parseRotation(req.getRotationType());
        List<String> users = validUsers(req.getUsers());
        Instant now = clock.instant();
        Instant rotationStart = req.getRotationStart() == null ? now
                : OnCallResolver.parseInstant(req.getRotationStart(), zone, "rotation_start");

        return storeTransactions.write("oncall_create", () -> {
            String name = req.getName().trim();
            if (scheduleRepository.findByName(name).isPresent()) {
                throw new AlertingException(ErrorKind.CONFLICT, "On-call schedule " + name + " already exists",
                        Map.of("name", name));
            }
            OnCallSchedule saved = scheduleRepository.save(OnCallSchedule.builder()
                    .name(name)
                    .description(req.getDescription())
                    .timezone(zone.getId())
                    .rotationType(rotation)
                    .rotationStart(rotationStart)
                    .users(users)
                    .overrides(new ArrayList<>())
                    .enabled(req.getEnabled() == null || req.getEnabled())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            log.info("Created on-call schedule {} ({} rotation, {} users, tz={})",
                    saved.getName(), rotation.code(), users.size(), zone.getId());
            return saved;
        });
    }

    public OnCallSchedule update(String scheduleRef, ScheduleReq req) {
        return storeTransactions.write("oncall_update", () -> {
            OnCallSchedule s = find(scheduleRef)
                    .orElseThrow(() -> AlertingException.notFound("On-call schedule", scheduleRef));
            if (req.getName() != null && !req.getName().isBlank() && !req.getName().trim().equals(s.getName())) {
                String name = req.getName().trim();
                if (scheduleRepository.findByName(name).isPresent()) {
                    throw new AlertingException(ErrorKind.CONFLICT, "On-call schedule " + name + " already exists",
                            Map.of("name", name));
                }
                s.setName(name);
            }
            if (req.getDescription() != null) s.setDescription(req.getDescription());
            if (req.getTimezone() != null) s.setTimezone(OnCallResolver.zoneOf(req.getTimezone()).getId());
            if (req.getRotationType() != null) s.setRotationType(parseRotation(req.getRotationType()));
            if (req.getRotationStart() != null) {
                s.setRotationStart(OnCallResolver.parseInstant(req.getRotationStart(),
                        OnCallResolver.zoneOf(s.getTimezone()), "rotation_start"));
            }
            if (req.getUsers() != null) s.setUsers(validUsers(req.getUsers()));
            if (req.getEnabled() != null) s.setEnabled(req.getEnabled());
            s.setUpdatedAt(clock.instant());
            log.info("Updated on-call schedule {}", s.getName());
            return s;
        });
    }

    public void delete(String scheduleRef) {
        storeTransactions.write("oncall_delete", () -> {
            OnCallSchedule s = find(scheduleRef)
                    .orElseThrow(() -> AlertingException.notFound("On-call schedule", scheduleRef));
            scheduleRepository.delete(s);
            log.info("Deleted on-call schedule {}", s.getName());
            return null;
        });
    }

    public OnCallSchedule addOverride(String scheduleRef, OverrideReq req) {
        if (req.getUserId() == null || req.getUserId().isBlank()) {
            throw AlertingException.validation("user_id is required");
        }
        return storeTransactions.write("oncall_override", () -> {
            OnCallSchedule s = find(scheduleRef)
                    .orElseThrow(() -> AlertingException.notFound("On-call schedule", scheduleRef));
            ZoneId zone = OnCallResolver.zoneOf(s.getTimezone());
            Instant start = OnCallResolver.parseInstant(req.getStart(), zone, "start");
            Instant end = OnCallResolver.parseInstant(req.getEnd(), zone, "end");
            if (start.isAfter(end)) {
                throw AlertingException.validation("override start must not be after end");
            }
            List<OnCallOverride> overrides = new ArrayList<>(s.getOverrides() == null ? List.of() : s.getOverrides());
            overrides.add(OnCallOverride.builder()
                    .userId(req.getUserId().trim())
                    .start(start)
                    .end(end)
                    .reason(req.getReason() == null || req.getReason().isBlank() ? "Manual override" : req.getReason())
                    .build());
            s.setOverrides(overrides);
            s.setUpdatedAt(clock.instant());
            log.info("Added override to schedule {}: {} from {} to {}", s.getName(), req.getUserId(), start, end);
            return s;
        });
    }

    /** Resolves the user on call for a schedule name; used for {@code oncall:<schedule>} recipients. */
    public String resolveUser(String scheduleName, Instant at) {
        OnCallSchedule schedule = storeTransactions.read("oncall_resolve", () -> scheduleRepository.findByName(scheduleName)
                .orElseThrow(() -> AlertingException.notFound("On-call schedule", scheduleName)));
        return resolver.resolve(schedule, at).getUserId();
    }

    private Optional<OnCallSchedule> find(String ref) {
        if (!ref.isEmpty() && ref.length() <= 18 && ref.chars().allMatch(Character::isDigit)) {
            Optional<OnCallSchedule> byId = scheduleRepository.findById(Long.valueOf(ref));
            if (byId.isPresent()) return byId;
        }
        return scheduleRepository.findByName(ref);
    }

    private static RotationType parseRotation(String code) {
        RotationType rotation = RotationType.fromCode(code);
        if (rotation == null) {
            throw AlertingException.validation("rotation_type must be one of weekly, daily");
        }
        return rotation;
    }

    private static List<String> validUsers(List<String> users) {
        if (users == null || users.isEmpty()) {
            throw AlertingException.validation("users must not be empty");
        }
        List<String> cleaned = new ArrayList<>();
        for (String u : users) {
            if (u == null || u.isBlank()) {
                throw AlertingException.validation("user ids must not be blank");
            }
            cleaned.add(u.trim());
        }
        return cleaned;
    }
}
