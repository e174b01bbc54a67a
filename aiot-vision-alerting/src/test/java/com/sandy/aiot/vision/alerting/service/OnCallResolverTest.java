package com.sandy.aiot.vision.alerting.service;

import com.sandy.aiot.vision.alerting.entity.OnCallOverride;
import com.sandy.aiot.vision.alerting.entity.OnCallSchedule;
import com.sandy.aiot.vision.alerting.entity.RotationType;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.exception.ErrorKind;
import com.sandy.aiot.vision.alerting.vo.OnCallAssignmentVO;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OnCallResolverTest {

    // a Monday
    private static final Instant MON = Instant.parse("2024-03-04T00:00:00Z");

    private final OnCallResolver resolver = new OnCallResolver();

    private OnCallSchedule weekly(List<OnCallOverride> overrides) {
        return OnCallSchedule.builder()
                .id(1L)
                .name("ops-primary")
                .timezone("UTC")
                .enabled(true)
                .rotationType(RotationType.WEEKLY)
                .rotationStart(MON)
                .users(List.of("A", "B", "C"))
                .overrides(overrides)
                .build();
    }

    @Test
    void weeklyRotationCyclesThroughUsers() {
        OnCallSchedule s = weekly(new ArrayList<>());
        assertEquals("A", resolver.resolve(s, MON).getUserId());
        assertEquals("B", resolver.resolve(s, MON.plus(Duration.ofDays(7))).getUserId());
        assertEquals("C", resolver.resolve(s, MON.plus(Duration.ofDays(14))).getUserId());
        assertEquals("A", resolver.resolve(s, MON.plus(Duration.ofDays(21))).getUserId());
    }

    @Test
    void shiftBoundsFollowRotationStart() {
        OnCallAssignmentVO r = resolver.resolve(weekly(new ArrayList<>()), MON.plus(Duration.ofDays(9)));
        assertEquals("B", r.getUserId());
        assertEquals(2, r.getUserOrder());
        assertEquals(MON.plus(Duration.ofDays(7)), r.getShiftStart().toInstant());
        assertEquals(MON.plus(Duration.ofDays(14)).minusSeconds(1), r.getShiftEnd().toInstant());
        assertFalse(r.isOverride());
    }

    @Test
    void overrideWinsInsideItsWindow() {
        List<OnCallOverride> overrides = new ArrayList<>();
        overrides.add(OnCallOverride.builder().userId("D")
                .start(MON.plus(Duration.ofDays(10))).end(MON.plus(Duration.ofDays(12))).reason("vacation cover").build());
        OnCallSchedule s = weekly(overrides);

        OnCallAssignmentVO r = resolver.resolve(s, MON.plus(Duration.ofDays(11)));
        assertEquals("D", r.getUserId());
        assertTrue(r.isOverride());
        assertNull(r.getUserOrder());
        assertEquals("vacation cover", r.getOverrideReason());

        // bounds are inclusive
        assertEquals("D", resolver.resolve(s, MON.plus(Duration.ofDays(10))).getUserId());
        assertEquals("D", resolver.resolve(s, MON.plus(Duration.ofDays(12))).getUserId());
        assertEquals("B", resolver.resolve(s, MON.plus(Duration.ofDays(12)).plusSeconds(1)).getUserId());
    }

    @Test
    void firstMatchingOverrideWins() {
        List<OnCallOverride> overrides = new ArrayList<>();
        overrides.add(OnCallOverride.builder().userId("D").start(MON).end(MON.plus(Duration.ofDays(3))).build());
        overrides.add(OnCallOverride.builder().userId("E").start(MON).end(MON.plus(Duration.ofDays(5))).build());
        OnCallSchedule s = weekly(overrides);
        assertEquals("D", resolver.resolve(s, MON.plus(Duration.ofDays(2))).getUserId());
        assertEquals("E", resolver.resolve(s, MON.plus(Duration.ofDays(4))).getUserId());
    }

    @Test
    void instantsBeforeRotationStartWrapBackwards() {
        OnCallAssignmentVO r = resolver.resolve(weekly(new ArrayList<>()), MON.minus(Duration.ofHours(1)));
        assertEquals("C", r.getUserId());
        assertEquals(MON.minus(Duration.ofDays(7)), r.getShiftStart().toInstant());
    }

    @Test
    void dailyRotationKeepsLocalHandoverAcrossDst() {
        ZoneId chicago = ZoneId.of("America/Chicago");
        // DST starts 2024-03-10 02:00 local
        Instant start = LocalDateTime.parse("2024-03-09T09:00:00").atZone(chicago).toInstant();
        OnCallSchedule s = OnCallSchedule.builder()
                .name("plant-night")
                .timezone("America/Chicago")
                .enabled(true)
                .rotationType(RotationType.DAILY)
                .rotationStart(start)
                .users(List.of("A", "B"))
                .build();

        Instant nextHandover = LocalDateTime.parse("2024-03-10T09:00:00").atZone(chicago).toInstant();
        assertEquals(Duration.ofHours(23), Duration.between(start, nextHandover));

        OnCallAssignmentVO r = resolver.resolve(s, nextHandover);
        assertEquals("B", r.getUserId());
        assertEquals(9, r.getShiftStart().getHour());
        assertEquals("A", resolver.resolve(s, nextHandover.minusSeconds(1)).getUserId());
    }

    @Test
    void resolutionIsDeterministic() {
        OnCallSchedule s = weekly(new ArrayList<>());
        Instant t = MON.plus(Duration.ofDays(45)).plusSeconds(1234);
        assertEquals(resolver.resolve(s, t), resolver.resolve(s, t));
    }

    @Test
    void invalidSchedulesAreRejected() {
        OnCallSchedule noUsers = weekly(new ArrayList<>());
        noUsers.setUsers(new ArrayList<>());
        AlertingException e1 = assertThrows(AlertingException.class, () -> resolver.resolve(noUsers, MON));
        assertEquals(ErrorKind.INVALID_SCHEDULE, e1.getKind());

        OnCallSchedule disabled = weekly(new ArrayList<>());
        disabled.setEnabled(false);
        AlertingException e2 = assertThrows(AlertingException.class, () -> resolver.resolve(disabled, MON));
        assertEquals(ErrorKind.INVALID_SCHEDULE, e2.getKind());

        OnCallSchedule badZone = weekly(new ArrayList<>());
        badZone.setTimezone("Mars/Olympus");
        AlertingException e3 = assertThrows(AlertingException.class, () -> resolver.resolve(badZone, MON));
        assertEquals(ErrorKind.INVALID_SCHEDULE, e3.getKind());
    }

    @Test
    void localTimesAreReadInScheduleZone() {
        ZoneId chicago = ZoneId.of("America/Chicago");
        assertEquals(Instant.parse("2024-07-01T14:00:00Z"),
                OnCallResolver.parseInstant("2024-07-01T09:00:00", chicago, "instant"));
        assertEquals(Instant.parse("2024-07-01T09:00:00Z"),
                OnCallResolver.parseInstant("2024-07-01T09:00:00Z", chicago, "instant"));
        assertEquals(Instant.parse("2024-07-01T07:00:00Z"),
                OnCallResolver.parseInstant("2024-07-01T09:00:00+02:00", ZoneOffset.UTC, "instant"));
        AlertingException e = assertThrows(AlertingException.class,
                () -> OnCallResolver.parseInstant("next tuesday", chicago, "instant"));
        assertEquals(ErrorKind.VALIDATION, e.getKind());
    }
}
