package com.sandy.aiot.vision.alerting.service;

import com.sandy.aiot.vision.alerting.entity.AlertGroup;
import com.sandy.aiot.vision.alerting.entity.GroupStatus;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.exception.ErrorKind;
import com.sandy.aiot.vision.alerting.repository.AlertGroupRepository;
import com.sandy.aiot.vision.alerting.repository.AlertRepository;
import com.sandy.aiot.vision.alerting.support.AlertingTestConfig;
import com.sandy.aiot.vision.alerting.support.MutableClock;
import com.sandy.aiot.vision.alerting.vo.AlertCreatedVO;
import com.sandy.aiot.vision.alerting.vo.CreateAlertReq;
import com.sandy.aiot.vision.alerting.vo.GroupStatsVO;
import com.sandy.aiot.vision.alerting.vo.OverallGroupStatsVO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.sandy.aiot.vision.alerting.support.AlertingTestConfig.T0;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(AlertingTestConfig.class)
class AlertGroupingIntegrationTest {

    @Autowired AlertIngressService ingressService;
    @Autowired AlertGroupingEngine groupingEngine;
    @Autowired AlertGroupRepository groupRepository;
    @Autowired AlertRepository alertRepository;
    @Autowired MutableClock clock;
    @Autowired AlertingTestConfig.StoreCleaner storeCleaner;

    @BeforeEach
    void setup() {
        storeCleaner.reset();
        clock.set(T0);
    }

    private AlertCreatedVO raise(String device, String rule, String severity) {
        return ingressService.createAlert(CreateAlertReq.builder()
                .deviceId(device).ruleId(rule).severity(severity).message(rule + " on " + device).build());
    }

    @Test
    void burstWithinWindowIsAbsorbedIntoOneGroup() {
        AlertCreatedVO first = raise("compressor-7", "vibration_high", "critical");
        clock.set(T0.plus(Duration.ofMinutes(2)));
        AlertCreatedVO second = raise("compressor-7", "vibration_high", "critical");
        clock.set(T0.plus(Duration.ofMinutes(4)));
        AlertCreatedVO third = raise("compressor-7", "vibration_high", "critical");

        assertEquals(first.getGroupId(), second.getGroupId());
        assertEquals(first.getGroupId(), third.getGroupId());

        AlertGroup g = groupingEngine.get(first.getGroupId());
        assertEquals(GroupStatus.ACTIVE, g.getStatus());
        assertEquals(3, g.getOccurrenceCount());
        assertEquals(T0, g.getFirstOccurrence());
        assertEquals(T0.plus(Duration.ofMinutes(4)), g.getLastOccurrence());
        assertEquals(first.getAlertId(), g.getRepresentativeAlertId());
        assertEquals("compressor-7:vibration_high:critical", g.getGroupKey());
        assertTrue(g.noiseReductionPct() >= 66.6);
        assertEquals(3, alertRepository.countByGroupId(g.getId()));

        GroupStatsVO stats = groupingEngine.statistics(g.getId());
        assertEquals(4.0, stats.getDurationMinutes());
        assertEquals(66.67, stats.getNoiseReductionPct());
    }

    @Test
    void exactlyWindowApartJoinsButOneSecondMoreOpensNewGroup() {
        AlertCreatedVO a = raise("pump-1", "pressure_low", "high");
        clock.set(T0.plus(Duration.ofMinutes(5)));
        AlertCreatedVO b = raise("pump-1", "pressure_low", "high");
        assertEquals(a.getGroupId(), b.getGroupId());

        clock.set(T0.plus(Duration.ofMinutes(10)).plusSeconds(1));
        AlertCreatedVO c = raise("pump-1", "pressure_low", "high");
        assertNotEquals(a.getGroupId(), c.getGroupId());

        AlertGroup old = groupingEngine.get(a.getGroupId());
        assertEquals(GroupStatus.CLOSED, old.getStatus());
        assertNull(old.getActiveKey());
        assertEquals("window_expired", old.getMetadata().get("close_reason"));
        assertEquals(1, groupingEngine.list(null, null, GroupStatus.ACTIVE, 10).size());
    }

    @Test
    void differentKeysNeverShareAGroup() {
        AlertCreatedVO a = raise("pump-1", "pressure_low", "high");
        AlertCreatedVO b = raise("pump-1", "pressure_low", "critical");
        AlertCreatedVO c = raise("pump-2", "pressure_low", "high");
        AlertCreatedVO d = raise("pump-1", "flow_low", "high");
        assertEquals(4, List.of(a.getGroupId(), b.getGroupId(), c.getGroupId(), d.getGroupId())
                .stream().distinct().count());
    }

    @Test
    void closedGroupNeverAbsorbsNewAlerts() {
        AlertCreatedVO a = raise("pump-1", "pressure_low", "high");
        groupingEngine.close(a.getGroupId(), "maintenance window");
        clock.advance(Duration.ofMinutes(1));
        AlertCreatedVO b = raise("pump-1", "pressure_low", "high");

        assertNotEquals(a.getGroupId(), b.getGroupId());
        assertEquals("maintenance window", groupingEngine.get(a.getGroupId()).getMetadata().get("close_reason"));
    }

    @Test
    void lastOccurrenceNeverMovesBackwards() {
        clock.set(T0.plus(Duration.ofMinutes(3)));
        AlertCreatedVO a = raise("pump-1", "pressure_low", "high");
        AlertGroup g = groupingEngine.get(a.getGroupId());

        // a late writer whose clock lags behind
        clock.set(T0.plus(Duration.ofMinutes(1)));
        raise("pump-1", "pressure_low", "high");

        AlertGroup after = groupingEngine.get(g.getId());
        assertEquals(2, after.getOccurrenceCount());
        assertEquals(T0.plus(Duration.ofMinutes(3)), after.getLastOccurrence());
        assertEquals(T0.plus(Duration.ofMinutes(1)), after.getFirstOccurrence());
    }

    @Test
    void resolvingEveryAlertClosesTheGroup() {
        AlertCreatedVO a = raise("pump-1", "pressure_low", "high");
        AlertCreatedVO b = raise("pump-1", "pressure_low", "high");

        ingressService.transition(a.getAlertId(), "resolved", "op-1", null, null);
        assertEquals(GroupStatus.ACTIVE, groupingEngine.get(a.getGroupId()).getStatus());

        ingressService.transition(b.getAlertId(), "resolved", "op-1", null, null);
        AlertGroup g = groupingEngine.get(a.getGroupId());
        assertEquals(GroupStatus.CLOSED, g.getStatus());
        assertEquals("all_resolved", g.getMetadata().get("close_reason"));
    }

    @Test
    void overallStatisticsReportNoiseReduction() {
        for (int i = 0; i < 4; i++) raise("pump-1", "pressure_low", "high");
        for (int i = 0; i < 2; i++) raise("pump-2", "pressure_low", "high");
        raise("pump-3", "pressure_low", "high");

        OverallGroupStatsVO stats = groupingEngine.overallStatistics();
        assertEquals(3, stats.getTotalGroups());
        assertEquals(3, stats.getActiveGroups());
        assertEquals(7, stats.getTotalAlerts());
        assertEquals(4, stats.getMaxGroupSize());
        assertEquals(2.33, stats.getAvgGroupSize());
        // (7 - 3) / 7
        assertEquals(57.14, stats.getNoiseReductionPct());
    }

    @Test
    void metadataMergeAndDelete() {
        AlertCreatedVO a = raise("pump-1", "pressure_low", "high");
        groupingEngine.updateMetadata(a.getGroupId(), Map.of("owner", "shift-b"));
        groupingEngine.updateMetadata(a.getGroupId(), Map.of("ticket", "INC-42"));
        AlertGroup g = groupingEngine.get(a.getGroupId());
        assertEquals("shift-b", g.getMetadata().get("owner"));
        assertEquals("INC-42", g.getMetadata().get("ticket"));

        groupingEngine.delete(a.getGroupId());
        assertNull(alertRepository.findById(a.getAlertId()).orElseThrow().getGroupId());
        assertEquals(ErrorKind.NOT_FOUND, assertThrows(AlertingException.class,
                () -> groupingEngine.get(a.getGroupId())).getKind());
    }

    @Test
    void deletingAlertsShrinksAndFinallyRemovesGroup() {
        AlertCreatedVO a = raise("pump-1", "pressure_low", "high");
        AlertCreatedVO b = raise("pump-1", "pressure_low", "high");

        ingressService.deleteAlert(a.getAlertId());
        AlertGroup g = groupingEngine.get(b.getGroupId());
        assertEquals(1, g.getOccurrenceCount());
        assertNull(g.getRepresentativeAlertId());

        ingressService.deleteAlert(b.getAlertId());
        assertTrue(groupRepository.findById(b.getGroupId()).isEmpty());
    }

    @Test
    void colonsInIdsDoNotMergeDistinctDevices() {
        AlertCreatedVO a = raise("plant:a", "r", "high");
        AlertCreatedVO b = raise("plant", "a:r", "high");

        assertNotEquals(a.getGroupId(), b.getGroupId());
        AlertGroup ga = groupingEngine.get(a.getGroupId());
        AlertGroup gb = groupingEngine.get(b.getGroupId());
        assertEquals("plant:a", ga.getDeviceId());
        assertEquals("plant", gb.getDeviceId());
        assertEquals(1, ga.getOccurrenceCount());
        assertEquals(1, gb.getOccurrenceCount());
        assertNotEquals(ga.getGroupKey(), gb.getGroupKey());
        assertEquals("plant\\:a:r:high", ga.getGroupKey());
    }

    @Test
    void concurrentIngestOfOneKeyKeepsSingleActiveGroup() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AlertCreatedVO>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return raise("kiln-2", "temp_high", "high");
            }));
        }
        start.countDown();

        int created = 0;
        int rejected = 0;
        for (Future<AlertCreatedVO> f : futures) {
            try {
                f.get(30, TimeUnit.SECONDS);
                created++;
            } catch (ExecutionException e) {
                // a lost race may be rejected; it must leave nothing behind
                rejected++;
            }
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(threads, created + rejected);
        assertTrue(created >= 1);
        List<AlertGroup> active = groupRepository.findAll().stream()
                .filter(g -> g.getStatus() == GroupStatus.ACTIVE)
                .toList();
        assertEquals(1, active.size());
        AlertGroup group = active.get(0);
        assertEquals(created, group.getOccurrenceCount());
        assertEquals(created, alertRepository.countByGroupId(group.getId()));
        assertEquals(created, alertRepository.count());
        assertEquals(1, groupRepository.count());
    }
}
