package com.sandy.aiot.vision.alerting;

import com.sandy.aiot.vision.alerting.entity.AlertSla;
import com.sandy.aiot.vision.alerting.entity.AlertState;
import com.sandy.aiot.vision.alerting.entity.AlertStateEntry;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.exception.ErrorKind;
import com.sandy.aiot.vision.alerting.repository.AlertRepository;
import com.sandy.aiot.vision.alerting.repository.AlertSlaRepository;
import com.sandy.aiot.vision.alerting.service.AlertIngressService;
import com.sandy.aiot.vision.alerting.service.SlaTracker;
import com.sandy.aiot.vision.alerting.support.AlertingTestConfig;
import com.sandy.aiot.vision.alerting.support.MutableClock;
import com.sandy.aiot.vision.alerting.vo.AlertCreatedVO;
import com.sandy.aiot.vision.alerting.vo.AlertDetailVO;
import com.sandy.aiot.vision.alerting.vo.AlertItemVO;
import com.sandy.aiot.vision.alerting.vo.CreateAlertReq;
import com.sandy.aiot.vision.alerting.vo.PageVO;
import com.sandy.aiot.vision.alerting.vo.SlaReportVO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
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
class AlertLifecycleIntegrationTest {

    @Autowired AlertIngressService ingressService;
    @Autowired SlaTracker slaTracker;
    @Autowired AlertSlaRepository slaRepository;
    @Autowired AlertRepository alertRepository;
    @Autowired MutableClock clock;
    @Autowired AlertingTestConfig.StoreCleaner storeCleaner;

    @BeforeEach
    void setup() {
        storeCleaner.reset();
        clock.set(T0);
    }

    private AlertCreatedVO create(String device, String severity) {
        return ingressService.createAlert(CreateAlertReq.builder()
                .deviceId(device)
                .ruleId("temp_high")
                .severity(severity)
                .message("Temperature above limit")
                .payload(Map.of("value", 92.5))
                .build());
    }

    private AlertSla sla(Long alertId) {
        return slaRepository.findByAlertId(alertId).orElseThrow();
    }

    @Test
    void creationWritesAlertHistorySlaAndGroup() {
        AlertCreatedVO created = create("pump-1", "critical");

        assertNotNull(created.getAlertId());
        assertEquals("new", created.getState());
        assertEquals(5, created.getSla().getTtaTargetMin());
        assertEquals(30, created.getSla().getTtrTargetMin());
        assertNotNull(created.getGroupId());

        AlertDetailVO detail = ingressService.getAlert(created.getAlertId());
        assertEquals(1, detail.getHistory().size());
        AlertStateEntry first = detail.getHistory().get(0);
        assertEquals(AlertState.NEW, first.getState());
        assertNull(first.getChangedBy());
        assertEquals(T0, first.getChangedAt());
        assertEquals(T0, detail.getSla().getCreatedAt());
        assertNull(detail.getSla().getTtaActualMin());
        assertEquals(92.5, ((Number) detail.getAlert().getPayload().get("value")).doubleValue());
    }

    @Test
    void criticalAlertHandledWithinSla() {
        Long id = create("pump-1", "critical").getAlertId();

        clock.set(T0.plus(Duration.ofMinutes(3)));
        ingressService.transition(id, "acknowledged", "op-1", "on it", null);
        clock.set(T0.plus(Duration.ofMinutes(20)));
        ingressService.transition(id, "resolved", "op-1", "valve replaced", null);

        AlertSla s = sla(id);
        assertEquals(3, s.getTtaActualMin());
        assertEquals(20, s.getTtrActualMin());
        assertFalse(s.isTtaBreached());
        assertFalse(s.isTtrBreached());
        assertEquals(T0.plus(Duration.ofMinutes(3)), s.getAcknowledgedAt());

        List<AlertStateEntry> history = ingressService.getAlert(id).getHistory();
        assertEquals(List.of(AlertState.NEW, AlertState.ACKNOWLEDGED, AlertState.RESOLVED),
                history.stream().map(AlertStateEntry::getState).toList());
        assertEquals("op-1", history.get(1).getChangedBy());
        assertEquals(AlertState.RESOLVED, alertRepository.findById(id).orElseThrow().getCurrentState());
    }

    @Test
    void lateAcknowledgementBreachesTta() {
        Long id = create("pump-1", "critical").getAlertId();

        clock.set(T0.plus(Duration.ofMinutes(10)));
        ingressService.transition(id, "acknowledged", "op-1", null, null);

        AlertSla s = sla(id);
        assertEquals(10, s.getTtaActualMin());
        assertTrue(s.isTtaBreached());
        assertNull(s.getTtrActualMin());
    }

    @Test
    void partialMinutesAreTruncated() {
        Long id = create("pump-1", "critical").getAlertId();
        clock.set(T0.plus(Duration.ofSeconds(5 * 60 + 59)));
        ingressService.transition(id, "investigating", "op-1", null, null);

        AlertSla s = sla(id);
        assertEquals(5, s.getTtaActualMin());
        assertFalse(s.isTtaBreached());
    }

    @Test
    void firstHumanResponseIsRecordedOnce() {
        Long id = create("pump-1", "high").getAlertId();
        clock.set(T0.plus(Duration.ofMinutes(4)));
        ingressService.transition(id, "acknowledged", "op-1", null, null);
        clock.set(T0.plus(Duration.ofMinutes(30)));
        ingressService.transition(id, "investigating", "op-2", null, null);

        assertEquals(4, sla(id).getTtaActualMin());
        assertEquals(T0.plus(Duration.ofMinutes(4)), sla(id).getAcknowledgedAt());
    }

    @Test
    void directResolveAlsoSetsTta() {
        Long id = create("pump-1", "medium").getAlertId();
        clock.set(T0.plus(Duration.ofMinutes(7)));
        ingressService.transition(id, "resolved", "op-1", "false positive", null);

        AlertSla s = sla(id);
        assertEquals(7, s.getTtaActualMin());
        assertEquals(7, s.getTtrActualMin());
    }

    @Test
    void resolvedIsTerminal() {
        Long id = create("pump-1", "low").getAlertId();
        ingressService.transition(id, "resolved", "op-1", null, null);

        for (String target : List.of("new", "acknowledged", "investigating", "resolved")) {
            AlertingException e = assertThrows(AlertingException.class,
                    () -> ingressService.transition(id, target, "op-1", null, null));
            assertEquals(ErrorKind.INVALID_TRANSITION, e.getKind(), target);
        }
        assertEquals(2, ingressService.getAlert(id).getHistory().size());
    }

    @Test
    void resolutionTimeIsSetAtMostOnce() {
        Long id = create("pump-1", "critical").getAlertId();
        clock.set(T0.plus(Duration.ofMinutes(12)));
        ingressService.transition(id, "resolved", "op-1", null, null);

        // recovery reopens and resolves again; the first resolution stands
        clock.set(T0.plus(Duration.ofMinutes(50)));
        ingressService.forceTransition(id, AlertState.INVESTIGATING, "system-recovery", "reopened");
        clock.set(T0.plus(Duration.ofMinutes(90)));
        ingressService.transition(id, "resolved", "op-1", null, null);

        AlertSla s = sla(id);
        assertEquals(12, s.getTtrActualMin());
        assertFalse(s.isTtrBreached());
        assertEquals(T0.plus(Duration.ofMinutes(12)), s.getResolvedAt());

        List<AlertStateEntry> history = ingressService.getAlert(id).getHistory();
        assertEquals(Boolean.TRUE, history.get(2).getMetadata().get("forced"));
    }

    @Test
    void invalidTransitionReportsAllowedTargets() {
        Long id = create("pump-1", "high").getAlertId();
        ingressService.transition(id, "investigating", "op-1", null, null);

        AlertingException e = assertThrows(AlertingException.class,
                () -> ingressService.transition(id, "acknowledged", "op-1", null, null));
        assertEquals(ErrorKind.INVALID_TRANSITION, e.getKind());
        assertEquals("investigating", e.getDetail().get("from_state"));
        assertEquals(List.of("resolved"), e.getDetail().get("allowed"));
    }

    @Test
    void validationFailures() {
        assertEquals(ErrorKind.VALIDATION, assertThrows(AlertingException.class,
                () -> create("pump-1", "urgent")).getKind());
        assertEquals(ErrorKind.VALIDATION, assertThrows(AlertingException.class,
                () -> create(" ", "high")).getKind());
        Long id = create("pump-1", "high").getAlertId();
        assertEquals(ErrorKind.VALIDATION, assertThrows(AlertingException.class,
                () -> ingressService.transition(id, "closed", "op-1", null, null)).getKind());
        assertEquals(ErrorKind.VALIDATION, assertThrows(AlertingException.class,
                () -> ingressService.addNote(id, "op-1", "  ", null)).getKind());
        assertEquals(ErrorKind.NOT_FOUND, assertThrows(AlertingException.class,
                () -> ingressService.transition(999_999L, "resolved", "op-1", null, null)).getKind());
    }

    @Test
    void notesKeepCurrentState() {
        Long id = create("pump-1", "high").getAlertId();
        ingressService.transition(id, "acknowledged", "op-1", null, null);
        clock.advance(Duration.ofMinutes(1));
        AlertStateEntry note = ingressService.addNote(id, "op-2", "called the plant", Map.of("ticket", "INC-7"));

        assertEquals(AlertState.ACKNOWLEDGED, note.getState());
        assertEquals("INC-7", note.getMetadata().get("ticket"));
        assertEquals(3, ingressService.getAlert(id).getHistory().size());
        // a note is not a transition; acknowledged -> investigating is still valid
        ingressService.transition(id, "investigating", "op-2", null, null);
    }

    @Test
    void listingFiltersByStateSeverityAndDevice() {
        Long a = create("pump-1", "critical").getAlertId();
        create("pump-2", "critical");
        create("pump-1", "low");
        ingressService.transition(a, "acknowledged", "op-1", null, null);

        PageVO<AlertItemVO> acked = ingressService.list(null, "acknowledged", null, null, 0, 50);
        assertEquals(1, acked.getTotalElements());
        assertEquals(a, acked.getContent().get(0).getId());

        assertEquals(2, ingressService.list("critical", null, null, null, 0, 50).getTotalElements());
        assertEquals(2, ingressService.list(null, null, "pump-1", null, 0, 50).getTotalElements());
        assertEquals(3, ingressService.list(null, null, null, 60, 0, 50).getTotalElements());

        clock.advance(Duration.ofHours(2));
        assertEquals(0, ingressService.list(null, null, null, 60, 0, 50).getTotalElements());
    }

    @Test
    void deleteCascadesToHistoryAndSla() {
        Long id = create("pump-1", "high").getAlertId();
        ingressService.transition(id, "acknowledged", "op-1", null, null);
        ingressService.deleteAlert(id);

        assertTrue(alertRepository.findById(id).isEmpty());
        assertTrue(slaRepository.findByAlertId(id).isEmpty());
        assertEquals(ErrorKind.NOT_FOUND, assertThrows(AlertingException.class,
                () -> ingressService.getAlert(id)).getKind());
    }

    @Test
    void complianceReportCountsRespondedAlerts() {
        Long fast = create("pump-1", "critical").getAlertId();
        Long slow = create("pump-2", "critical").getAlertId();
        create("pump-3", "critical");

        clock.set(T0.plus(Duration.ofMinutes(2)));
        ingressService.transition(fast, "acknowledged", "op-1", null, null);
        clock.set(T0.plus(Duration.ofMinutes(8)));
        ingressService.transition(slow, "acknowledged", "op-1", null, null);
        clock.set(T0.plus(Duration.ofMinutes(25)));
        ingressService.transition(fast, "resolved", "op-1", null, null);

        SlaReportVO report = slaTracker.complianceReport(null, null, null);
        assertEquals(3, report.getTotalAlerts());
        assertEquals(2, report.getAcknowledgedAlerts());
        assertEquals(1, report.getResolvedAlerts());
        assertEquals(1, report.getTtaComplianceCount());
        assertEquals(50.0, report.getTtaComplianceRate());
        assertEquals(100.0, report.getTtrComplianceRate());
        assertEquals(5.0, report.getAvgTta());
        assertEquals(25.0, report.getAvgTtr());

        List<AlertSla> breaches = slaTracker.breached("tta", null, 10);
        assertEquals(1, breaches.size());
        assertEquals(slow, breaches.get(0).getAlertId());
        assertTrue(slaTracker.breached("ttr", null, 10).isEmpty());
    }

    @Test
    void reservedMetadataKeysAreRejected() {
        Long id = create("pump-9", "high").getAlertId();

        AlertingException onTransition = assertThrows(AlertingException.class,
                () -> ingressService.transition(id, "investigating", "op-1", null, Map.of("escalation_tier", 0)));
        assertEquals(ErrorKind.VALIDATION, onTransition.getKind());
        assertEquals("escalation_tier", onTransition.getDetail().get("key"));
        assertEquals(ErrorKind.VALIDATION, assertThrows(AlertingException.class,
                () -> ingressService.addNote(id, "op-1", "checked", Map.of("policy_id", 7))).getKind());
        assertEquals(ErrorKind.VALIDATION, assertThrows(AlertingException.class,
                () -> ingressService.transition(id, "resolved", "op-1", null, Map.of("forced", true))).getKind());

        assertEquals(1, ingressService.getAlert(id).getHistory().size());
        assertEquals("new", ingressService.getAlert(id).getState());
    }

    @Test
    void oversizedEntryInputIsValidationNotConflict() {
        Long id = create("pump-9", "high").getAlertId();
        String longNotes = "n".repeat(2500);

        assertEquals(ErrorKind.VALIDATION, assertThrows(AlertingException.class,
                () -> ingressService.addNote(id, "op-1", longNotes, null)).getKind());
        assertEquals(ErrorKind.VALIDATION, assertThrows(AlertingException.class,
                () -> ingressService.transition(id, "acknowledged", "op-1", longNotes, null)).getKind());
        assertEquals(ErrorKind.VALIDATION, assertThrows(AlertingException.class,
                () -> ingressService.transition(id, "acknowledged", "u".repeat(200), null, null)).getKind());
        assertEquals(ErrorKind.VALIDATION, assertThrows(AlertingException.class,
                () -> ingressService.transition(id, "acknowledged", "op-1", null, Map.of("trace", "t".repeat(5000)))).getKind());

        Map<String, Object> bigPayload = new LinkedHashMap<>();
        bigPayload.put("samples", "s".repeat(9000));
        assertEquals(ErrorKind.VALIDATION, assertThrows(AlertingException.class,
                () -> ingressService.createAlert(CreateAlertReq.builder()
                        .deviceId("pump-9").ruleId("temp_high").severity("low").message("m").payload(bigPayload).build())).getKind());

        assertEquals(1, alertRepository.count());
        assertEquals("acknowledged", ingressService.transition(id, "acknowledged", "op-1", "n".repeat(2000), null)
                .getState().code());
    }

    @Test
    void concurrentTransitionsOnOneAlertHaveSingleWinner() throws Exception {
        Long id = create("pump-4", "critical").getAlertId();
        clock.set(T0.plus(Duration.ofMinutes(3)));

        int threads = 4;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AlertStateEntry>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String actor = "op-" + i;
            futures.add(pool.submit(() -> {
                start.await();
                return ingressService.transition(id, "acknowledged", actor, null, null);
            }));
        }
        start.countDown();

        int won = 0;
        for (Future<AlertStateEntry> f : futures) {
            try {
                f.get(30, TimeUnit.SECONDS);
                won++;
            } catch (ExecutionException e) {
                // losers see the acknowledged state, or time out on the row lock
                assertNotNull(e.getCause());
            }
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(1, won);
        List<AlertStateEntry> history = ingressService.getAlert(id).getHistory();
        assertEquals(2, history.size());
        assertEquals(1, history.stream().filter(e -> e.getState() == AlertState.ACKNOWLEDGED).count());
        assertEquals(AlertState.ACKNOWLEDGED, alertRepository.findById(id).orElseThrow().getCurrentState());
        assertEquals(3, sla(id).getTtaActualMin());
    }
}
