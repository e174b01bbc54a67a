package com.sandy.aiot.vision.alerting.service;

import com.sandy.aiot.vision.alerting.config.SlaTargetProperties;
import com.sandy.aiot.vision.alerting.entity.Alert;
import com.sandy.aiot.vision.alerting.entity.AlertSla;
import com.sandy.aiot.vision.alerting.entity.AlertState;
import com.sandy.aiot.vision.alerting.entity.Severity;
import com.sandy.aiot.vision.alerting.event.AlertTransitionEvent;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.repository.AlertSlaRepository;
import com.sandy.aiot.vision.alerting.vo.SlaReportVO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Time-to-acknowledge / time-to-resolve accounting. Targets are materialized with the alert; actuals are
 * written once by conditional updates after the transition that triggers them has committed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaTracker {

    static final Duration DEFAULT_REPORT_WINDOW = Duration.ofDays(30);

    private final AlertSlaRepository slaRepository;
    private final SlaTargetProperties targetProperties;
    private final StoreTransactions storeTransactions;
    private final Clock clock;

    /** Runs inside the alert creation transaction. */
    public AlertSla materialize(Alert alert) {
        SlaTargetProperties.Target target = targetProperties.targetFor(alert.getSeverity());
        return slaRepository.save(AlertSla.builder()
                .alertId(alert.getId())
                .severity(alert.getSeverity())
                .ttaTargetMin(target.getTtaMinutes())
                .ttrTargetMin(target.getTtrMinutes())
                .createdAt(alert.getCreatedAt())
                .build());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTransition(AlertTransitionEvent event) {
        try {
            if (event.toState().isHumanResponse()) {
                onFirstHumanResponse(event.alertId(), event.changedAt());
            } else if (event.toState() == AlertState.RESOLVED) {
                onResolved(event.alertId(), event.changedAt());
            }
        } catch (RuntimeException e) {
            // the transition is already committed; leave the row for reconciliation
            log.error("SLA update failed alert={} {} -> {}, needs reconciliation: {}",
                    event.alertId(), event.fromState().code(), event.toState().code(), e.getMessage(), e);
        }
    }

    public void onFirstHumanResponse(Long alertId, Instant at) {
        storeTransactions.writeIsolated("sla_first_response", () -> {
            recordFirstResponse(requireSla(alertId), at);
            return null;
        });
    }

    /** A direct new -> resolved transition also counts as the first response. */
    public void onResolved(Long alertId, Instant at) {
        storeTransactions.writeIsolated("sla_resolved", () -> {
            AlertSla sla = requireSla(alertId);
            if (sla.getTtaActualMin() == null) {
                recordFirstResponse(sla, at);
            }
            int actual = minutesSince(sla.getCreatedAt(), at);
            boolean breached = actual > sla.getTtrTargetMin();
            if (slaRepository.recordResolution(alertId, actual, at, breached) == 0) {
                log.debug("TTR already recorded for alert {}", alertId);
                return null;
            }
            if (breached) {
                log.warn("SLA BREACH: alert {} TTR {}min exceeded target {}min (severity: {})",
                        alertId, actual, sla.getTtrTargetMin(), sla.getSeverity().code());
            } else {
                log.info("Alert {}: TTR {}min (target: {}min)", alertId, actual, sla.getTtrTargetMin());
            }
            return null;
        });
    }

    private void recordFirstResponse(AlertSla sla, Instant at) {
        int actual = minutesSince(sla.getCreatedAt(), at);
        boolean breached = actual > sla.getTtaTargetMin();
        if (slaRepository.recordFirstResponse(sla.getAlertId(), actual, at, breached) == 0) {
            log.debug("TTA already recorded for alert {}", sla.getAlertId());
            return;
        }
        if (breached) {
            log.warn("SLA BREACH: alert {} TTA {}min exceeded target {}min (severity: {})",
                    sla.getAlertId(), actual, sla.getTtaTargetMin(), sla.getSeverity().code());
        } else {
            log.info("Alert {}: TTA {}min (target: {}min)", sla.getAlertId(), actual, sla.getTtaTargetMin());
        }
    }

    public AlertSla slaFor(Long alertId) {
        return storeTransactions.read("sla_get", () -> requireSla(alertId));
    }

    public SlaReportVO complianceReport(Severity severity, Instant from, Instant to) {
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_REPORT_WINDOW);
        if (start.isAfter(end)) {
            throw AlertingException.validation("from must not be after to");
        }
        List<AlertSla> rows = storeTransactions.read("sla_report", () -> slaRepository.findInWindow(severity, start, end));

        long acknowledged = 0, resolved = 0, ttaCompliant = 0, ttrCompliant = 0;
        long ttaSum = 0, ttrSum = 0;
        for (AlertSla s : rows) {
            if (s.getTtaActualMin() != null) {
                acknowledged++;
                ttaSum += s.getTtaActualMin();
                if (!s.isTtaBreached()) ttaCompliant++;
            }
            if (s.getTtrActualMin() != null) {
                resolved++;
                ttrSum += s.getTtrActualMin();
                if (!s.isTtrBreached()) ttrCompliant++;
            }
        }
        return SlaReportVO.builder()
                .severity(severity == null ? "all" : severity.code())
                .totalAlerts(rows.size())
                .acknowledgedAlerts(acknowledged)
                .resolvedAlerts(resolved)
                .ttaComplianceCount(ttaCompliant)
                .ttaComplianceRate(rate(ttaCompliant, acknowledged))
                .ttrComplianceCount(ttrCompliant)
                .ttrComplianceRate(rate(ttrCompliant, resolved))
                .avgTta(average(ttaSum, acknowledged))
                .avgTtr(average(ttrSum, resolved))
                .periodStart(start)
                .periodEnd(end)
                .build();
    }

    /**
     * @param type {@code tta}, {@code ttr} or {@code all}
     */
    public List<AlertSla> breached(String type, Severity severity, int limit) {
        String t = type == null ? "all" : type.trim().toLowerCase(Locale.ROOT);
        boolean tta = t.equals("tta") || t.equals("all");
        boolean ttr = t.equals("ttr") || t.equals("all");
        if (!tta && !ttr) {
            throw AlertingException.validation("type must be one of tta, ttr, all");
        }
        int size = Math.max(1, Math.min(limit, 1000));
        return storeTransactions.read("sla_breaches",
                () -> slaRepository.findBreached(tta, ttr, severity, PageRequest.of(0, size)));
    }

    private AlertSla requireSla(Long alertId) {
        return slaRepository.findByAlertId(alertId)
                .orElseThrow(() -> AlertingException.notFound("SLA record for alert", alertId));
    }

    static int minutesSince(Instant createdAt, Instant at) {
        long minutes = Duration.between(createdAt, at).toMinutes();
        return (int) Math.max(0, minutes);
    }

    private static double rate(long compliant, long total) {
        if (total == 0) return 0d;
        return Math.round(compliant * 1000d / total) / 10d;
    }

    private static double average(long sum, long count) {
        if (count == 0) return 0d;
        return Math.round(sum * 10d / count) / 10d;
    }
}
