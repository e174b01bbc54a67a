package com.sandy.aiot.vision.alerting.service.impl;

import com.sandy.aiot.vision.alerting.entity.Alert;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.repository.AlertRepository;
import com.sandy.aiot.vision.alerting.service.EscalationService;
import com.sandy.aiot.vision.alerting.service.StoreTransactions;
import com.sandy.aiot.vision.alerting.vo.EscalationResultVO;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Periodic escalation scan. Each tick advances every due alert by at most one tier, each in its own
 * transaction; alerts left over when the batch or time budget runs out are picked up next tick.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EscalationDriver {

    private final AlertRepository alertRepository;
    private final EscalationService escalationService;
    private final StoreTransactions storeTransactions;
    private final Clock clock;

    @Value("${alerting.escalation.enabled:true}")
    private boolean enabled;
    @Value("${alerting.escalation.batch-size:100}")
    private int batchSize;
    @Value("${alerting.escalation.tick-budget-ms:10000}")
    private long tickBudgetMs;

    @PostConstruct
    public void init() {
        log.info("Escalation driver initialized: enabled={} batchSize={} tickBudgetMs={}", enabled, batchSize, tickBudgetMs);
    }

    @Scheduled(fixedDelayString = "#{${alerting.escalation.tick-interval-seconds:30} * 1000}",
            initialDelayString = "#{${alerting.escalation.tick-interval-seconds:30} * 1000}")
    public void scheduledTick() {
        if (!enabled) return;
        try { tick(); } catch (Exception e) { log.error("Scheduled escalation tick failed: {}", e.getMessage(), e); }
    }

    /**
     * One scan over due alerts.
     * @return number of alerts advanced by a tier
     */
    public int tick() {
        long deadline = System.nanoTime() + tickBudgetMs * 1_000_000L;
        Instant now = clock.instant();
        List<Alert> due = storeTransactions.read("escalation_scan",
                () -> alertRepository.findDueForEscalation(now, PageRequest.of(0, Math.max(1, batchSize))));
        int advanced = 0;
        int processed = 0;
        for (Alert alert : due) {
            if (System.nanoTime() > deadline) {
                log.warn("Escalation tick budget of {}ms exhausted after {}/{} alerts", tickBudgetMs, processed, due.size());
                break;
            }
            processed++;
            try {
                EscalationResultVO result = escalationService.escalate(alert.getId(), false);
                if (result.isEscalated()) advanced++;
            } catch (AlertingException e) {
                log.warn("Escalation of alert {} skipped this tick: {} {}", alert.getId(), e.getKind(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Escalation of alert {} failed: {}", alert.getId(), e.getMessage(), e);
            }
        }
        if (!due.isEmpty()) {
            log.debug("Escalation tick completed. due={} processed={} advanced={}", due.size(), processed, advanced);
        }
        return advanced;
    }

    public boolean isEnabled() { return enabled; }
}
