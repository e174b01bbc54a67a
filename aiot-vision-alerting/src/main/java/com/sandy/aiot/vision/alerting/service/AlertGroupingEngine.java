package com.sandy.aiot.vision.alerting.service;

import com.sandy.aiot.vision.alerting.entity.Alert;
import com.sandy.aiot.vision.alerting.entity.AlertGroup;
import com.sandy.aiot.vision.alerting.entity.AlertState;
import com.sandy.aiot.vision.alerting.entity.GroupStatus;
import com.sandy.aiot.vision.alerting.entity.Severity;
import com.sandy.aiot.vision.alerting.event.AlertTransitionEvent;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.repository.AlertGroupRepository;
import com.sandy.aiot.vision.alerting.repository.AlertRepository;
import com.sandy.aiot.vision.alerting.vo.GroupStatsVO;
import com.sandy.aiot.vision.alerting.vo.OverallGroupStatsVO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds repeated alerts for the same device, rule and severity into one active group while they keep
 * arriving within the grouping window.
 */
@Service
@Slf4j
public class AlertGroupingEngine {

    private final AlertGroupRepository groupRepository;
    private final AlertRepository alertRepository;
    private final StoreTransactions storeTransactions;
    private final Clock clock;
    private final Duration window;
    private final boolean closeWhenResolved;

    public AlertGroupingEngine(AlertGroupRepository groupRepository,
                               AlertRepository alertRepository,
                               StoreTransactions storeTransactions,
                               Clock clock,
                               @Value("${alerting.grouping.window-minutes:5}") long windowMinutes,
                               @Value("${alerting.grouping.close-when-resolved:true}") boolean closeWhenResolved) {
        this.groupRepository = groupRepository;
        this.alertRepository = alertRepository;
        this.storeTransactions = storeTransactions;
        this.clock = clock;
        this.window = Duration.ofMinutes(windowMinutes);
        this.closeWhenResolved = closeWhenResolved;
    }

    /**
     * Links a freshly persisted alert to its group. Runs inside the ingest transaction; the active-key row
     * lock serializes concurrent ingests of one key, and a lost race on the first insert surfaces as a
     * uniqueness violation that the ingest retries.
     */
    public AlertGroup assign(Alert alert) {
        String key = AlertGroup.compositeKey(alert.getDeviceId(), alert.getRuleId(), alert.getSeverity());
        Instant t = alert.getCreatedAt();
        Instant now = clock.instant();

        AlertGroup active = groupRepository.findActiveByKeyForUpdate(key).orElse(null);
        if (active != null && !t.isAfter(active.getLastOccurrence().plus(window))) {
            active.setOccurrenceCount(active.getOccurrenceCount() + 1);
            if (t.isAfter(active.getLastOccurrence())) active.setLastOccurrence(t);
            if (t.isBefore(active.getFirstOccurrence())) active.setFirstOccurrence(t);
            active.setUpdatedAt(now);
            alert.setGroupId(active.getId());
            log.debug("Alert {} joined group {} (count={})", alert.getId(), active.getId(), active.getOccurrenceCount());
            return active;
        }
        if (active != null) {
            active.close(now, "window_expired");
            groupRepository.saveAndFlush(active);
            log.info("Group {} closed, window expired for key {}", active.getId(), key);
        }

        AlertGroup group = groupRepository.saveAndFlush(AlertGroup.builder()
                .deviceId(alert.getDeviceId())
                .ruleId(alert.getRuleId())
                .severity(alert.getSeverity())
                .groupKey(key)
                .activeKey(key)
                .firstOccurrence(t)
                .lastOccurrence(t)
                .occurrenceCount(1)
                .status(GroupStatus.ACTIVE)
                .representativeAlertId(alert.getId())
                .createdAt(now)
                .updatedAt(now)
                .build());
        alert.setGroupId(group.getId());
        log.info("Opened alert group {} for key {}", group.getId(), key);
        return group;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTransition(AlertTransitionEvent event) {
        if (!closeWhenResolved || event.toState() != AlertState.RESOLVED || event.groupId() == null) {
            return;
        }
        try {
            storeTransactions.writeIsolated("group_close_on_resolve", () -> {
                groupRepository.findByIdForUpdate(event.groupId())
                        .filter(g -> g.getStatus() == GroupStatus.ACTIVE)
                        .filter(g -> alertRepository.countByGroupIdAndCurrentStateNot(g.getId(), AlertState.RESOLVED) == 0)
                        .ifPresent(g -> {
                            g.close(clock.instant(), "all_resolved");
                            log.info("Group {} closed, all alerts resolved", g.getId());
                        });
                return null;
            });
        } catch (RuntimeException e) {
            log.error("Closing group {} after resolve of alert {} failed: {}", event.groupId(), event.alertId(), e.getMessage(), e);
        }
    }

    /** Called inside the alert delete transaction. */
    public void onAlertDeleted(Alert alert) {
        if (alert.getGroupId() == null) return;
        groupRepository.findByIdForUpdate(alert.getGroupId()).ifPresent(g -> {
            int remaining = Math.max(0, g.getOccurrenceCount() - 1);
            if (remaining == 0) {
                groupRepository.delete(g);
                log.info("Group {} removed with its last alert {}", g.getId(), alert.getId());
                return;
            }
            g.setOccurrenceCount(remaining);
            if (alert.getId().equals(g.getRepresentativeAlertId())) {
                g.setRepresentativeAlertId(null);
            }
            g.setUpdatedAt(clock.instant());
        });
    }

    public AlertGroup close(Long groupId, String reason) {
        return storeTransactions.write("group_close", () -> {
            AlertGroup g = groupRepository.findByIdForUpdate(groupId)
                    .orElseThrow(() -> AlertingException.notFound("Alert group", groupId));
            if (g.getStatus() == GroupStatus.CLOSED) {
                return g;
            }
            g.close(clock.instant(), reason == null || reason.isBlank() ? "manual" : reason);
            log.info("Group {} closed manually", groupId);
            return g;
        });
    }

    public AlertGroup updateMetadata(Long groupId, Map<String, Object> patch) {
        if (patch == null || patch.isEmpty()) {
            throw AlertingException.validation("metadata must not be empty");
        }
        return storeTransactions.write("group_metadata", () -> {
            AlertGroup g = groupRepository.findByIdForUpdate(groupId)
                    .orElseThrow(() -> AlertingException.notFound("Alert group", groupId));
            Map<String, Object> merged = new LinkedHashMap<>(g.getMetadata() == null ? Map.of() : g.getMetadata());
            merged.putAll(patch);
            g.setMetadata(merged);
            g.setUpdatedAt(clock.instant());
            return g;
        });
    }

    /** Alerts keep their own history; they are only unlinked from the group. */
    public void delete(Long groupId) {
        storeTransactions.write("group_delete", () -> {
            AlertGroup g = groupRepository.findByIdForUpdate(groupId)
                    .orElseThrow(() -> AlertingException.notFound("Alert group", groupId));
            int unlinked = alertRepository.unlinkGroup(groupId);
            groupRepository.delete(g);
            log.info("Deleted group {} ({} alerts unlinked)", groupId, unlinked);
            return null;
        });
    }

    public AlertGroup get(Long groupId) {
        return storeTransactions.read("group_get", () -> groupRepository.findById(groupId)
                .orElseThrow(() -> AlertingException.notFound("Alert group", groupId)));
    }

    public List<AlertGroup> list(String deviceId, Severity severity, GroupStatus status, int limit) {
        int size = Math.max(1, Math.min(limit, 1000));
        return storeTransactions.read("group_list",
                () -> groupRepository.search(deviceId, severity, status, PageRequest.of(0, size)));
    }

    public GroupStatsVO statistics(Long groupId) {
        AlertGroup g = get(groupId);
        Duration span = Duration.between(g.getFirstOccurrence(), g.getLastOccurrence());
        double spanMinutes = span.getSeconds() / 60d;
        return GroupStatsVO.builder()
                .groupId(g.getId())
                .groupKey(g.getGroupKey())
                .status(g.getStatus().code())
                .occurrenceCount(g.getOccurrenceCount())
                .firstOccurrence(g.getFirstOccurrence())
                .lastOccurrence(g.getLastOccurrence())
                .durationMinutes(Math.round(spanMinutes * 10d) / 10d)
                .frequencyPerHour(spanMinutes > 0 ? Math.round(g.getOccurrenceCount() * 600d / spanMinutes) / 10d : 0d)
                .noiseReductionPct(g.noiseReductionPct())
                .build();
    }

    public OverallGroupStatsVO overallStatistics() {
        return storeTransactions.read("group_overall", () -> {
            long total = groupRepository.count();
            long active = groupRepository.countByStatus(GroupStatus.ACTIVE);
            long occurrences = groupRepository.sumOccurrences();
            double reduction = occurrences == 0 ? 0d
                    : Math.round((occurrences - total) * 10000d / occurrences) / 100d;
            return OverallGroupStatsVO.builder()
                    .totalGroups(total)
                    .activeGroups(active)
                    .closedGroups(total - active)
                    .totalAlerts(occurrences)
                    .maxGroupSize(groupRepository.maxOccurrences())
                    .avgGroupSize(total == 0 ? 0d : Math.round(occurrences * 100d / total) / 100d)
                    .noiseReductionPct(reduction)
                    .build();
        });
    }

    public Duration getWindow() {
        return window;
    }
}
