package com.sandy.aiot.vision.alerting.service;

import com.sandy.aiot.vision.alerting.entity.Alert;
import com.sandy.aiot.vision.alerting.entity.AlertGroup;
import com.sandy.aiot.vision.alerting.entity.AlertSla;
import com.sandy.aiot.vision.alerting.entity.AlertState;
import com.sandy.aiot.vision.alerting.entity.AlertStateEntry;
import com.sandy.aiot.vision.alerting.entity.Severity;
import com.sandy.aiot.vision.alerting.entity.converter.JsonAttributeConverter;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.repository.AlertRepository;
import com.sandy.aiot.vision.alerting.repository.AlertSlaRepository;
import com.sandy.aiot.vision.alerting.repository.AlertStateEntryRepository;
import com.sandy.aiot.vision.alerting.repository.NotificationIntentRepository;
import com.sandy.aiot.vision.alerting.vo.AlertCreatedVO;
import com.sandy.aiot.vision.alerting.vo.AlertDetailVO;
import com.sandy.aiot.vision.alerting.vo.AlertItemVO;
import com.sandy.aiot.vision.alerting.vo.CreateAlertReq;
import com.sandy.aiot.vision.alerting.vo.PageVO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for alert producers and operators. Each public method is one store transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertIngressService {

    static final int MAX_ID_LENGTH = 128;
    static final int MAX_MESSAGE_LENGTH = 1000;
    static final int MAX_NOTES_LENGTH = 2000;
    static final int MAX_PAYLOAD_JSON = 8000;
    // the entry column holds 4000; the rest is left for the carried escalation keys
    static final int MAX_METADATA_JSON = 3800;
    static final int MAX_PAGE_SIZE = 200;

    private final AlertRepository alertRepository;
    private final AlertStateEntryRepository entryRepository;
    private final AlertSlaRepository slaRepository;
    private final NotificationIntentRepository intentRepository;
    private final AlertStateMachine stateMachine;
    private final SlaTracker slaTracker;
    private final AlertGroupingEngine groupingEngine;
    private final EscalationService escalationService;
    private final StoreTransactions storeTransactions;
    private final Clock clock;

    /**
     * Inserts the alert, its initial history entry and SLA row, and links it to a group, all in one
     * transaction. Losing the race to open a group retries the whole ingest once.
     */
    public AlertCreatedVO createAlert(CreateAlertReq req) {
        String deviceId = required(req.getDeviceId(), "device_id", MAX_ID_LENGTH);
        String ruleId = required(req.getRuleId(), "rule_id", MAX_ID_LENGTH);
        String message = required(req.getMessage(), "message", MAX_MESSAGE_LENGTH);
        Severity severity = Severity.fromCode(req.getSeverity());
        if (severity == null) {
            throw AlertingException.validation("severity is required and must be one of critical, high, medium, low, info");
        }
        Map<String, Object> payload = req.getPayload() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(req.getPayload());
        boundedJson(payload, "payload", MAX_PAYLOAD_JSON);

        AlertCreatedVO created = storeTransactions.writeRetryingOnConflict("create_alert", () -> {
            Alert alert = alertRepository.save(Alert.builder()
                    .deviceId(deviceId)
                    .ruleId(ruleId)
                    .severity(severity)
                    .message(message)
                    .payload(payload)
                    .createdAt(clock.instant())
                    .currentState(AlertState.NEW)
                    .build());
            stateMachine.appendInitial(alert);
            AlertSla sla = slaTracker.materialize(alert);
            AlertGroup group = groupingEngine.assign(alert);
            escalationService.scheduleInitial(alert);
            return AlertCreatedVO.builder()
                    .alertId(alert.getId())
                    .state(AlertState.NEW.code())
                    .severity(severity.code())
                    .sla(new AlertCreatedVO.SlaTargets(sla.getTtaTargetMin(), sla.getTtrTargetMin()))
                    .groupId(group.getId())
                    .build();
        });
        log.info("Created alert id={} device={} rule={} severity={} group={}",
                created.getAlertId(), deviceId, ruleId, severity.code(), created.getGroupId());
        return created;
    }

    public AlertStateEntry transition(Long alertId, String targetState, String actor, String notes, Map<String, Object> metadata) {
        AlertState target = AlertState.fromCode(targetState);
        checkEntryInput(actor, notes, metadata);
        return storeTransactions.write("transition",
                () -> stateMachine.transition(alertId, target, actor, notes, metadata, false));
    }

    /** Recovery path that bypasses the transition table; never exposed to operators. */
    public AlertStateEntry forceTransition(Long alertId, AlertState target, String actor, String notes) {
        checkEntryInput(actor, notes, null);
        return storeTransactions.write("force_transition",
                () -> stateMachine.transition(alertId, target, actor, notes, null, true));
    }

    public AlertStateEntry addNote(Long alertId, String actor, String notes, Map<String, Object> metadata) {
        checkEntryInput(actor, notes, metadata);
        return storeTransactions.write("add_note", () -> stateMachine.addNote(alertId, actor, notes, metadata));
    }

    public AlertDetailVO getAlert(Long alertId) {
        return storeTransactions.read("get_alert", () -> {
            Alert alert = alertRepository.findById(alertId)
                    .orElseThrow(() -> AlertingException.notFound("Alert", alertId));
            List<AlertStateEntry> history = stateMachine.history(alertId);
            AlertStateEntry latest = history.isEmpty() ? null : history.get(history.size() - 1);
            return AlertDetailVO.builder()
                    .alert(alert)
                    .state(latest == null ? alert.getCurrentState().code() : latest.getState().code())
                    .history(history)
                    .sla(slaRepository.findByAlertId(alertId).orElse(null))
                    .groupId(alert.getGroupId())
                    .escalationTier(latest == null ? 0 : latest.escalationTier())
                    .build();
        });
    }

    /**
     * @param windowMinutes only alerts created in the last N minutes; null for no bound
     */
    public PageVO<AlertItemVO> list(String severityCode, String stateCode, String deviceId, Integer windowMinutes,
                                    int page, int size) {
        Severity severity = optionalSeverity(severityCode);
        AlertState state = null;
        if (stateCode != null && !stateCode.isBlank()) {
            state = AlertState.fromCode(stateCode);
            if (state == null) throw AlertingException.validation("Unknown state: " + stateCode);
        }
        if (windowMinutes != null && windowMinutes <= 0) {
            throw AlertingException.validation("window must be a positive number of minutes");
        }
        Instant since = windowMinutes == null ? null : clock.instant().minus(Duration.ofMinutes(windowMinutes));
        PageRequest pageable = PageRequest.of(Math.max(0, page), Math.max(1, Math.min(size, MAX_PAGE_SIZE)),
                Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));
        AlertState s = state;
        String device = deviceId == null || deviceId.isBlank() ? null : deviceId.trim();
        return storeTransactions.read("list_alerts",
                () -> PageVO.of(alertRepository.search(severity, s, device, since, pageable), AlertItemVO::of));
    }

    public List<AlertItemVO> listByRule(String ruleId, String deviceId, String severityCode, int limit) {
        Severity severity = optionalSeverity(severityCode);
        String device = deviceId == null || deviceId.isBlank() ? null : deviceId.trim();
        int size = Math.max(1, Math.min(limit, 1000));
        return storeTransactions.read("list_alerts_by_rule", () -> alertRepository
                .findByRule(ruleId, device, severity, PageRequest.of(0, size))
                .stream().map(AlertItemVO::of).toList());
    }

    /** Removes the alert with its history, SLA row and notification intents. */
    public void deleteAlert(Long alertId) {
        storeTransactions.write("delete_alert", () -> {
            Alert alert = stateMachine.lockAlert(alertId);
            entryRepository.deleteByAlertId(alertId);
            slaRepository.deleteByAlertId(alertId);
            intentRepository.deleteByAlertId(alertId);
            groupingEngine.onAlertDeleted(alert);
            alertRepository.delete(alert);
            return null;
        });
        log.info("Deleted alert id={}", alertId);
    }

    public long countOpen() {
        return storeTransactions.read("count_open", () -> alertRepository.countByCurrentStateNot(AlertState.RESOLVED));
    }

    private static Severity optionalSeverity(String code) {
        if (code == null || code.isBlank()) return null;
        Severity severity = Severity.fromCode(code);
        if (severity == null) throw AlertingException.validation("Unknown severity: " + code);
        return severity;
    }

    private static void checkEntryInput(String actor, String notes, Map<String, Object> metadata) {
        if (actor != null && actor.length() > MAX_ID_LENGTH) {
            throw AlertingException.validation("actor must be at most " + MAX_ID_LENGTH + " characters");
        }
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw AlertingException.validation("notes must be at most " + MAX_NOTES_LENGTH + " characters");
        }
        boundedJson(metadata, "metadata", MAX_METADATA_JSON);
    }

    private static void boundedJson(Map<String, Object> value, String field, int maxLength) {
        int length;
        try {
            length = JsonAttributeConverter.storedLength(value);
        } catch (IllegalArgumentException e) {
            throw AlertingException.validation(field + " is not valid JSON: " + e.getMessage());
        }
        if (length > maxLength) {
            throw AlertingException.validation(field + " must serialize to at most " + maxLength + " characters");
        }
    }

    private static String required(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw AlertingException.validation(field + " is required");
        }
        String v = value.trim();
        if (v.length() > maxLength) {
            throw AlertingException.validation(field + " must be at most " + maxLength + " characters");
        }
        return v;
    }
}
