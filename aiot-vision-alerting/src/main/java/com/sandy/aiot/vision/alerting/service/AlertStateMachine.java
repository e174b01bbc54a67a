package com.sandy.aiot.vision.alerting.service;

import com.sandy.aiot.vision.alerting.entity.Alert;
import com.sandy.aiot.vision.alerting.entity.AlertState;
import com.sandy.aiot.vision.alerting.entity.AlertStateEntry;
import com.sandy.aiot.vision.alerting.event.AlertTransitionEvent;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.exception.ErrorKind;
import com.sandy.aiot.vision.alerting.repository.AlertRepository;
import com.sandy.aiot.vision.alerting.repository.AlertStateEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Owns the alert history. Every method must run inside a caller transaction; writes lock the alert row
 * first so concurrent transitions on one alert are serialized and the loser validates against the newer state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertStateMachine {

    static final String META_FORCED = "forced";
    static final List<String> RESERVED_METADATA_KEYS =
            List.of(AlertStateEntry.META_ESCALATION_TIER, AlertStateEntry.META_POLICY_ID, META_FORCED);

    private final AlertRepository alertRepository;
    private final AlertStateEntryRepository entryRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /** First entry of every alert: {@code new}, system actor, written with the alert. */
    public AlertStateEntry appendInitial(Alert alert) {
        AlertStateEntry entry = AlertStateEntry.builder()
                .alertId(alert.getId())
                .state(AlertState.NEW)
                .changedBy(null)
                .changedAt(alert.getCreatedAt())
                .notes("Alert created")
                .build();
        alert.setCurrentState(AlertState.NEW);
        return entryRepository.save(entry);
    }

    public AlertStateEntry transition(Long alertId, AlertState target, String actor, String notes,
                                      Map<String, Object> metadata, boolean force) {
        if (target == null) {
            throw AlertingException.validation("target_state is required and must be one of new, acknowledged, investigating, resolved");
        }
        Alert alert = lockAlert(alertId);
        AlertStateEntry latest = latestEntry(alertId);
        AlertState from = latest.getState();

        if (!from.canTransitionTo(target)) {
            if (!force) {
                throw new AlertingException(ErrorKind.INVALID_TRANSITION,
                        "Invalid transition " + from.code() + " -> " + target.code(),
                        Map.of("from_state", from.code(),
                                "to_state", target.code(),
                                "allowed", from.allowedTargets().stream().map(AlertState::code).collect(Collectors.toList())));
            }
            log.warn("Forced transition alert={} {} -> {} actor={}", alertId, from.code(), target.code(), actor);
        }

        checkCallerMetadata(metadata);
        Map<String, Object> meta = carryEscalation(latest);
        if (metadata != null) meta.putAll(metadata);
        if (force) meta.put(META_FORCED, true);

        AlertStateEntry entry = entryRepository.save(AlertStateEntry.builder()
                .alertId(alertId)
                .state(target)
                .changedBy(actor)
                .changedAt(nextInstant(latest))
                .notes(notes)
                .metadata(meta)
                .build());
        alert.setCurrentState(target);

        log.info("Alert transition id={} {} -> {} actor={}", alertId, from.code(), target.code(), actor == null ? "system" : actor);
        eventPublisher.publishEvent(new AlertTransitionEvent(alertId, from, target, actor, entry.getChangedAt(),
                alert.getGroupId(), force));
        return entry;
    }

    /** Appends an entry that keeps the current state; used for operator notes. */
    public AlertStateEntry addNote(Long alertId, String actor, String notes, Map<String, Object> metadata) {
        if (notes == null || notes.isBlank()) {
            throw AlertingException.validation("notes must not be empty");
        }
        checkCallerMetadata(metadata);
        lockAlert(alertId);
        AlertStateEntry latest = latestEntry(alertId);
        Map<String, Object> meta = carryEscalation(latest);
        if (metadata != null) meta.putAll(metadata);
        return entryRepository.save(AlertStateEntry.builder()
                .alertId(alertId)
                .state(latest.getState())
                .changedBy(actor)
                .changedAt(nextInstant(latest))
                .notes(notes)
                .metadata(meta)
                .build());
    }

    /**
     * Records a new escalation tier. The caller holds the alert lock and has re-checked eligibility
     * against {@code latest}.
     */
    public AlertStateEntry appendEscalation(Alert alert, AlertStateEntry latest, int tier, Long policyId, String notes) {
        Map<String, Object> meta = new LinkedHashMap<>(latest.getMetadata() == null ? Map.of() : latest.getMetadata());
        meta.put(AlertStateEntry.META_ESCALATION_TIER, tier);
        meta.put(AlertStateEntry.META_POLICY_ID, policyId);
        return entryRepository.save(AlertStateEntry.builder()
                .alertId(alert.getId())
                .state(latest.getState())
                .changedBy(null)
                .changedAt(nextInstant(latest))
                .notes(notes)
                .metadata(meta)
                .build());
    }

    public Alert lockAlert(Long alertId) {
        return alertRepository.findByIdForUpdate(alertId)
                .orElseThrow(() -> AlertingException.notFound("Alert", alertId));
    }

    public AlertStateEntry latestEntry(Long alertId) {
        return entryRepository.findTopByAlertIdOrderByChangedAtDescIdDesc(alertId)
                .orElseThrow(() -> new AlertingException(ErrorKind.INTERNAL, "Alert " + alertId + " has no state history"));
    }

    public List<AlertStateEntry> history(Long alertId) {
        return entryRepository.findByAlertIdOrderByChangedAtAscIdAsc(alertId);
    }

    /** Escalation bookkeeping and the forced flag are written by the subsystem only. */
    static void checkCallerMetadata(Map<String, Object> metadata) {
        if (metadata == null) return;
        for (String key : RESERVED_METADATA_KEYS) {
            if (metadata.containsKey(key)) {
                throw new AlertingException(ErrorKind.VALIDATION, "metadata key " + key + " is reserved",
                        Map.of("key", key));
            }
        }
    }

    private Map<String, Object> carryEscalation(AlertStateEntry latest) {
        Map<String, Object> meta = new LinkedHashMap<>();
        Map<String, Object> previous = latest.getMetadata();
        if (previous != null) {
            if (previous.containsKey(AlertStateEntry.META_ESCALATION_TIER)) {
                meta.put(AlertStateEntry.META_ESCALATION_TIER, previous.get(AlertStateEntry.META_ESCALATION_TIER));
            }
            if (previous.containsKey(AlertStateEntry.META_POLICY_ID)) {
                meta.put(AlertStateEntry.META_POLICY_ID, previous.get(AlertStateEntry.META_POLICY_ID));
            }
        }
        return meta;
    }

    // history instants never go backwards, even if the worker clock does
    private Instant nextInstant(AlertStateEntry latest) {
        Instant now = clock.instant();
        return now.isBefore(latest.getChangedAt()) ? latest.getChangedAt() : now;
    }
}
