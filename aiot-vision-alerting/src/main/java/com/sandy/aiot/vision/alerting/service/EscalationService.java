package com.sandy.aiot.vision.alerting.service;

import com.sandy.aiot.vision.alerting.entity.Alert;
import com.sandy.aiot.vision.alerting.entity.AlertState;
import com.sandy.aiot.vision.alerting.entity.AlertStateEntry;
import com.sandy.aiot.vision.alerting.entity.EscalationPolicy;
import com.sandy.aiot.vision.alerting.entity.EscalationTier;
import com.sandy.aiot.vision.alerting.entity.NotificationChannel;
import com.sandy.aiot.vision.alerting.entity.NotificationIntent;
import com.sandy.aiot.vision.alerting.entity.Severity;
import com.sandy.aiot.vision.alerting.event.AlertTransitionEvent;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.exception.ErrorKind;
import com.sandy.aiot.vision.alerting.repository.AlertRepository;
import com.sandy.aiot.vision.alerting.repository.EscalationPolicyRepository;
import com.sandy.aiot.vision.alerting.service.notification.NotificationService;
import com.sandy.aiot.vision.alerting.vo.EscalationResultVO;
import com.sandy.aiot.vision.alerting.vo.EscalationStatusVO;
import com.sandy.aiot.vision.alerting.vo.PolicyReq;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Escalation policies and tier advancement. The current tier of an alert lives in the metadata of its
 * latest history entry; advancing re-reads it under the alert row lock, so each tier is reached once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EscalationService {

    private final EscalationPolicyRepository policyRepository;
    private final AlertRepository alertRepository;
    private final AlertStateMachine stateMachine;
    private final NotificationService notificationService;
    private final StoreTransactions storeTransactions;
    private final Clock clock;

    @Value("${alerting.escalation.acknowledge-suppresses:true}")
    private boolean acknowledgeSuppresses;

    private record Advance(EscalationResultVO result, List<NotificationIntent> intents, Alert alert) { }

    /** First enabled policy covering the severity, by name. */
    public Optional<EscalationPolicy> selectPolicy(Severity severity) {
        return policyRepository.findByEnabledTrueOrderByNameAsc().stream()
                .filter(p -> p.appliesTo(severity))
                .findFirst();
    }

    /** Sets the first due time of a new alert; runs inside the ingest transaction. */
    public void scheduleInitial(Alert alert) {
        EscalationTier first = selectPolicy(alert.getSeverity()).map(p -> p.tierAt(1)).orElse(null);
        alert.setEscalationDueAt(first == null ? null : dueAt(alert, first));
    }

    /**
     * Advances the alert by at most one tier. {@code force} skips the delay check only; resolved alerts,
     * exhausted chains and paused acknowledgements are never escalated.
     */
    public EscalationResultVO escalate(Long alertId, boolean force) {
        Advance advance = storeTransactions.write("escalate", () -> advanceLocked(alertId, force));
        if (advance.result().isEscalated() && !advance.intents().isEmpty()) {
            notificationService.dispatch(advance.intents(), advance.alert());
        }
        return advance.result();
    }

    private Advance advanceLocked(Long alertId, boolean force) {
        Alert alert = stateMachine.lockAlert(alertId);
        AlertStateEntry latest = stateMachine.latestEntry(alertId);
        Instant now = clock.instant();
        int current = latest.escalationTier();

        if (latest.getState() == AlertState.RESOLVED) {
            alert.setEscalationDueAt(null);
            return skipped(alert, "resolved", current, null);
        }
        EscalationPolicy policy = policyFor(alert, latest).orElse(null);
        if (policy == null) {
            alert.setEscalationDueAt(null);
            return skipped(alert, "no_policy", current, null);
        }
        EscalationTier next = policy.tierAt(current + 1);
        if (next == null) {
            alert.setEscalationDueAt(null);
            return skipped(alert, "exhausted", current, policy);
        }
        if (latest.getState() == AlertState.ACKNOWLEDGED && suppressesOnAcknowledge(policy)) {
            alert.setEscalationDueAt(null);
            return skipped(alert, "acknowledged", current, policy);
        }
        Instant due = dueAt(alert, next);
        if (!force && now.isBefore(due)) {
            alert.setEscalationDueAt(due);
            return skipped(alert, "not_due", current, policy);
        }

        int tier = current + 1;
        List<NotificationIntent> intents = notificationService.createIntents(alert, next, tier, now);
        String channels = next.getChannels().stream().map(NotificationChannel::code).collect(Collectors.joining(","));
        stateMachine.appendEscalation(alert, latest, tier, policy.getId(),
                "Escalated to tier " + tier + " (" + policy.getName() + ") via " + channels + (force ? " [manual]" : ""));

        EscalationTier following = policy.tierAt(tier + 1);
        Instant nextDue = following == null ? null : dueAt(alert, following);
        alert.setEscalationDueAt(nextDue);
        log.info("Alert {} escalated to tier {} policy={} intents={}", alertId, tier, policy.getName(), intents.size());

        EscalationResultVO result = EscalationResultVO.builder()
                .alertId(alertId)
                .escalated(true)
                .tier(tier)
                .policyId(policy.getId())
                .policyName(policy.getName())
                .nextEscalationAt(nextDue)
                .intents(intents)
                .build();
        return new Advance(result, intents, alert);
    }

    private Advance skipped(Alert alert, String reason, int tier, EscalationPolicy policy) {
        log.debug("Alert {} not escalated: {}", alert.getId(), reason);
        EscalationResultVO result = EscalationResultVO.builder()
                .alertId(alert.getId())
                .escalated(false)
                .reason(reason)
                .tier(tier)
                .policyId(policy == null ? null : policy.getId())
                .policyName(policy == null ? null : policy.getName())
                .nextEscalationAt(alert.getEscalationDueAt())
                .build();
        return new Advance(result, List.of(), alert);
    }

    /**
     * The policy already driving the alert while it still applies, else a fresh selection. The tier counter
     * is kept across a switch: a replacement policy continues at the level after the one already reached.
     */
    private Optional<EscalationPolicy> policyFor(Alert alert, AlertStateEntry latest) {
        Long recorded = latest.escalationPolicyId();
        if (recorded != null) {
            Optional<EscalationPolicy> p = policyRepository.findById(recorded)
                    .filter(EscalationPolicy::isEnabled)
                    .filter(x -> x.appliesTo(alert.getSeverity()));
            if (p.isPresent()) return p;
        }
        return selectPolicy(alert.getSeverity());
    }

    private boolean suppressesOnAcknowledge(EscalationPolicy policy) {
        return policy.getAcknowledgeSuppresses() != null ? policy.getAcknowledgeSuppresses() : acknowledgeSuppresses;
    }

    private static Instant dueAt(Alert alert, EscalationTier tier) {
        return alert.getCreatedAt().plus(Duration.ofMinutes(tier.getDelayMinutes()));
    }

    /** Keeps the due-time hint consistent with the new state; runs inside the transition transaction. */
    @EventListener
    public void onTransition(AlertTransitionEvent event) {
        alertRepository.findById(event.alertId()).ifPresent(alert -> {
            if (event.toState() == AlertState.RESOLVED) {
                alert.setEscalationDueAt(null);
            } else if (alert.getEscalationDueAt() == null) {
                alert.setEscalationDueAt(event.changedAt());
            }
        });
    }

    public EscalationStatusVO status(Long alertId) {
        return storeTransactions.read("escalation_status", () -> {
            Alert alert = alertRepository.findById(alertId)
                    .orElseThrow(() -> AlertingException.notFound("Alert", alertId));
            AlertStateEntry latest = stateMachine.latestEntry(alertId);
            EscalationPolicy policy = policyFor(alert, latest).orElse(null);
            int current = latest.escalationTier();
            int total = policy == null ? 0 : policy.tierCount();
            boolean resolved = latest.getState() == AlertState.RESOLVED;
            boolean paused = policy != null && latest.getState() == AlertState.ACKNOWLEDGED && suppressesOnAcknowledge(policy);
            EscalationTier next = policy == null ? null : policy.tierAt(current + 1);
            return EscalationStatusVO.builder()
                    .alertId(alertId)
                    .state(latest.getState().code())
                    .policyId(policy == null ? null : policy.getId())
                    .policyName(policy == null ? null : policy.getName())
                    .currentTier(current)
                    .totalTiers(total)
                    .nextEscalationAt(next == null || resolved || paused ? null : dueAt(alert, next))
                    .completed(policy != null && current >= total)
                    .paused(paused)
                    .build();
        });
    }

    // ---- policy administration ----

    public List<EscalationPolicy> listPolicies(boolean enabledOnly) {
        return storeTransactions.read("policy_list", () -> enabledOnly
                ? policyRepository.findByEnabledTrueOrderByNameAsc()
                : policyRepository.findAllByOrderByNameAsc());
    }

    public EscalationPolicy getPolicy(Long id) {
        return storeTransactions.read("policy_get", () -> policyRepository.findById(id)
                .orElseThrow(() -> AlertingException.notFound("Escalation policy", id)));
    }

    public EscalationPolicy createPolicy(PolicyReq req) {
        if (req.getName() == null || req.getName().isBlank()) {
            throw AlertingException.validation("name is required");
        }
        List<Severity> severities = parseSeverities(req.getSeverities());
        List<EscalationTier> tiers = validateTiers(req.getTiers());
        Instant now = clock.instant();
        return storeTransactions.write("policy_create", () -> {
            String name = req.getName().trim();
            ensureNameFree(name);
            EscalationPolicy saved = policyRepository.save(EscalationPolicy.builder()
                    .name(name)
                    .description(req.getDescription())
                    .severities(severities)
                    .tiers(tiers)
                    .enabled(req.getEnabled() == null || req.getEnabled())
                    .acknowledgeSuppresses(req.getAcknowledgeSuppresses())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            rearm(saved, severities, now);
            log.info("Created escalation policy {} severities={} tiers={}", saved.getName(), severities, tiers.size());
            return saved;
        });
    }

    public EscalationPolicy updatePolicy(Long id, PolicyReq req) {
        List<Severity> severities = req.getSeverities() == null ? null : parseSeverities(req.getSeverities());
        List<EscalationTier> tiers = req.getTiers() == null ? null : validateTiers(req.getTiers());
        return storeTransactions.write("policy_update", () -> {
            EscalationPolicy p = policyRepository.findById(id)
                    .orElseThrow(() -> AlertingException.notFound("Escalation policy", id));
            Set<Severity> affected = EnumSet.noneOf(Severity.class);
            affected.addAll(p.getSeverities());
            if (req.getName() != null && !req.getName().isBlank() && !req.getName().trim().equals(p.getName())) {
                ensureNameFree(req.getName().trim());
                p.setName(req.getName().trim());
            }
            if (req.getDescription() != null) p.setDescription(req.getDescription());
            if (severities != null) {
                p.setSeverities(severities);
                affected.addAll(severities);
            }
            if (tiers != null) p.setTiers(tiers);
            if (req.getEnabled() != null) p.setEnabled(req.getEnabled());
            if (req.getAcknowledgeSuppresses() != null) p.setAcknowledgeSuppresses(req.getAcknowledgeSuppresses());
            Instant now = clock.instant();
            p.setUpdatedAt(now);
            policyRepository.saveAndFlush(p);
            rearm(p, affected, now);
            log.info("Updated escalation policy {}", p.getName());
            return p;
        });
    }

    public void deletePolicy(Long id) {
        storeTransactions.write("policy_delete", () -> {
            EscalationPolicy p = policyRepository.findById(id)
                    .orElseThrow(() -> AlertingException.notFound("Escalation policy", id));
            policyRepository.delete(p);
            log.info("Deleted escalation policy {}", p.getName());
            return null;
        });
    }

    private void rearm(EscalationPolicy policy, Collection<Severity> severities, Instant now) {
        if (!policy.isEnabled() || severities.isEmpty()) return;
        int n = alertRepository.rearmEscalation(severities, now);
        if (n > 0) log.info("Re-armed escalation for {} open alerts after policy {} changed", n, policy.getName());
    }

    private void ensureNameFree(String name) {
        if (policyRepository.findByName(name).isPresent()) {
            throw new AlertingException(ErrorKind.CONFLICT, "Escalation policy " + name + " already exists", Map.of("name", name));
        }
    }

    static List<Severity> parseSeverities(List<String> codes) {
        if (codes == null || codes.isEmpty()) {
            throw AlertingException.validation("severities must not be empty");
        }
        List<Severity> out = new ArrayList<>();
        for (String code : codes) {
            Severity s = Severity.fromCode(code);
            if (s == null) {
                throw AlertingException.validation("Unknown severity: " + code);
            }
            if (!out.contains(s)) out.add(s);
        }
        return out;
    }

    static List<EscalationTier> validateTiers(List<EscalationTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw AlertingException.validation("tiers must not be empty");
        }
        int previousLevel = 0;
        int previousDelay = 0;
        for (EscalationTier t : tiers) {
            if (t == null) {
                throw AlertingException.validation("tier must not be null");
            }
            if (t.getLevel() <= previousLevel || (previousLevel == 0 && t.getLevel() != 1)) {
                throw AlertingException.validation("tier levels must start at 1 and increase strictly");
            }
            if (t.getDelayMinutes() < 0 || t.getDelayMinutes() < previousDelay) {
                throw AlertingException.validation("tier delays must be non-negative and non-decreasing");
            }
            if (t.getChannels() == null || t.getChannels().isEmpty() || t.getChannels().contains(null)) {
                throw AlertingException.validation("tier " + t.getLevel() + " channels must be non-empty and one of email, sms, voice, webhook");
            }
            if (t.getRecipients() == null || t.getRecipients().isEmpty()
                    || t.getRecipients().stream().anyMatch(r -> r == null || r.isBlank())) {
                throw AlertingException.validation("tier " + t.getLevel() + " recipients must be non-empty");
            }
            previousLevel = t.getLevel();
            previousDelay = t.getDelayMinutes();
        }
        return new ArrayList<>(tiers);
    }
}
