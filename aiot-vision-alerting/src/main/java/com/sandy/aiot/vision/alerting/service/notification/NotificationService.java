package com.sandy.aiot.vision.alerting.service.notification;

import com.sandy.aiot.vision.alerting.entity.Alert;
import com.sandy.aiot.vision.alerting.entity.EscalationTier;
import com.sandy.aiot.vision.alerting.entity.IntentStatus;
import com.sandy.aiot.vision.alerting.entity.NotificationChannel;
import com.sandy.aiot.vision.alerting.entity.NotificationIntent;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.repository.NotificationIntentRepository;
import com.sandy.aiot.vision.alerting.repository.OnCallScheduleRepository;
import com.sandy.aiot.vision.alerting.service.OnCallResolver;
import com.sandy.aiot.vision.alerting.service.StoreTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Persists notification intents and hands them to the dispatchers.
 */
@Service
@Slf4j
public class NotificationService {

    public static final String ONCALL_PREFIX = "oncall:";

    private static final Set<IntentStatus> ACK_STATUSES = Set.of(IntentStatus.DELIVERED, IntentStatus.UNDELIVERABLE, IntentStatus.FAILED);

    private final NotificationIntentRepository intentRepository;
    private final OnCallScheduleRepository scheduleRepository;
    private final OnCallResolver onCallResolver;
    private final List<NotificationDispatcher> dispatchers;
    private final StoreTransactions storeTransactions;
    private final Clock clock;

    public NotificationService(NotificationIntentRepository intentRepository,
                               OnCallScheduleRepository scheduleRepository,
                               OnCallResolver onCallResolver,
                               List<NotificationDispatcher> dispatchers,
                               StoreTransactions storeTransactions,
                               Clock clock) {
        this.intentRepository = intentRepository;
        this.scheduleRepository = scheduleRepository;
        this.onCallResolver = onCallResolver;
        this.dispatchers = dispatchers;
        this.storeTransactions = storeTransactions;
        this.clock = clock;
    }

    /**
     * Writes one intent per channel and recipient of the tier. Runs inside the escalation transaction;
     * an unresolvable on-call recipient yields a failed intent and does not stop the others.
     */
    public List<NotificationIntent> createIntents(Alert alert, EscalationTier tier, int level, Instant now) {
        List<NotificationIntent> intents = new ArrayList<>();
        for (String recipient : tier.getRecipients()) {
            String resolved = null;
            String failure = null;
            try {
                resolved = resolveRecipient(recipient, now);
            } catch (AlertingException e) {
                failure = e.getMessage();
                log.warn("Alert {} tier {}: recipient {} unresolvable: {}", alert.getId(), level, recipient, failure);
            }
            for (NotificationChannel channel : tier.getChannels()) {
                intents.add(NotificationIntent.builder()
                        .alertId(alert.getId())
                        .tier(level)
                        .channel(channel)
                        .recipient(resolved != null ? resolved : recipient)
                        .status(failure == null ? IntentStatus.PENDING : IntentStatus.FAILED)
                        .detail(failure == null ? (resolved.equals(recipient) ? null : "resolved from " + recipient) : failure)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
            }
        }
        return intentRepository.saveAll(intents);
    }

    String resolveRecipient(String recipient, Instant at) {
        if (!recipient.startsWith(ONCALL_PREFIX)) {
            return recipient;
        }
        String scheduleName = recipient.substring(ONCALL_PREFIX.length()).trim();
        return scheduleRepository.findByName(scheduleName)
                .map(s -> onCallResolver.resolve(s, at).getUserId())
                .orElseThrow(() -> AlertingException.notFound("On-call schedule", scheduleName));
    }

    /**
     * Hands pending intents to the dispatchers. Called after the escalation transaction committed; each
     * outcome is recorded in its own short transaction.
     */
    public void dispatch(List<NotificationIntent> intents, Alert alert) {
        for (NotificationIntent intent : intents) {
            if (intent.getStatus() != IntentStatus.PENDING) {
                continue;
            }
            NotificationDispatcher dispatcher = dispatchers.stream()
                    .filter(d -> d.supports(intent.getChannel()))
                    .findFirst()
                    .orElse(null);
            IntentStatus outcome;
            String detail;
            if (dispatcher == null) {
                outcome = IntentStatus.FAILED;
                detail = "no dispatcher for channel " + intent.getChannel().code();
                log.warn("Intent {}: {}", intent.getId(), detail);
            } else {
                try {
                    dispatcher.dispatch(intent, alert);
                    outcome = IntentStatus.DISPATCHED;
                    detail = "via " + dispatcher.name();
                } catch (RuntimeException e) {
                    outcome = IntentStatus.FAILED;
                    detail = dispatcher.name() + ": " + e.getMessage();
                    log.warn("Dispatch of intent {} via {} failed: {}", intent.getId(), dispatcher.name(), e.getMessage());
                }
            }
            try {
                recordOutcome(intent.getId(), outcome, detail);
                intent.setStatus(outcome);
                intent.setDetail(detail);
            } catch (RuntimeException e) {
                log.error("Recording dispatch outcome of intent {} failed", intent.getId(), e);
            }
        }
    }

    private void recordOutcome(Long intentId, IntentStatus status, String detail) {
        storeTransactions.write("intent_outcome", () -> {
            intentRepository.findById(intentId).ifPresent(i -> {
                i.setStatus(status);
                i.setDetail(detail);
                i.setUpdatedAt(clock.instant());
            });
            return null;
        });
    }

    /** Delivery receipt from a channel integration. */
    public NotificationIntent acknowledge(Long intentId, String statusCode, String detail) {
        IntentStatus status = IntentStatus.fromCode(statusCode);
        if (status == null || !ACK_STATUSES.contains(status)) {
            throw AlertingException.validation("status must be one of delivered, undeliverable, failed");
        }
        return storeTransactions.write("intent_ack", () -> {
            NotificationIntent intent = intentRepository.findById(intentId)
                    .orElseThrow(() -> AlertingException.notFound("Notification intent", intentId));
            intent.setStatus(status);
            if (detail != null) intent.setDetail(detail);
            intent.setUpdatedAt(clock.instant());
            log.info("Intent {} acknowledged as {}", intentId, status.code());
            return intent;
        });
    }

    public List<NotificationIntent> list(Long alertId, int limit) {
        int size = Math.max(1, Math.min(limit, 1000));
        return storeTransactions.read("intent_list", () -> alertId != null
                ? intentRepository.findByAlertIdOrderByIdAsc(alertId)
                : intentRepository.findAllByOrderByIdDesc(PageRequest.of(0, size)));
    }
}
