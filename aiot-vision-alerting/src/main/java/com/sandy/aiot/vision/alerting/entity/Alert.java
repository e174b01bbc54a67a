package com.sandy.aiot.vision.alerting.entity;

import com.sandy.aiot.vision.alerting.entity.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An alert raised by a rule engine or by the anomaly bridge.
 * Immutable after creation except for the state mirror, the group link and the escalation due time.
 */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alerts_created_at", columnList = "created_at"),
        @Index(name = "idx_alerts_device_created", columnList = "device_id,created_at"),
        @Index(name = "idx_alerts_escalation_due", columnList = "escalation_due_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false, length = 128)
    private String deviceId;

    @Column(nullable = false, length = 128)
    private String ruleId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity severity;

    @Column(nullable = false, length = 1000)
    private String message;

    /** Structured payload supplied by the producer (rule context, ML scores, ...). */
    @Convert(converter = JsonMapConverter.class)
    @Column(length = 8000)
    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    /** Mirror of the latest history entry, written under the alert row lock. */
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertState currentState;

    /** Null when not grouped or when the group was deleted. */
    private Long groupId;

    /** When the next escalation tier falls due; null when there is nothing to escalate. */
    @Column(name = "escalation_due_at")
    private Instant escalationDueAt;
}
