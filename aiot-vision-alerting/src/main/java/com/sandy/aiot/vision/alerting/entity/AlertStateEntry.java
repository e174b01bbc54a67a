package com.sandy.aiot.vision.alerting.entity;

import com.sandy.aiot.vision.alerting.entity.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only alert history. The latest entry (by changedAt, then id) defines the current state.
 */
@Entity
@Table(name = "alert_state_entries", indexes = {
        @Index(name = "idx_alert_state_entries_alert_changed", columnList = "alert_id,changed_at DESC")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertStateEntry {

    public static final String META_ESCALATION_TIER = "escalation_tier";
    public static final String META_POLICY_ID = "policy_id";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false)
    private Long alertId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertState state;

    /** User reference; null means the system. */
    @Column(length = 128)
    private String changedBy;

    @Column(name = "changed_at", nullable = false)
    private Instant changedAt;

    @Column(length = 2000)
    private String notes;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 4000)
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public int escalationTier() {
        Object v = metadata == null ? null : metadata.get(META_ESCALATION_TIER);
        return v instanceof Number n ? n.intValue() : 0;
    }

    public Long escalationPolicyId() {
        Object v = metadata == null ? null : metadata.get(META_POLICY_ID);
        return v instanceof Number n ? n.longValue() : null;
    }
}
