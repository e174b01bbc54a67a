package com.sandy.aiot.vision.alerting.entity;

import com.sandy.aiot.vision.alerting.entity.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A burst of alerts sharing device, rule and severity.
 * {@code activeKey} equals {@code groupKey} while the group is active and is null once closed; its unique
 * constraint keeps at most one active group per key.
 */
@Entity
@Table(name = "alert_groups",
        uniqueConstraints = @UniqueConstraint(name = "uk_alert_groups_active_key", columnNames = "active_key"),
        indexes = {
                @Index(name = "idx_alert_groups_group_key", columnList = "group_key"),
                @Index(name = "idx_alert_groups_status", columnList = "status"),
                @Index(name = "idx_alert_groups_device", columnList = "device_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertGroup {
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

    @Column(name = "group_key", nullable = false, length = 600)
    private String groupKey;

    @Column(name = "active_key", length = 600)
    private String activeKey;

    @Column(nullable = false)
    private Instant firstOccurrence;

    @Column(nullable = false)
    private Instant lastOccurrence;

    private int occurrenceCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private GroupStatus status;

    private Long representativeAlertId;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 4000)
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    /** {@code device:rule:severity}, with ':' and backslash inside the ids escaped. Distinct tuples never share a key. */
    public static String compositeKey(String deviceId, String ruleId, Severity severity) {
        return escapeKeyPart(deviceId) + ":" + escapeKeyPart(ruleId) + ":" + severity.code();
    }

    static String escapeKeyPart(String part) {
        return part.replace("\\", "\\\\").replace(":", "\\:");
    }

    public void close(Instant at, String reason) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        merged.put("close_reason", reason);
        this.metadata = merged;
        this.status = GroupStatus.CLOSED;
        this.activeKey = null;
        this.updatedAt = at;
    }

    /** (N - 1) / N as a percentage, 0 for a single alert. */
    public double noiseReductionPct() {
        if (occurrenceCount <= 1) return 0d;
        return Math.round((occurrenceCount - 1) * 10000d / occurrenceCount) / 100d;
    }
}
