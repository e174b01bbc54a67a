package com.sandy.aiot.vision.alerting.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * SLA accounting row, one per alert. Targets are fixed at creation from the severity table.
 */
@Entity
@Table(name = "alert_slas", indexes = {
        @Index(name = "idx_alert_slas_severity_created", columnList = "severity,created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertSla {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long alertId;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private Severity severity;

    @Column(nullable = false)
    private int ttaTargetMin;
    @Column(nullable = false)
    private int ttrTargetMin;

    private Integer ttaActualMin;
    private Integer ttrActualMin;

    /** Alert creation instant, copied so SLA math never needs the alert row. */
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
    private Instant acknowledgedAt;
    private Instant resolvedAt;

    private boolean ttaBreached;
    private boolean ttrBreached;
}
