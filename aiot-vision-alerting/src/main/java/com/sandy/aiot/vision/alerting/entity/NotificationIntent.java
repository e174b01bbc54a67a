package com.sandy.aiot.vision.alerting.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A request to notify one recipient over one channel, emitted when an alert reaches a tier.
 */
@Entity
@Table(name = "notification_intents", indexes = {
        @Index(name = "idx_notification_intents_alert", columnList = "alert_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationIntent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false)
    private Long alertId;

    private int tier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private NotificationChannel channel;

    @Column(nullable = false, length = 500)
    private String recipient;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private IntentStatus status;

    @Column(length = 1000)
    private String detail;

    @Column(nullable = false)
    private Instant createdAt;
    private Instant updatedAt;
}
