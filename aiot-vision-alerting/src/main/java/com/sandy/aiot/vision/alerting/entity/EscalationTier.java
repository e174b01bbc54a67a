package com.sandy.aiot.vision.alerting.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One step of an escalation chain. The delay is measured from alert creation, not from the previous tier.
 * A recipient of the form {@code oncall:<schedule>} is resolved against the on-call schedule at dispatch time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationTier {
    private int level;
    private int delayMinutes;
    @Builder.Default
    private List<NotificationChannel> channels = new ArrayList<>();
    @Builder.Default
    private List<String> recipients = new ArrayList<>();
}
