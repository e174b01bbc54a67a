package com.sandy.aiot.vision.alerting.vo;

import com.sandy.aiot.vision.alerting.entity.NotificationIntent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one escalation attempt. When nothing advanced, {@code reason} says why
 * (resolved, no_policy, exhausted, acknowledged, not_due).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationResultVO {
    private Long alertId;
    private boolean escalated;
    private String reason;
    private int tier;
    private Long policyId;
    private String policyName;
    private Instant nextEscalationAt;
    @Builder.Default
    private List<NotificationIntent> intents = new ArrayList<>();
}
