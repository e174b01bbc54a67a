package com.sandy.aiot.vision.alerting.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationStatusVO {
    private Long alertId;
    private String state;
    private Long policyId;
    private String policyName;
    private int currentTier;
    private int totalTiers;
    private Instant nextEscalationAt;
    private boolean completed;
    private boolean paused;
}
