package com.sandy.aiot.vision.alerting.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Composite result of alert creation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertCreatedVO {
    private Long alertId;
    private String state;
    private String severity;
    private SlaTargets sla;
    private Long groupId;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SlaTargets {
        private int ttaTargetMin;
        private int ttrTargetMin;
    }
}
