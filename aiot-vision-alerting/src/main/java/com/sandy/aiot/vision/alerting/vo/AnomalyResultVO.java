package com.sandy.aiot.vision.alerting.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyResultVO {
    private boolean created;
    /** Why no alert was created: not_anomalous or below_confidence. */
    private String reason;
    private String severity;
    private AlertCreatedVO alert;
    private boolean escalated;
}
