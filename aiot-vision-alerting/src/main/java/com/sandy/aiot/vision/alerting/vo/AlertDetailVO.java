package com.sandy.aiot.vision.alerting.vo;

import com.sandy.aiot.vision.alerting.entity.Alert;
import com.sandy.aiot.vision.alerting.entity.AlertSla;
import com.sandy.aiot.vision.alerting.entity.AlertStateEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Alert with its full history, SLA row, group link and escalation tier. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertDetailVO {
    private Alert alert;
    private String state;
    private List<AlertStateEntry> history;
    private AlertSla sla;
    private Long groupId;
    private int escalationTier;
}
