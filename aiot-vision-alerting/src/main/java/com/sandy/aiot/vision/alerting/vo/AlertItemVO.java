package com.sandy.aiot.vision.alerting.vo;

import com.sandy.aiot.vision.alerting.entity.Alert;
import lombok.Data;

import java.time.Instant;

/** Alert row for list views. */
@Data
public class AlertItemVO {
    private Long id;
    private String deviceId;
    private String ruleId;
    private String severity;
    private String message;
    private Instant createdAt;
    private String state;
    private Long groupId;

    public static AlertItemVO of(Alert a) {
        AlertItemVO vo = new AlertItemVO();
        vo.setId(a.getId());
        vo.setDeviceId(a.getDeviceId());
        vo.setRuleId(a.getRuleId());
        vo.setSeverity(a.getSeverity().code());
        vo.setMessage(a.getMessage());
        vo.setCreatedAt(a.getCreatedAt());
        vo.setState(a.getCurrentState().code());
        vo.setGroupId(a.getGroupId());
        return vo;
    }
}
