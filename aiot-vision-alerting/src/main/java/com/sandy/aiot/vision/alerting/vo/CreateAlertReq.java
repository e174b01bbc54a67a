package com.sandy.aiot.vision.alerting.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAlertReq {
    private String deviceId;
    private String ruleId;
    private String severity;
    private String message;
    private Map<String, Object> payload;
}
