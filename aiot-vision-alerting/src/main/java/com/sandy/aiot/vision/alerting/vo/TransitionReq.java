package com.sandy.aiot.vision.alerting.vo;

import lombok.Data;

import java.util.Map;

@Data
public class TransitionReq {
    private String targetState;
    private String notes;
    private Map<String, Object> metadata;
}
