package com.sandy.aiot.vision.alerting.vo;

import lombok.Data;

@Data
public class OverrideReq {
    private String userId;
    private String start;
    private String end;
    private String reason;
}
