package com.sandy.aiot.vision.alerting.vo;

import lombok.Data;

import java.util.Map;

@Data
public class NoteReq {
    private String notes;
    private Map<String, Object> metadata;
}
