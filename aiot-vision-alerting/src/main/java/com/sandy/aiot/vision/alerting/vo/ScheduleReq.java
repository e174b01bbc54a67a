package com.sandy.aiot.vision.alerting.vo;

import lombok.Data;

import java.util.List;

/** Create or partial update of an on-call schedule; null fields are left unchanged on update. */
@Data
public class ScheduleReq {
    private String name;
    private String description;
    private String timezone;
    private String rotationType;
    /** ISO-8601; without an offset it is read in the schedule's timezone. */
    private String rotationStart;
    private List<String> users;
    private Boolean enabled;
}
