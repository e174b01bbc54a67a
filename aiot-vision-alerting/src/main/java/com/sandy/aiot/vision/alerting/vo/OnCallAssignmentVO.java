package com.sandy.aiot.vision.alerting.vo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Who is on call for a schedule at an instant. Shift bounds are rendered in the schedule's timezone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnCallAssignmentVO {
    private Long scheduleId;
    private String scheduleName;
    private String timezone;
    private String userId;
    /** 1-based position in the rotation; null for an override. */
    private Integer userOrder;
    private OffsetDateTime shiftStart;
    private OffsetDateTime shiftEnd;
    @JsonProperty("is_override")
    private boolean override;
    private String overrideReason;
}
