package com.sandy.aiot.vision.alerting.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Time-bounded replacement of the rotation user; the window is inclusive on both ends.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnCallOverride {
    private String userId;
    private Instant start;
    private Instant end;
    private String reason;

    public boolean covers(Instant t) {
        return start != null && end != null && !t.isBefore(start) && !t.isAfter(end);
    }
}
