package com.sandy.aiot.vision.alerting.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Aggregate grouping metrics; noise reduction is (alerts - groups) / alerts as a percentage. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverallGroupStatsVO {
    private long totalGroups;
    private long activeGroups;
    private long closedGroups;
    private long totalAlerts;
    private int maxGroupSize;
    private double avgGroupSize;
    private double noiseReductionPct;
}
