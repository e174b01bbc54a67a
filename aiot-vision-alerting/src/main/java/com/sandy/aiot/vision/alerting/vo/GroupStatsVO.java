package com.sandy.aiot.vision.alerting.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupStatsVO {
    private Long groupId;
    private String groupKey;
    private String status;
    private int occurrenceCount;
    private Instant firstOccurrence;
    private Instant lastOccurrence;
    private double durationMinutes;
    private double frequencyPerHour;
    private double noiseReductionPct;
}
