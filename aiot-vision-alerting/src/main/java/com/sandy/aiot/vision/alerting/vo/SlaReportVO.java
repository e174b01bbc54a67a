package com.sandy.aiot.vision.alerting.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Compliance aggregates over alerts created in a period. Rates are percentages of the acknowledged
 * (TTA) or resolved (TTR) alerts, rounded to one decimal; averages are minutes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaReportVO {
    private String severity;
    private long totalAlerts;
    private long acknowledgedAlerts;
    private long resolvedAlerts;
    private long ttaComplianceCount;
    private double ttaComplianceRate;
    private long ttrComplianceCount;
    private double ttrComplianceRate;
    private double avgTta;
    private double avgTtr;
    private Instant periodStart;
    private Instant periodEnd;
}
