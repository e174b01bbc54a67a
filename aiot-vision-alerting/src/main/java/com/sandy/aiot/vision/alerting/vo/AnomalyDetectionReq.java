package com.sandy.aiot.vision.alerting.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One anomaly detection result from an ML model. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyDetectionReq {
    private String deviceId;
    private String metric;
    private Double value;
    private Double score;
    private Double confidence;
    private String modelId;
    private String source;
    /** False when the model judged the point normal; defaults to true. */
    private Boolean anomaly;
}
