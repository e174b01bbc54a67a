package com.sandy.aiot.vision.alerting.service;

import com.sandy.aiot.vision.alerting.entity.Severity;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.vo.AlertCreatedVO;
import com.sandy.aiot.vision.alerting.vo.AlertItemVO;
import com.sandy.aiot.vision.alerting.vo.AnomalyDetectionReq;
import com.sandy.aiot.vision.alerting.vo.AnomalyResultVO;
import com.sandy.aiot.vision.alerting.vo.CreateAlertReq;
import com.sandy.aiot.vision.alerting.vo.EscalationResultVO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns ML anomaly detections into alerts. Detections below the confidence floor are dropped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyAlertBridge {

    public static final String RULE_ID = "ml_anomaly_detection";

    private final AlertIngressService ingressService;
    private final EscalationService escalationService;

    @Value("${alerting.anomaly-bridge.min-confidence:0.70}")
    private double minConfidence;
    @Value("${alerting.anomaly-bridge.auto-escalate:true}")
    private boolean autoEscalate;

    public AnomalyResultVO process(AnomalyDetectionReq req) {
        if (req.getDeviceId() == null || req.getDeviceId().isBlank()) {
            throw AlertingException.validation("device_id is required");
        }
        if (req.getMetric() == null || req.getMetric().isBlank()) {
            throw AlertingException.validation("metric is required");
        }
        Double confidence = req.getConfidence();
        if (confidence == null || confidence.isNaN() || confidence < 0d || confidence > 1d) {
            throw AlertingException.validation("confidence must be between 0 and 1");
        }
        if (Boolean.FALSE.equals(req.getAnomaly())) {
            return AnomalyResultVO.builder().created(false).reason("not_anomalous").build();
        }
        if (confidence < minConfidence) {
            log.debug("Anomaly on {} {} below confidence floor {} (confidence={})",
                    req.getDeviceId(), req.getMetric(), minConfidence, confidence);
            return AnomalyResultVO.builder().created(false).reason("below_confidence").build();
        }

        Severity severity = severityFor(confidence);
        String message = RULE_ID + ": " + req.getMetric() + "=" + req.getValue()
                + " score=" + req.getScore() + " confidence=" + confidence;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model_id", req.getModelId());
        payload.put("score", req.getScore());
        payload.put("confidence", confidence);
        payload.put("metric", req.getMetric());
        payload.put("value", req.getValue());
        payload.put("source", req.getSource() == null ? "ml_anomaly_detector" : req.getSource());

        AlertCreatedVO created = ingressService.createAlert(CreateAlertReq.builder()
                .deviceId(req.getDeviceId())
                .ruleId(RULE_ID)
                .severity(severity.code())
                .message(message)
                .payload(payload)
                .build());
        log.info("ML anomaly alert {} created for device {} metric {} severity={} confidence={}",
                created.getAlertId(), req.getDeviceId(), req.getMetric(), severity.code(), confidence);

        boolean escalated = false;
        if (autoEscalate && (severity == Severity.CRITICAL || severity == Severity.HIGH)) {
            try {
                EscalationResultVO r = escalationService.escalate(created.getAlertId(), false);
                escalated = r.isEscalated();
            } catch (AlertingException e) {
                log.warn("Immediate escalation of ML alert {} failed: {}", created.getAlertId(), e.getMessage());
            }
        }
        return AnomalyResultVO.builder()
                .created(true)
                .severity(severity.code())
                .alert(created)
                .escalated(escalated)
                .build();
    }

    /** Bands below 0.70 only matter when the floor is configured lower. */
    static Severity severityFor(double confidence) {
        if (confidence >= 0.90) return Severity.CRITICAL;
        if (confidence >= 0.80) return Severity.HIGH;
        if (confidence >= 0.70) return Severity.MEDIUM;
        if (confidence >= 0.45) return Severity.LOW;
        return Severity.INFO;
    }

    public List<AlertItemVO> recentAlerts(String deviceId, String severity, int limit) {
        return ingressService.listByRule(RULE_ID, deviceId, severity, limit);
    }
}
