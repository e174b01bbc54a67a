package com.sandy.aiot.vision.alerting.controller;

import com.sandy.aiot.vision.alerting.service.AnomalyAlertBridge;
import com.sandy.aiot.vision.alerting.vo.AlertItemVO;
import com.sandy.aiot.vision.alerting.vo.AnomalyDetectionReq;
import com.sandy.aiot.vision.alerting.vo.AnomalyResultVO;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/anomalies")
@RequiredArgsConstructor
public class AnomalyController {

    private final AnomalyAlertBridge anomalyAlertBridge;

    /** 201 when an alert was created, 200 when the detection was dropped. */
    @PostMapping
    public ResponseEntity<AnomalyResultVO> submit(@RequestBody AnomalyDetectionReq req) {
        AnomalyResultVO result = anomalyAlertBridge.process(req);
        return ResponseEntity.status(result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK).body(result);
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<AlertItemVO>> alerts(@RequestParam(name = "device_id", required = false) String deviceId,
                                                    @RequestParam(required = false) String severity,
                                                    @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(anomalyAlertBridge.recentAlerts(deviceId, severity, limit));
    }
}
