package com.sandy.aiot.vision.alerting.controller;

import com.sandy.aiot.vision.alerting.entity.NotificationIntent;
import com.sandy.aiot.vision.alerting.service.notification.NotificationService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Notification intent audit and delivery receipts from channel integrations. */
@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public ResponseEntity<List<NotificationIntent>> list(@RequestParam(name = "alert_id", required = false) Long alertId,
                                                         @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(notificationService.list(alertId, limit));
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<NotificationIntent> acknowledge(@PathVariable Long id, @RequestBody AckReq req) {
        return ResponseEntity.ok(notificationService.acknowledge(id, req.getStatus(), req.getDetail()));
    }

    @Data
    public static class AckReq {
        private String status;
        private String detail;
    }
}
