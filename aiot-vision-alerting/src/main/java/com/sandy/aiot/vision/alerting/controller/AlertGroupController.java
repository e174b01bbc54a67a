package com.sandy.aiot.vision.alerting.controller;

import com.sandy.aiot.vision.alerting.entity.AlertGroup;
import com.sandy.aiot.vision.alerting.entity.GroupStatus;
import com.sandy.aiot.vision.alerting.entity.Severity;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.service.AlertGroupingEngine;
import com.sandy.aiot.vision.alerting.vo.GroupStatsVO;
import com.sandy.aiot.vision.alerting.vo.OverallGroupStatsVO;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
public class AlertGroupController {

    private final AlertGroupingEngine groupingEngine;

    @GetMapping
    public ResponseEntity<List<AlertGroup>> list(@RequestParam(name = "device_id", required = false) String deviceId,
                                                 @RequestParam(required = false) String severity,
                                                 @RequestParam(required = false) String status,
                                                 @RequestParam(defaultValue = "100") int limit) {
        Severity sev = null;
        if (severity != null && !severity.isBlank()) {
            sev = Severity.fromCode(severity);
            if (sev == null) throw AlertingException.validation("Unknown severity: " + severity);
        }
        GroupStatus st = null;
        if (status != null && !status.isBlank()) {
            st = GroupStatus.fromCode(status);
            if (st == null) throw AlertingException.validation("status must be one of active, closed");
        }
        String device = deviceId == null || deviceId.isBlank() ? null : deviceId.trim();
        return ResponseEntity.ok(groupingEngine.list(device, sev, st, limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<OverallGroupStatsVO> overall() {
        return ResponseEntity.ok(groupingEngine.overallStatistics());
    }

    @GetMapping("/{id}")
    public ResponseEntity<AlertGroup> get(@PathVariable Long id) {
        return ResponseEntity.ok(groupingEngine.get(id));
    }

    @GetMapping("/{id}/stats")
    public ResponseEntity<GroupStatsVO> stats(@PathVariable Long id) {
        return ResponseEntity.ok(groupingEngine.statistics(id));
    }

    @PostMapping("/{id}/close")
    public ResponseEntity<AlertGroup> close(@PathVariable Long id, @RequestParam(required = false) String reason) {
        return ResponseEntity.ok(groupingEngine.close(id, reason));
    }

    @PatchMapping("/{id}/metadata")
    public ResponseEntity<AlertGroup> updateMetadata(@PathVariable Long id, @RequestBody Map<String, Object> metadata) {
        return ResponseEntity.ok(groupingEngine.updateMetadata(id, metadata));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        groupingEngine.delete(id);
        return ResponseEntity.noContent().build();
    }
}
