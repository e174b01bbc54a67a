package com.sandy.aiot.vision.alerting.controller;

import com.sandy.aiot.vision.alerting.entity.OnCallSchedule;
import com.sandy.aiot.vision.alerting.service.OnCallService;
import com.sandy.aiot.vision.alerting.vo.OnCallAssignmentVO;
import com.sandy.aiot.vision.alerting.vo.OverrideReq;
import com.sandy.aiot.vision.alerting.vo.ScheduleReq;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
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

/**
 * On-call lookups and schedule administration. {@code schedule_id} accepts the numeric id or the schedule name.
 */
@RestController
@RequestMapping("/api/on-call")
@RequiredArgsConstructor
public class OnCallController {

    private final OnCallService onCallService;

    @GetMapping("/current")
    public ResponseEntity<OnCallAssignmentVO> current(@RequestParam(name = "schedule_id") String scheduleId) {
        return ResponseEntity.ok(onCallService.current(scheduleId));
    }

    @GetMapping("/at")
    public ResponseEntity<OnCallAssignmentVO> at(@RequestParam(name = "schedule_id") String scheduleId,
                                                 @RequestParam String instant) {
        return ResponseEntity.ok(onCallService.at(scheduleId, instant));
    }

    @GetMapping("/schedules")
    public ResponseEntity<List<OnCallSchedule>> list(@RequestParam(name = "enabled_only", defaultValue = "false") boolean enabledOnly) {
        return ResponseEntity.ok(onCallService.list(enabledOnly));
    }

    @PostMapping("/schedules")
    public ResponseEntity<OnCallSchedule> create(@RequestBody ScheduleReq req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(onCallService.create(req));
    }

    @GetMapping("/schedules/{id}")
    public ResponseEntity<OnCallSchedule> get(@PathVariable String id) {
        return ResponseEntity.ok(onCallService.get(id));
    }

    @PatchMapping("/schedules/{id}")
    public ResponseEntity<OnCallSchedule> update(@PathVariable String id, @RequestBody ScheduleReq req) {
        return ResponseEntity.ok(onCallService.update(id, req));
    }

    @DeleteMapping("/schedules/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        onCallService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/schedules/{id}/overrides")
    public ResponseEntity<OnCallSchedule> addOverride(@PathVariable String id, @RequestBody OverrideReq req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(onCallService.addOverride(id, req));
    }
}
