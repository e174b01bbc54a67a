package com.sandy.aiot.vision.alerting.controller;

import com.sandy.aiot.vision.alerting.entity.AlertStateEntry;
import com.sandy.aiot.vision.alerting.service.AlertGroupingEngine;
import com.sandy.aiot.vision.alerting.service.AlertIngressService;
import com.sandy.aiot.vision.alerting.service.impl.EscalationDriver;
import com.sandy.aiot.vision.alerting.vo.AlertCreatedVO;
import com.sandy.aiot.vision.alerting.vo.AlertDetailVO;
import com.sandy.aiot.vision.alerting.vo.AlertItemVO;
import com.sandy.aiot.vision.alerting.vo.CreateAlertReq;
import com.sandy.aiot.vision.alerting.vo.NoteReq;
import com.sandy.aiot.vision.alerting.vo.PageVO;
import com.sandy.aiot.vision.alerting.vo.TransitionReq;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Alert ingress and operator actions. The acting user comes from the {@code X-User-Id} header.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertController {

    public static final String ACTOR_HEADER = "X-User-Id";

    private final AlertIngressService ingressService;
    private final AlertGroupingEngine groupingEngine;
    private final EscalationDriver escalationDriver;

    @PostMapping
    public ResponseEntity<AlertCreatedVO> create(@RequestBody CreateAlertReq req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ingressService.createAlert(req));
    }

    @GetMapping
    public ResponseEntity<PageVO<AlertItemVO>> list(@RequestParam(required = false) String severity,
                                                    @RequestParam(required = false) String state,
                                                    @RequestParam(name = "device_id", required = false) String deviceId,
                                                    @RequestParam(required = false) Integer window,
                                                    @RequestParam(defaultValue = "0") int page,
                                                    @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(ingressService.list(severity, state, deviceId, window, page, size));
    }

    @GetMapping("/meta")
    public ResponseEntity<Meta> meta() {
        Meta m = new Meta();
        m.setEscalationEnabled(escalationDriver.isEnabled());
        m.setOpenAlerts(ingressService.countOpen());
        m.setGroupingWindowMinutes(groupingEngine.getWindow().toMinutes());
        return ResponseEntity.ok(m);
    }

    @GetMapping("/{id}")
    public ResponseEntity<AlertDetailVO> get(@PathVariable Long id) {
        return ResponseEntity.ok(ingressService.getAlert(id));
    }

    @PostMapping("/{id}/transition")
    public ResponseEntity<AlertStateEntry> transition(@PathVariable Long id,
                                                      @RequestHeader(name = ACTOR_HEADER, required = false) String actor,
                                                      @RequestBody TransitionReq req) {
        return ResponseEntity.ok(ingressService.transition(id, req.getTargetState(), actor, req.getNotes(), req.getMetadata()));
    }

    @PostMapping("/{id}/notes")
    public ResponseEntity<AlertStateEntry> addNote(@PathVariable Long id,
                                                   @RequestHeader(name = ACTOR_HEADER, required = false) String actor,
                                                   @RequestBody NoteReq req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ingressService.addNote(id, actor, req.getNotes(), req.getMetadata()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        ingressService.deleteAlert(id);
        return ResponseEntity.noContent().build();
    }

    @Data
    public static class Meta {
        private boolean escalationEnabled;
        private long openAlerts;
        private long groupingWindowMinutes;
    }
}
