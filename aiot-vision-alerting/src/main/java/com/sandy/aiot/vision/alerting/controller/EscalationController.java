package com.sandy.aiot.vision.alerting.controller;

import com.sandy.aiot.vision.alerting.entity.EscalationPolicy;
import com.sandy.aiot.vision.alerting.service.EscalationService;
import com.sandy.aiot.vision.alerting.vo.EscalationResultVO;
import com.sandy.aiot.vision.alerting.vo.EscalationStatusVO;
import com.sandy.aiot.vision.alerting.vo.PolicyReq;
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

@RestController
@RequestMapping("/api/escalation")
@RequiredArgsConstructor
public class EscalationController {

    private final EscalationService escalationService;

    @GetMapping("/policies")
    public ResponseEntity<List<EscalationPolicy>> policies(@RequestParam(name = "enabled_only", defaultValue = "false") boolean enabledOnly) {
        return ResponseEntity.ok(escalationService.listPolicies(enabledOnly));
    }

    @PostMapping("/policies")
    public ResponseEntity<EscalationPolicy> create(@RequestBody PolicyReq req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(escalationService.createPolicy(req));
    }

    @GetMapping("/policies/{id}")
    public ResponseEntity<EscalationPolicy> get(@PathVariable Long id) {
        return ResponseEntity.ok(escalationService.getPolicy(id));
    }

    @PatchMapping("/policies/{id}")
    public ResponseEntity<EscalationPolicy> update(@PathVariable Long id, @RequestBody PolicyReq req) {
        return ResponseEntity.ok(escalationService.updatePolicy(id, req));
    }

    @DeleteMapping("/policies/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        escalationService.deletePolicy(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/alerts/{id}/status")
    public ResponseEntity<EscalationStatusVO> status(@PathVariable Long id) {
        return ResponseEntity.ok(escalationService.status(id));
    }

    /** Manual escalation; {@code force} skips the tier delay but not the other eligibility checks. */
    @PostMapping("/alerts/{id}/escalate")
    public ResponseEntity<EscalationResultVO> escalate(@PathVariable Long id,
                                                       @RequestParam(defaultValue = "false") boolean force) {
        return ResponseEntity.ok(escalationService.escalate(id, force));
    }
}
