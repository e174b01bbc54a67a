package com.sandy.aiot.vision.alerting.controller;

import com.sandy.aiot.vision.alerting.entity.AlertSla;
import com.sandy.aiot.vision.alerting.entity.Severity;
import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.service.SlaTracker;
import com.sandy.aiot.vision.alerting.vo.SlaReportVO;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

@RestController
@RequestMapping("/api/sla")
@RequiredArgsConstructor
public class SlaController {

    private final SlaTracker slaTracker;

    /** Compliance over alerts created in [from, to]; defaults to the last 30 days. */
    @GetMapping("/report")
    public ResponseEntity<SlaReportVO> report(@RequestParam(required = false) String severity,
                                              @RequestParam(required = false) String from,
                                              @RequestParam(required = false) String to) {
        return ResponseEntity.ok(slaTracker.complianceReport(severity(severity), instant(from, "from"), instant(to, "to")));
    }

    @GetMapping("/breaches")
    public ResponseEntity<List<AlertSla>> breaches(@RequestParam(defaultValue = "all") String type,
                                                   @RequestParam(required = false) String severity,
                                                   @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(slaTracker.breached(type, severity(severity), limit));
    }

    @GetMapping("/alerts/{id}")
    public ResponseEntity<AlertSla> forAlert(@PathVariable Long id) {
        return ResponseEntity.ok(slaTracker.slaFor(id));
    }

    private static Severity severity(String code) {
        if (code == null || code.isBlank()) return null;
        Severity s = Severity.fromCode(code);
        if (s == null) throw AlertingException.validation("Unknown severity: " + code);
        return s;
    }

    private static Instant instant(String text, String field) {
        if (text == null || text.isBlank()) return null;
        try {
            return OffsetDateTime.parse(text.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw AlertingException.validation(field + " must be an ISO-8601 date-time with offset");
        }
    }
}
