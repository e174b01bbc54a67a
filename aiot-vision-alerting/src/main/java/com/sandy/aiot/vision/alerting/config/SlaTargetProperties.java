package com.sandy.aiot.vision.alerting.config;

import com.sandy.aiot.vision.alerting.entity.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Severity to SLA targets (minutes). Defaults are the platform table; a deployment may override
 * entries with {@code alerting.sla.severity-targets.<severity>.tta-minutes} / {@code .ttr-minutes}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "alerting.sla")
public class SlaTargetProperties {

    private Map<Severity, Target> severityTargets = defaults();

    public Target targetFor(Severity severity) {
        Target t = severityTargets.get(severity);
        return t != null ? t : defaults().get(severity);
    }

    private static Map<Severity, Target> defaults() {
        Map<Severity, Target> m = new EnumMap<>(Severity.class);
        m.put(Severity.CRITICAL, new Target(5, 30));
        m.put(Severity.HIGH, new Target(15, 120));
        m.put(Severity.MEDIUM, new Target(60, 480));
        m.put(Severity.LOW, new Target(240, 1440));
        m.put(Severity.INFO, new Target(1440, 10080));
        return m;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Target {
        private int ttaMinutes;
        private int ttrMinutes;
    }
}
