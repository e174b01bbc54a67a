package com.sandy.aiot.vision.alerting.support;

import com.sandy.aiot.vision.alerting.repository.AlertGroupRepository;
import com.sandy.aiot.vision.alerting.repository.AlertRepository;
import com.sandy.aiot.vision.alerting.repository.AlertSlaRepository;
import com.sandy.aiot.vision.alerting.repository.AlertStateEntryRepository;
import com.sandy.aiot.vision.alerting.repository.EscalationPolicyRepository;
import com.sandy.aiot.vision.alerting.repository.NotificationIntentRepository;
import com.sandy.aiot.vision.alerting.repository.OnCallScheduleRepository;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

import java.time.Instant;

@TestConfiguration
public class AlertingTestConfig {

    public static final Instant T0 = Instant.parse("2024-03-04T08:00:00Z");

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock(T0);
    }

    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public RecordingNotificationDispatcher recordingNotificationDispatcher() {
        return new RecordingNotificationDispatcher();
    }

    @Bean
    public StoreCleaner storeCleaner(AlertRepository alerts,
                                     AlertStateEntryRepository entries,
                                     AlertSlaRepository slas,
                                     AlertGroupRepository groups,
                                     EscalationPolicyRepository policies,
                                     OnCallScheduleRepository schedules,
                                     NotificationIntentRepository intents) {
        return () -> {
            intents.deleteAllInBatch();
            entries.deleteAllInBatch();
            slas.deleteAllInBatch();
            alerts.deleteAllInBatch();
            groups.deleteAllInBatch();
            policies.deleteAllInBatch();
            schedules.deleteAllInBatch();
        };
    }

    @FunctionalInterface
    public interface StoreCleaner {
        void reset();
    }
}
