package com.sandy.aiot.vision.alerting.service.notification;

import com.sandy.aiot.vision.alerting.entity.Alert;
import com.sandy.aiot.vision.alerting.entity.NotificationIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Fallback dispatcher: writes the notification to the log only. */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void dispatch(NotificationIntent intent, Alert alert) {
        log.info("[NOTIFY] tier={} channel={} to={} alert={} severity={} device={} msg={}",
                intent.getTier(), intent.getChannel().code(), intent.getRecipient(), alert.getId(),
                alert.getSeverity().code(), alert.getDeviceId(), alert.getMessage());
    }
}
