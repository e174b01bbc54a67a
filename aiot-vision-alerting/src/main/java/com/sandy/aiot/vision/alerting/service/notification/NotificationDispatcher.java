package com.sandy.aiot.vision.alerting.service.notification;

import com.sandy.aiot.vision.alerting.entity.Alert;
import com.sandy.aiot.vision.alerting.entity.NotificationChannel;
import com.sandy.aiot.vision.alerting.entity.NotificationIntent;

/**
 * Delivers notification intents to an external channel (mail relay, SMS gateway, webhook ...).
 * Dispatchers are ordered; the first one that supports the channel handles the intent.
 */
public interface NotificationDispatcher {

    /**
     * Channel or integration name, used in logs and recorded on the intent.
     */
    String name();

    default boolean supports(NotificationChannel channel) {
        return true;
    }

    /**
     * Hands the intent over synchronously. Throwing marks the intent failed; returning marks it dispatched.
     * Delivery itself is confirmed later through an acknowledgement.
     */
    void dispatch(NotificationIntent intent, Alert alert);
}
