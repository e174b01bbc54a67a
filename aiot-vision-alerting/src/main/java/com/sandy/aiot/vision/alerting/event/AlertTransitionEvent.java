package com.sandy.aiot.vision.alerting.event;

import com.sandy.aiot.vision.alerting.entity.AlertState;

import java.time.Instant;

/**
 * Published inside the transition transaction, after the history entry is written.
 */
public record AlertTransitionEvent(Long alertId,
                                   AlertState fromState,
                                   AlertState toState,
                                   String actor,
                                   Instant changedAt,
                                   Long groupId,
                                   boolean forced) {
}
