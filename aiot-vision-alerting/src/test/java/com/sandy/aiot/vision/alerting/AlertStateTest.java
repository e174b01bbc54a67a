package com.sandy.aiot.vision.alerting;

import com.sandy.aiot.vision.alerting.entity.AlertState;
import com.sandy.aiot.vision.alerting.entity.Severity;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class AlertStateTest {

    @Test
    void transitionTableMatchesLifecycle() {
        assertEquals(EnumSet.of(AlertState.ACKNOWLEDGED, AlertState.INVESTIGATING, AlertState.RESOLVED),
                AlertState.NEW.allowedTargets());
        assertEquals(EnumSet.of(AlertState.INVESTIGATING, AlertState.RESOLVED),
                AlertState.ACKNOWLEDGED.allowedTargets());
        assertEquals(EnumSet.of(AlertState.RESOLVED), AlertState.INVESTIGATING.allowedTargets());
        assertTrue(AlertState.RESOLVED.allowedTargets().isEmpty());
    }

    @Test
    void resolvedIsTerminal() {
        assertTrue(AlertState.RESOLVED.isTerminal());
        for (AlertState target : AlertState.values()) {
            assertFalse(AlertState.RESOLVED.canTransitionTo(target), "resolved -> " + target);
        }
    }

    @Test
    void noBackwardsOrSelfTransitions() {
        assertFalse(AlertState.ACKNOWLEDGED.canTransitionTo(AlertState.NEW));
        assertFalse(AlertState.INVESTIGATING.canTransitionTo(AlertState.ACKNOWLEDGED));
        assertFalse(AlertState.NEW.canTransitionTo(AlertState.NEW));
    }

    @Test
    void humanResponseStates() {
        assertTrue(AlertState.ACKNOWLEDGED.isHumanResponse());
        assertTrue(AlertState.INVESTIGATING.isHumanResponse());
        assertFalse(AlertState.NEW.isHumanResponse());
        assertFalse(AlertState.RESOLVED.isHumanResponse());
    }

    @Test
    void codesAreCaseInsensitiveAndUnknownIsNull() {
        assertEquals(AlertState.ACKNOWLEDGED, AlertState.fromCode("Acknowledged"));
        assertEquals(Severity.CRITICAL, Severity.fromCode(" critical "));
        assertNull(Severity.fromCode("urgent"));
        assertNull(AlertState.fromCode(""));
        assertNull(AlertState.fromCode(null));
        assertEquals("investigating", AlertState.INVESTIGATING.code());
    }
}
