package com.phillippitts.multiroomaudio.service.status;

import com.phillippitts.multiroomaudio.service.status.event.PlayerProcessExitedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class PlayerEventsListenerTest {

    @Test
    void throttlesRepeatLogsPerPlayer() {
        PlayerEventsListener l = new PlayerEventsListener();
        assertThat(l.shouldLog("exited-Kitchen")).isTrue();
        assertThat(l.shouldLog("exited-Kitchen")).isFalse();
        // other players are throttled independently
        assertThat(l.shouldLog("exited-Patio")).isTrue();
    }

    @Test
    void handlerDoesNotThrow() {
        PlayerEventsListener l = new PlayerEventsListener();
        assertThatCode(() -> {
            l.onProcessExited(new PlayerProcessExitedEvent("Kitchen", Instant.now()));
            l.onProcessExited(new PlayerProcessExitedEvent("Kitchen", Instant.now()));
        }).doesNotThrowAnyException();
    }
}
