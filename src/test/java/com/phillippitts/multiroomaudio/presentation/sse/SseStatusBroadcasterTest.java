package com.phillippitts.multiroomaudio.presentation.sse;

import com.phillippitts.multiroomaudio.domain.PlayerStatusSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SseStatusBroadcasterTest {

    @Test
    void tracksConnectedClients() {
        SseStatusBroadcaster broadcaster = new SseStatusBroadcaster();

        broadcaster.connect(Map.of("Kitchen", true));
        broadcaster.connect(Map.of());

        assertThat(broadcaster.clientCount()).isEqualTo(2);
    }

    @Test
    void dropsClientsThatCannotBeWritten() {
        SseStatusBroadcaster broadcaster = new SseStatusBroadcaster();
        SseEmitter gone = broadcaster.connect(Map.of());
        broadcaster.connect(Map.of());
        gone.complete();

        assertThatCode(() -> broadcaster.onStatus(PlayerStatusSnapshot.of(Map.of("Kitchen", false))))
                .doesNotThrowAnyException();

        assertThat(broadcaster.clientCount()).isEqualTo(1);
    }
}
