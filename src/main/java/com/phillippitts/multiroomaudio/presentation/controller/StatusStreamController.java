package com.phillippitts.multiroomaudio.presentation.controller;

import com.phillippitts.multiroomaudio.presentation.sse.SseStatusBroadcaster;
import com.phillippitts.multiroomaudio.service.player.PlayerOrchestrator;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Live player statuses over Server-Sent Events.
 */
@RestController
class StatusStreamController {

    private final SseStatusBroadcaster broadcaster;
    private final PlayerOrchestrator orchestrator;

    StatusStreamController(SseStatusBroadcaster broadcaster, PlayerOrchestrator orchestrator) {
        this.broadcaster = broadcaster;
        this.orchestrator = orchestrator;
    }

    @GetMapping(path = "/api/status/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    SseEmitter stream() {
        return broadcaster.connect(orchestrator.getAllStatuses());
    }
}
