package com.phillippitts.multiroomaudio.presentation.controller;

import com.phillippitts.multiroomaudio.domain.AudioDiagnostics;
import com.phillippitts.multiroomaudio.service.player.PlayerOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Troubleshooting views of the host's audio tooling.
 */
@RestController
@RequestMapping("/api/debug")
class DebugController {

    private static final Logger LOG = LogManager.getLogger(DebugController.class);

    private final PlayerOrchestrator orchestrator;

    DebugController(PlayerOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/audio")
    Map<String, Object> audio() {
        AudioDiagnostics diagnostics = orchestrator.getAudioDiagnostics();
        LOG.info("Audio diagnostics: aplay={}, amixer={}, {} device(s)",
                diagnostics.aplayAvailable(), diagnostics.amixerAvailable(), diagnostics.detectedDevices().size());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detected_devices", diagnostics.detectedDevices());
        body.put("aplay_available", diagnostics.aplayAvailable());
        body.put("amixer_available", diagnostics.amixerAvailable());
        body.put("aplay_output", diagnostics.aplayOutput());
        body.put("amixer_cards_output", diagnostics.amixerCardsOutput());
        body.put("mixer_controls", diagnostics.mixerControls());
        return body;
    }
}
