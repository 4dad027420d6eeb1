package com.phillippitts.multiroomaudio.presentation.controller;

import com.phillippitts.multiroomaudio.domain.ProviderInfo;
import com.phillippitts.multiroomaudio.service.player.PlayerOrchestrator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
class ProviderController {

    private final PlayerOrchestrator orchestrator;

    ProviderController(PlayerOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/api/providers")
    Map<String, List<ProviderInfo>> listProviders() {
        return Map.of("providers", orchestrator.getAvailableProviders());
    }
}
