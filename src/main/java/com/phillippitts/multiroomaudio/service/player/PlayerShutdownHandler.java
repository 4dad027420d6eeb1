package com.phillippitts.multiroomaudio.service.player;

import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Stops every supervised player when the application context closes, so no player process
 * outlives the controller.
 */
@Component
public class PlayerShutdownHandler {

    private static final Logger LOG = LogManager.getLogger(PlayerShutdownHandler.class);

    private final PlayerOrchestrator orchestrator;

    public PlayerShutdownHandler(PlayerOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PreDestroy
    public void onShutdown() {
        LOG.info("Shutting down: stopping player processes");
        int stopped = orchestrator.shutdown();
        LOG.info("Shutdown complete ({} player(s) stopped)", stopped);
    }
}
