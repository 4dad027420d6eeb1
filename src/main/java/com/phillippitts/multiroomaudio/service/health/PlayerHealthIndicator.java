package com.phillippitts.multiroomaudio.service.health;

import com.phillippitts.multiroomaudio.service.player.PlayerOrchestrator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Health indicator summarising the supervised players.
 *
 * <ul>
 *   <li>UP: every running player uses its declared device</li>
 *   <li>DEGRADED: at least one player runs from its fallback command</li>
 * </ul>
 *
 * <p>Stopped players do not affect health; they are reported in the details only.
 * Exposed via /actuator/health endpoint.
 */
@Component
public class PlayerHealthIndicator implements HealthIndicator {

    private final PlayerOrchestrator orchestrator;

    public PlayerHealthIndicator(PlayerOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        Map<String, Boolean> statuses = orchestrator.getAllStatuses();
        long running = statuses.values().stream().filter(Boolean::booleanValue).count();
        List<String> degraded = statuses.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .filter(orchestrator::isDegraded)
                .toList();

        Health.Builder builder = degraded.isEmpty() ? Health.up() : Health.status("DEGRADED");
        return builder
                .withDetail("configured", statuses.size())
                .withDetail("running", running)
                .withDetail("degraded", degraded)
                .build();
    }
}
