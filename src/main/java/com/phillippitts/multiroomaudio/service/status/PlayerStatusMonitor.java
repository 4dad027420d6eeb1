package com.phillippitts.multiroomaudio.service.status;

import com.phillippitts.multiroomaudio.config.properties.StatusMonitorProperties;
import com.phillippitts.multiroomaudio.domain.PlayerStatusSnapshot;
import com.phillippitts.multiroomaudio.service.player.PlayerOrchestrator;
import com.phillippitts.multiroomaudio.service.status.event.PlayerProcessExitedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Periodic task that reaps crashed player processes and publishes a status snapshot.
 *
 * <p>Each poll: reap processes that exited on their own (one {@link PlayerProcessExitedEvent}
 * per player), check every configured player, hand the snapshot to the
 * {@link PlayerStatusPublisher}. A failing poll is logged and the next one runs as scheduled.
 */
@Component
@ConditionalOnProperty(prefix = "player.status", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PlayerStatusMonitor {

    private static final Logger LOG = LogManager.getLogger(PlayerStatusMonitor.class);

    private final PlayerOrchestrator orchestrator;
    private final PlayerStatusPublisher publisher;
    private final ApplicationEventPublisher events;

    public PlayerStatusMonitor(PlayerOrchestrator orchestrator,
                               PlayerStatusPublisher publisher,
                               ApplicationEventPublisher events,
                               StatusMonitorProperties props) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.events = Objects.requireNonNull(events, "events");
        LOG.info("Status monitor polling every {} ms", props.getIntervalMs());
    }

    @Scheduled(fixedDelayString = "${player.status.interval-ms:2000}",
            initialDelayString = "${player.status.interval-ms:2000}")
    public void poll() {
        try {
            List<String> reaped = orchestrator.cleanupDeadProcesses();
            Instant now = Instant.now();
            for (String name : reaped) {
                events.publishEvent(new PlayerProcessExitedEvent(name, now));
            }
            PlayerStatusSnapshot snapshot = PlayerStatusSnapshot.of(orchestrator.getAllStatuses());
            publisher.publish(snapshot);
            LOG.trace("Published status of {} player(s), {} running",
                    snapshot.statuses().size(), snapshot.runningCount());
        } catch (RuntimeException e) {
            LOG.error("Error in status monitor: {}", e.toString());
        }
    }
}
