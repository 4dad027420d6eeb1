package com.phillippitts.multiroomaudio.service.status;

import com.phillippitts.multiroomaudio.service.status.event.PlayerProcessExitedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs player crashes. Throttled per player to avoid log spam from a crash-looping player.
 */
@Component
class PlayerEventsListener {
    private static final Logger LOG = LogManager.getLogger(PlayerEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onProcessExited(PlayerProcessExitedEvent e) {
        if (shouldLog("exited-" + e.name())) {
            LOG.warn("Player '{}' exited unexpectedly. Check its log file under player.process.log-dir.", e.name());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
