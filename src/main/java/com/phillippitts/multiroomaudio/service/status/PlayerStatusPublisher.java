package com.phillippitts.multiroomaudio.service.status;

import com.phillippitts.multiroomaudio.domain.PlayerStatusSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans a snapshot out to every {@link PlayerStatusListener}, one task per listener.
 *
 * <p>Listener failures are counted per listener and logged adaptively (the first three, then
 * every tenth) so a listener that is permanently broken does not flood the log every poll.
 */
@Component
public class PlayerStatusPublisher {

    private static final Logger LOG = LogManager.getLogger(PlayerStatusPublisher.class);

    static final int ALWAYS_LOG_FIRST = 3;
    static final int LOG_EVERY = 10;

    private final List<PlayerStatusListener> listeners;
    private final Executor executor;
    private final ConcurrentMap<PlayerStatusListener, AtomicLong> failures = new ConcurrentHashMap<>();

    public PlayerStatusPublisher(List<PlayerStatusListener> listeners,
                                 @Qualifier("statusExecutor") Executor executor) {
        this.listeners = List.copyOf(Objects.requireNonNull(listeners, "listeners"));
        this.executor = Objects.requireNonNull(executor, "executor");
        LOG.info("Status publisher initialized with {} listener(s)", this.listeners.size());
    }

    public void publish(PlayerStatusSnapshot snapshot) {
        for (PlayerStatusListener listener : listeners) {
            try {
                executor.execute(() -> deliver(listener, snapshot));
            } catch (RejectedExecutionException e) {
                recordFailure(listener, e);
            }
        }
    }

    private void deliver(PlayerStatusListener listener, PlayerStatusSnapshot snapshot) {
        try {
            listener.onStatus(snapshot);
        } catch (RuntimeException e) {
            recordFailure(listener, e);
        }
    }

    private void recordFailure(PlayerStatusListener listener, RuntimeException e) {
        long count = failures.computeIfAbsent(listener, l -> new AtomicLong()).incrementAndGet();
        if (count <= ALWAYS_LOG_FIRST || count % LOG_EVERY == 0) {
            LOG.warn("Status listener {} failed ({} failure(s) so far): {}",
                    listener.getClass().getSimpleName(), count, e.toString());
        }
    }

    /** Package-private for tests */
    long failureCount(PlayerStatusListener listener) {
        AtomicLong count = failures.get(listener);
        return count == null ? 0 : count.get();
    }
}
