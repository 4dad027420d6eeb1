package com.phillippitts.multiroomaudio.presentation.sse;

import com.phillippitts.multiroomaudio.domain.PlayerStatusSnapshot;
import com.phillippitts.multiroomaudio.service.status.PlayerStatusListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pushes each status snapshot to connected Server-Sent Events clients as a
 * {@code status_update} event. Clients that cannot be written to are dropped.
 */
@Component
public class SseStatusBroadcaster implements PlayerStatusListener {

    private static final Logger LOG = LogManager.getLogger(SseStatusBroadcaster.class);

    public static final String EVENT_NAME = "status_update";

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    /**
     * Registers a new client. No timeout: the stream lives until the client disconnects.
     *
     * @param initial statuses sent immediately so the client does not wait for the next poll
     */
    public SseEmitter connect(Map<String, Boolean> initial) {
        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));
        emitters.add(emitter);
        send(emitter, initial);
        LOG.debug("Status stream client connected ({} total)", emitters.size());
        return emitter;
    }

    @Override
    public void onStatus(PlayerStatusSnapshot snapshot) {
        for (SseEmitter emitter : emitters) {
            send(emitter, snapshot.statuses());
        }
    }

    private void send(SseEmitter emitter, Map<String, Boolean> statuses) {
        try {
            emitter.send(SseEmitter.event().name(EVENT_NAME).data(statuses));
        } catch (IOException | IllegalStateException e) {
            LOG.debug("Dropping status stream client: {}", e.toString());
            emitters.remove(emitter);
            emitter.completeWithError(e);
        }
    }

    /** Package-private for tests */
    int clientCount() {
        return emitters.size();
    }
}
