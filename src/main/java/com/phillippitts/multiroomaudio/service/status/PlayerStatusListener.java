package com.phillippitts.multiroomaudio.service.status;

import com.phillippitts.multiroomaudio.domain.PlayerStatusSnapshot;

/**
 * Receives every status snapshot taken by {@link PlayerStatusMonitor}.
 *
 * <p>Called on a pool thread; an exception is counted and logged by the publisher and does
 * not affect other listeners.
 */
@FunctionalInterface
public interface PlayerStatusListener {

    void onStatus(PlayerStatusSnapshot snapshot);
}
