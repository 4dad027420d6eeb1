package com.phillippitts.multiroomaudio.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Running state of every configured player at one instant.
 *
 * @param statuses player name to running flag, in configuration order
 * @param takenAt  when the liveness check ran
 */
public record PlayerStatusSnapshot(Map<String, Boolean> statuses, Instant takenAt) {

    public PlayerStatusSnapshot {
        statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
        Objects.requireNonNull(takenAt, "takenAt must not be null");
    }

    public static PlayerStatusSnapshot of(Map<String, Boolean> statuses) {
        return new PlayerStatusSnapshot(statuses, Instant.now());
    }

    public long runningCount() {
        return statuses.values().stream().filter(Boolean::booleanValue).count();
    }
}
