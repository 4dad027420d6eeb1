package com.phillippitts.multiroomaudio.service.process;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A live player process tracked by the {@link ProcessSupervisor}. Never persisted.
 *
 * @param name           player name, the supervisor key
 * @param process        OS process handle
 * @param processGroupId id of the process group the player leads, -1 if unknown
 * @param logPath        file receiving the process output
 * @param startedAt      when the process passed its startup grace period
 * @param degraded       whether the process was launched from the fallback command
 */
public record ManagedProcess(
        String name,
        Process process,
        long processGroupId,
        Path logPath,
        Instant startedAt,
        boolean degraded
) {

    public boolean isAlive() {
        return process.isAlive();
    }
}
