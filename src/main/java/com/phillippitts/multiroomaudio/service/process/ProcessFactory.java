package com.phillippitts.multiroomaudio.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of the supervisor.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub that returns a
 * fake {@link Process} with controlled liveness and exit behavior.
 */
public interface ProcessFactory {
    /**
     * Starts a long-running player process whose stdout and stderr are appended to {@code logFile}.
     *
     * @param command full command line, with the executable as the first element
     * @param logFile file receiving the process output (created if missing)
     * @return started {@link Process}
     * @throws IOException if the process cannot be started (e.g. executable not found)
     */
    Process start(List<String> command, Path logFile) throws IOException;
}
