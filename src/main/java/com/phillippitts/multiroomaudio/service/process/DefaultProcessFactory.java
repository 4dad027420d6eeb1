package com.phillippitts.multiroomaudio.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path logFile) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        // Players write to their own log file; nothing is buffered in the JVM
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        Process process = pb.start();
        process.getOutputStream().close();
        return process;
    }
}
