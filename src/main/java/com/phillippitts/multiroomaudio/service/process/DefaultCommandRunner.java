package com.phillippitts.multiroomaudio.service.process;

import com.phillippitts.multiroomaudio.exception.DeviceCommandException;
import com.phillippitts.multiroomaudio.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>stdout and stderr are drained concurrently by daemon gobbler threads so a chatty tool
 * cannot block on a full pipe; both are capped at {@link #MAX_OUTPUT_CHARS}.
 */
public final class DefaultCommandRunner implements CommandRunner {

    private static final Logger LOG = LogManager.getLogger(DefaultCommandRunner.class);

    static final int MAX_OUTPUT_CHARS = 64 * 1024;

    @Override
    public CommandResult run(List<String> command, Duration timeout) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(false);
            process = pb.start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw new DeviceCommandException(command, e);
        }

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, "cmd-out");
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "cmd-err");

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOG.warn("Command '{}' timed out after {}ms", command.get(0), timeout.toMillis());
                process.destroyForcibly();
                return new CommandResult(-1, "", "", true);
            }
            joinQuietly(outGobbler);
            joinQuietly(errGobbler);
            return new CommandResult(process.exitValue(), stdout.toString(), stderr.toString(), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new CommandResult(-1, "", "interrupted", true);
        }
    }

    private static Thread startGobbler(InputStream in, StringBuilder sink, String name) {
        Thread thread = new Thread(() -> drain(in, sink, name), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void drain(InputStream in, StringBuilder sink, String name) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                // Keep draining past the cap so the child never blocks on a full pipe
                synchronized (sink) {
                    if (sink.length() < MAX_OUTPUT_CHARS) {
                        sink.append(line).append('\n');
                    }
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    private static void joinQuietly(Thread thread) {
        try {
            thread.join(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
