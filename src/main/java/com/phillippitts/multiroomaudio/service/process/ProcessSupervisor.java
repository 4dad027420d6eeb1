package com.phillippitts.multiroomaudio.service.process;

import com.phillippitts.multiroomaudio.config.properties.ProcessSupervisorProperties;
import com.phillippitts.multiroomaudio.domain.OperationResult;
import com.phillippitts.multiroomaudio.exception.MultiRoomAudioException;
import com.phillippitts.multiroomaudio.util.KeyedLocks;
import com.phillippitts.multiroomaudio.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Owns the mapping from player name to its live OS process group.
 *
 * <p>Responsibilities:
 * - Spawn a player in its own process group and detect immediate failure within a grace period
 * - Retry once with a fallback command when the primary exits immediately
 * - Stop gracefully (SIGTERM to the group), escalating to SIGKILL after a bounded wait
 * - Check liveness on every call and reap processes that exited on their own
 *
 * <p>Start and stop for the same name are serialized by a per-name lock, so the "already
 * running" check and the registration of the new process are atomic. Liveness checks take no
 * lock. The supervisor never touches persisted configuration.
 */
public class ProcessSupervisor {

    private static final Logger LOG = LogManager.getLogger(ProcessSupervisor.class);

    /** Exit status used by shells and {@code setsid} when the program cannot be found. */
    static final int EXIT_COMMAND_NOT_FOUND = 127;

    private static final int FAILURE_TAIL_CHARS = 300;
    private static final int FAILURE_READ_BYTES = 4096;

    private final ProcessFactory processFactory;
    private final ProcessGroupStrategy groupStrategy;
    private final Path logDir;
    private final Duration startupGrace;
    private final Duration stopTimeout;
    private final Duration killTimeout;

    private final ConcurrentMap<String, ManagedProcess> processes = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ProcessState> transitions = new ConcurrentHashMap<>();
    private final KeyedLocks locks = new KeyedLocks();

    public ProcessSupervisor(ProcessFactory processFactory,
                             ProcessGroupStrategy groupStrategy,
                             ProcessSupervisorProperties props) {
        this(processFactory, groupStrategy, Path.of(props.getLogDir()),
                props.getStartupGrace(), props.getStopTimeout(), props.getKillTimeout());
    }

    public ProcessSupervisor(ProcessFactory processFactory,
                             ProcessGroupStrategy groupStrategy,
                             Path logDir,
                             Duration startupGrace,
                             Duration stopTimeout,
                             Duration killTimeout) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.groupStrategy = Objects.requireNonNull(groupStrategy, "groupStrategy");
        this.logDir = Objects.requireNonNull(logDir, "logDir").toAbsolutePath().normalize();
        this.startupGrace = Objects.requireNonNull(startupGrace, "startupGrace");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
        this.killTimeout = Objects.requireNonNull(killTimeout, "killTimeout");
        try {
            Files.createDirectories(this.logDir);
        } catch (IOException e) {
            throw new MultiRoomAudioException("Cannot create process log directory " + this.logDir, e);
        }
        LOG.info("Process supervisor ready: logDir={}, strategy={}, grace={}ms, stop={}ms, kill={}ms",
                this.logDir, groupStrategy.name(), startupGrace.toMillis(),
                stopTimeout.toMillis(), killTimeout.toMillis());
    }

    /**
     * Starts {@code command} for {@code name}, retrying with {@code fallbackCommand} if the primary
     * exits within the startup grace period.
     *
     * <p>A missing binary is reported as such and never retried with the fallback, since the
     * fallback uses the same binary.
     *
     * @param fallbackCommand fallback argv, or {@code null}/empty for none
     */
    public StartOutcome start(String name, List<String> command, List<String> fallbackCommand) {
        Objects.requireNonNull(name, "name");
        if (command == null || command.isEmpty()) {
            return StartOutcome.failed("No command given for process '" + name + "'");
        }
        return locks.withLock(name, () -> {
            ManagedProcess existing = processes.get(name);
            if (existing != null) {
                if (existing.isAlive()) {
                    return StartOutcome.failed("Process '" + name + "' is already running");
                }
                processes.remove(name, existing);
                LOG.debug("Reaped exited process '{}' before restart", name);
            }
            transitions.put(name, ProcessState.STARTING);
            try {
                return startLocked(name, command, fallbackCommand);
            } finally {
                transitions.remove(name);
            }
        });
    }

    private StartOutcome startLocked(String name, List<String> command, List<String> fallbackCommand) {
        LOG.info("Starting process '{}' with command: {}", name, LogSanitizer.command(command));
        LaunchAttempt primary = launch(name, command);
        if (primary.process() != null) {
            register(name, primary, false);
            return StartOutcome.started("Process '" + name + "' started successfully");
        }
        if (primary.binaryMissing()) {
            LOG.error("Binary '{}' not found", command.get(0));
            return StartOutcome.failed("Binary '" + command.get(0) + "' not found");
        }
        LOG.error("Process '{}' failed to start: {}", name, primary.error());
        if (fallbackCommand == null || fallbackCommand.isEmpty()) {
            return StartOutcome.failed("Process failed to start: " + primary.error());
        }

        LOG.info("Trying fallback command for '{}': {}", name, LogSanitizer.command(fallbackCommand));
        LaunchAttempt fallback = launch(name, fallbackCommand);
        if (fallback.process() != null) {
            register(name, fallback, true);
            return StartOutcome.startedWithFallback("Process '" + name + "' started with fallback configuration");
        }
        String reason = fallback.binaryMissing()
                ? "Binary '" + fallbackCommand.get(0) + "' not found"
                : fallback.error();
        LOG.error("Fallback for '{}' failed: {}", name, reason);
        return StartOutcome.failed("Fallback also failed: " + reason);
    }

    private void register(String name, LaunchAttempt attempt, boolean degraded) {
        Process process = attempt.process();
        ManagedProcess managed = new ManagedProcess(name, process, ProcessGroupStrategy.groupIdOf(process),
                attempt.logPath(), Instant.now(), degraded);
        processes.put(name, managed);
        LOG.info("Started process '{}' (pgid={}{})", name, managed.processGroupId(),
                degraded ? ", fallback" : "");
    }

    private LaunchAttempt launch(String name, List<String> command) {
        Path logPath = getLogPath(name);
        long offset = sizeOf(logPath);
        Process process;
        try {
            process = processFactory.start(groupStrategy.prepareCommand(command), logPath);
        } catch (IOException e) {
            if (isNotFound(e)) {
                return LaunchAttempt.missingBinary(logPath);
            }
            return LaunchAttempt.failed(logPath, "Error starting process: " + e.getMessage());
        }

        boolean exited;
        try {
            exited = process.waitFor(startupGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            groupStrategy.kill(process);
            return LaunchAttempt.failed(logPath, "Interrupted while waiting for process to start");
        }
        if (!exited) {
            return LaunchAttempt.running(process, logPath);
        }

        int exitCode = process.exitValue();
        if (exitCode == EXIT_COMMAND_NOT_FOUND) {
            return LaunchAttempt.missingBinary(logPath);
        }
        String output = readSince(logPath, offset);
        String error = output.isEmpty()
                ? "exited with code " + exitCode
                : output + " (exit code " + exitCode + ")";
        return LaunchAttempt.failed(logPath, error);
    }

    /**
     * Stops the process for {@code name}: SIGTERM to the group, then SIGKILL after the stop
     * timeout. The entry is dropped once either wait completes, even if the kill wait times out.
     */
    public OperationResult stop(String name) {
        return locks.withLock(name, () -> {
            ManagedProcess managed = processes.get(name);
            if (managed == null) {
                return OperationResult.failure("Process '" + name + "' not found");
            }
            if (!managed.isAlive()) {
                processes.remove(name, managed);
                return OperationResult.failure("Process '" + name + "' was not running");
            }
            transitions.put(name, ProcessState.STOPPING);
            try {
                return stopLocked(managed);
            } finally {
                transitions.remove(name);
            }
        });
    }

    private OperationResult stopLocked(ManagedProcess managed) {
        String name = managed.name();
        Process process = managed.process();
        try {
            groupStrategy.terminate(process);
            if (process.waitFor(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                processes.remove(name, managed);
                LOG.info("Stopped process '{}'", name);
                return OperationResult.ok("Process '" + name + "' stopped successfully");
            }
            LOG.warn("Process '{}' ignored SIGTERM for {}ms; killing process group", name, stopTimeout.toMillis());
            groupStrategy.kill(process);
            if (!process.waitFor(killTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Process '{}' still alive {}ms after SIGKILL; dropping it from tracking",
                        name, killTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            groupStrategy.kill(process);
        } catch (RuntimeException e) {
            LOG.error("Error stopping process '{}'", name, e);
            return OperationResult.failure("Error stopping process: " + e.getMessage());
        }
        processes.remove(name, managed);
        LOG.info("Force stopped process '{}'", name);
        return OperationResult.ok("Process '" + name + "' force stopped");
    }

    /** Live check, never cached. */
    public boolean isRunning(String name) {
        ManagedProcess managed = processes.get(name);
        return managed != null && managed.isAlive();
    }

    /** Running flag for every requested name, in iteration order; untracked names map to false. */
    public Map<String, Boolean> getAllStatuses(Collection<String> names) {
        Map<String, Boolean> statuses = new LinkedHashMap<>();
        for (String name : names) {
            statuses.put(name, isRunning(name));
        }
        return statuses;
    }

    public Optional<ProcessState> getProcessState(String name) {
        ProcessState transition = transitions.get(name);
        if (transition != null) {
            return Optional.of(transition);
        }
        ManagedProcess managed = processes.get(name);
        if (managed == null || !managed.isAlive()) {
            return Optional.empty();
        }
        return Optional.of(managed.degraded() ? ProcessState.RUNNING_DEGRADED : ProcessState.RUNNING);
    }

    /** Whether {@code name} is running from its fallback command. */
    public boolean isDegraded(String name) {
        ManagedProcess managed = processes.get(name);
        return managed != null && managed.degraded() && managed.isAlive();
    }

    /** Names that currently have a tracked entry, alive or not yet reaped. */
    public Set<String> trackedNames() {
        return Set.copyOf(processes.keySet());
    }

    /**
     * Drops every tracked process that exited without a stop call.
     *
     * @return names that were reaped
     */
    public List<String> cleanupDeadProcesses() {
        List<String> reaped = new ArrayList<>();
        for (Map.Entry<String, ManagedProcess> entry : processes.entrySet()) {
            ManagedProcess managed = entry.getValue();
            if (!managed.isAlive() && processes.remove(entry.getKey(), managed)) {
                reaped.add(entry.getKey());
                LOG.debug("Cleaned up terminated process '{}'", entry.getKey());
            }
        }
        return reaped;
    }

    /**
     * Stops every tracked process. A failure on one name does not prevent stopping the rest.
     *
     * @return number of processes that were running and are now stopped
     */
    public int stopAll() {
        int stopped = 0;
        for (String name : new ArrayList<>(processes.keySet())) {
            try {
                if (stop(name).success()) {
                    stopped++;
                }
            } catch (RuntimeException e) {
                LOG.error("Failed to stop process '{}' during shutdown", name, e);
            }
        }
        return stopped;
    }

    public Path getLogPath(String name) {
        return logDir.resolve(name + ".log");
    }

    public Path getLogDir() {
        return logDir;
    }

    private static boolean isNotFound(IOException e) {
        String message = e.getMessage();
        return message != null
                && (message.contains("error=2,") || message.contains("No such file or directory"));
    }

    private static long sizeOf(Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            LOG.debug("Cannot read size of {}: {}", file, e.toString());
            return 0L;
        }
    }

    /** Output the process appended to its log after {@code offset}, collapsed and truncated. */
    private static String readSince(Path file, long offset) {
        if (!Files.exists(file)) {
            return "";
        }
        try (SeekableByteChannel channel = Files.newByteChannel(file)) {
            long size = channel.size();
            long start = Math.max(offset, size - FAILURE_READ_BYTES);
            if (start >= size) {
                return "";
            }
            channel.position(start);
            ByteBuffer buffer = ByteBuffer.allocate((int) (size - start));
            int read = 0;
            while (buffer.hasRemaining() && read >= 0) {
                read = channel.read(buffer);
            }
            String text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
            return LogSanitizer.tail(text, FAILURE_TAIL_CHARS);
        } catch (IOException e) {
            LOG.debug("Cannot read process log {}: {}", file, e.toString());
            return "";
        }
    }

    private record LaunchAttempt(Process process, Path logPath, boolean binaryMissing, String error) {

        static LaunchAttempt running(Process process, Path logPath) {
            return new LaunchAttempt(process, logPath, false, null);
        }

        static LaunchAttempt missingBinary(Path logPath) {
            return new LaunchAttempt(null, logPath, true, null);
        }

        static LaunchAttempt failed(Path logPath, String error) {
            return new LaunchAttempt(null, logPath, false, error);
        }
    }
}
