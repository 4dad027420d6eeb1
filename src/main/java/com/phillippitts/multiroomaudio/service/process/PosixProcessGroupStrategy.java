package com.phillippitts.multiroomaudio.service.process;

import com.phillippitts.multiroomaudio.exception.DeviceCommandException;
import com.phillippitts.multiroomaudio.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Starts players under {@code setsid} so each becomes a session and process-group leader
 * (pgid == pid), then signals the group with {@code kill -SIG -- -pgid}.
 *
 * <p>If {@code kill} fails the strategy falls back to signalling the leader through the JDK.
 */
public final class PosixProcessGroupStrategy implements ProcessGroupStrategy {

    private static final Logger LOG = LogManager.getLogger(PosixProcessGroupStrategy.class);

    private final CommandRunner runner;

    public PosixProcessGroupStrategy(CommandRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public String name() {
        return "posix-process-group";
    }

    @Override
    public List<String> prepareCommand(List<String> command) {
        List<String> wrapped = new ArrayList<>(command.size() + 1);
        wrapped.add("setsid");
        wrapped.addAll(command);
        return wrapped;
    }

    @Override
    public void terminate(Process process) {
        if (!signalGroup(process, "TERM")) {
            process.destroy();
        }
    }

    @Override
    public void kill(Process process) {
        if (!signalGroup(process, "KILL")) {
            process.destroyForcibly();
        }
    }

    private boolean signalGroup(Process process, String signal) {
        long pgid = ProcessGroupStrategy.groupIdOf(process);
        if (pgid <= 0) {
            return false;
        }
        try {
            CommandResult result = runner.run(
                    List.of("kill", "-" + signal, "--", "-" + pgid), ProcessTimeouts.HELPER_COMMAND_TIMEOUT);
            if (!result.succeeded()) {
                LOG.debug("kill -{} for group {} failed: {}", signal, pgid, result.errorText());
            }
            return result.succeeded();
        } catch (DeviceCommandException e) {
            LOG.warn("Could not signal process group {}: {}", pgid, e.getMessage());
            return false;
        }
    }
}
