package com.phillippitts.multiroomaudio.service.process;

import java.time.Duration;
import java.util.List;

/**
 * Runs short-lived helper commands (device listing, mixer control, signalling) to completion.
 */
public interface CommandRunner {
    /**
     * Runs {@code command} and waits at most {@code timeout} for it to exit.
     *
     * @throws com.phillippitts.multiroomaudio.exception.DeviceCommandException if the command
     *         cannot be launched at all
     */
    CommandResult run(List<String> command, Duration timeout);
}
