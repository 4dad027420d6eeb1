package com.phillippitts.multiroomaudio.util;

import java.time.Duration;

/**
 * Standard timeout values for player process and helper command management.
 *
 * <p>These are the defaults behind {@code player.process.*} and {@code audio.*}; every blocking
 * wait in the supervisor is bounded by one of them.
 *
 * @see com.phillippitts.multiroomaudio.service.process.ProcessSupervisor
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * How long a freshly spawned player must stay alive to count as started.
     *
     * <p>A missing device or bad flag makes squeezelite and friends exit well within 500ms.
     */
    public static final Duration STARTUP_GRACE = Duration.ofMillis(500);

    /**
     * Wait after SIGTERM to the process group before escalating.
     */
    public static final Duration GRACEFUL_STOP_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Wait after SIGKILL to the process group. The entry is dropped from tracking afterwards
     * whether or not the wait succeeded.
     */
    public static final Duration FORCED_KILL_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Upper bound for short-lived helper commands (aplay, amixer, kill).
     */
    public static final Duration HELPER_COMMAND_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Timeout for stream gobbler threads to flush buffered output after a helper command exits.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
