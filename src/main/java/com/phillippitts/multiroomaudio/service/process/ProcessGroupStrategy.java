package com.phillippitts.multiroomaudio.service.process;

import java.util.List;

/**
 * Platform capability for launching a player as the leader of its own process group and
 * signalling the whole group.
 *
 * <p>Players such as squeezelite fork decoder helpers; signalling only the leader would leave
 * helpers holding the audio device open. Where the platform has no process groups the
 * strategy falls back to walking the process tree.
 */
public interface ProcessGroupStrategy {

    /** Short name for logs. */
    String name();

    /**
     * Returns the argv that actually gets spawned for {@code command} (e.g. wrapped in
     * {@code setsid}).
     */
    List<String> prepareCommand(List<String> command);

    /** Requests graceful termination of the process and everything it spawned (SIGTERM). */
    void terminate(Process process);

    /** Unconditionally kills the process and everything it spawned (SIGKILL). */
    void kill(Process process);

    /** Identifier used to address the group: the leader's pid, or -1 when unknown. */
    static long groupIdOf(Process process) {
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return -1;
        }
    }
}
