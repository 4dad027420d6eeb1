package com.phillippitts.multiroomaudio.service.process;

/**
 * Result of a short-lived helper command.
 *
 * @param exitCode process exit code, or -1 when the command timed out
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 * @param timedOut whether the command was killed for exceeding its timeout
 */
public record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /** Best available explanation of a failure: stderr, then stdout, then the exit code. */
    public String errorText() {
        if (timedOut) {
            return "timed out";
        }
        if (stderr != null && !stderr.isBlank()) {
            return stderr.strip();
        }
        if (stdout != null && !stdout.isBlank()) {
            return stdout.strip();
        }
        return "exit code " + exitCode;
    }
}
