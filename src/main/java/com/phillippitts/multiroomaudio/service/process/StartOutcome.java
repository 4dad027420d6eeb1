package com.phillippitts.multiroomaudio.service.process;

/**
 * Result of {@link ProcessSupervisor#start}.
 *
 * @param success      whether a process is running for the name afterwards
 * @param usedFallback whether the running process came from the fallback command
 * @param message      human-readable outcome
 */
public record StartOutcome(boolean success, boolean usedFallback, String message) {

    public static StartOutcome started(String message) {
        return new StartOutcome(true, false, message);
    }

    public static StartOutcome startedWithFallback(String message) {
        return new StartOutcome(true, true, message);
    }

    public static StartOutcome failed(String message) {
        return new StartOutcome(false, false, message);
    }
}
