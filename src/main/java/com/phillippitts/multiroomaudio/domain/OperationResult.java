package com.phillippitts.multiroomaudio.domain;

import java.util.Optional;

/**
 * Outcome of a player operation as reported to the transport layer.
 *
 * <p>A {@code warning} is only present on partial successes: the declared state was persisted
 * but the process or hardware side did not follow (e.g. restart after update failed, mixer
 * refused a volume change). {@code success} stays {@code true} in those cases.
 *
 * @param success whether the requested change took effect in the persisted state
 * @param message user-facing message
 * @param warning secondary problem on partial success, otherwise {@code null}
 */
public record OperationResult(boolean success, String message, String warning) {

    public static OperationResult ok(String message) {
        return new OperationResult(true, message, null);
    }

    public static OperationResult okWithWarning(String message, String warning) {
        return new OperationResult(true, message, warning);
    }

    public static OperationResult failure(String message) {
        return new OperationResult(false, message, null);
    }

    public boolean hasWarning() {
        return warning != null;
    }

    public Optional<String> warningText() {
        return Optional.ofNullable(warning);
    }
}
