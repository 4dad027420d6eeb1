package com.phillippitts.multiroomaudio.exception;

import java.util.List;

/**
 * Thrown when an external device tool (aplay, amixer, kill, ...) cannot be run at all.
 * A tool that runs and exits non-zero is reported through its result, not this exception.
 */
public class DeviceCommandException extends MultiRoomAudioException {

    private final String command;

    public DeviceCommandException(List<String> command, Throwable cause) {
        super("Failed to run '" + String.join(" ", command) + "': " + cause.getMessage(), cause);
        this.command = command.isEmpty() ? "" : command.get(0);
    }

    public String getCommand() {
        return command;
    }
}
