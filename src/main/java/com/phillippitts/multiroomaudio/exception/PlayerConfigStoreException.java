package com.phillippitts.multiroomaudio.exception;

import java.nio.file.Path;

/**
 * Thrown when player configuration cannot be read from or written to its backing file.
 */
public class PlayerConfigStoreException extends MultiRoomAudioException {

    private final Path path;

    public PlayerConfigStoreException(String message, Path path) {
        super(message + " (path: " + path + ")");
        this.path = path;
    }

    public PlayerConfigStoreException(String message, Path path, Throwable cause) {
        super(message + " (path: " + path + ")", cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
