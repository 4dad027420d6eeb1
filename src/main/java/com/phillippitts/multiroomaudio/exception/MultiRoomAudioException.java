package com.phillippitts.multiroomaudio.exception;

/**
 * Base exception for all multi-room audio application errors.
 * Domain exceptions extend this class to enable centralized error handling.
 */
public class MultiRoomAudioException extends RuntimeException {

    public MultiRoomAudioException(String message) {
        super(message);
    }

    public MultiRoomAudioException(String message, Throwable cause) {
        super(message, cause);
    }

    public MultiRoomAudioException(Throwable cause) {
        super(cause);
    }
}
