package com.phillippitts.multiroomaudio.service.status.event;

import java.time.Instant;

/**
 * Published when a player process exited without being stopped.
 *
 * @param name     player name
 * @param detectedAt when the status monitor reaped the process
 */
public record PlayerProcessExitedEvent(String name, Instant detectedAt) {
}
