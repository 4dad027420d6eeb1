package com.phillippitts.multiroomaudio.domain;

/**
 * An audio output sink as reported by the device service.
 *
 * @param id   identifier passed to players (e.g. {@code hw:1,0}, {@code default})
 * @param name human-readable name
 */
public record AudioDevice(String id, String name) {
}
