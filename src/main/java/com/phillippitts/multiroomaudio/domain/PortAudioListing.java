package com.phillippitts.multiroomaudio.domain;

import java.util.List;

/**
 * Result of listing the outputs sendspin can address.
 *
 * @param success   whether at least a usable listing was obtained
 * @param devices   parsed entries, possibly empty
 * @param rawOutput stdout of the listing command, {@code null} if it never ran
 * @param stderr    stderr of the listing command when nothing was found, otherwise {@code null}
 * @param note      usage hint for the listed identifiers, {@code null} on failure
 * @param fallback  {@code pulseaudio} when the entries are PulseAudio sinks, otherwise {@code null}
 * @param message   failure description, otherwise {@code null}
 */
public record PortAudioListing(boolean success, List<PortAudioDevice> devices, String rawOutput,
                               String stderr, String note, String fallback, String message) {

    public PortAudioListing {
        devices = devices == null ? List.of() : List.copyOf(devices);
    }

    public static PortAudioListing failure(String message) {
        return new PortAudioListing(false, List.of(), null, null, null, null, message);
    }
}
