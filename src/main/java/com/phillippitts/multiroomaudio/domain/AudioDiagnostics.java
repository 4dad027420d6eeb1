package com.phillippitts.multiroomaudio.domain;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of what the ALSA tooling reports on this host, for troubleshooting device detection.
 *
 * @param detectedDevices   devices as returned by the regular device listing
 * @param aplayAvailable    whether {@code aplay -l} ran successfully
 * @param aplayOutput       its output, or the error text
 * @param amixerAvailable   whether a bare {@code amixer} ran successfully
 * @param amixerCardsOutput its output, or the error text
 * @param mixerControls     mixer controls per {@code hw:} device
 */
public record AudioDiagnostics(List<AudioDevice> detectedDevices,
                               boolean aplayAvailable, String aplayOutput,
                               boolean amixerAvailable, String amixerCardsOutput,
                               Map<String, List<String>> mixerControls) {
}
