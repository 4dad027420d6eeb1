package com.phillippitts.multiroomaudio.service.audio;

import com.phillippitts.multiroomaudio.domain.AudioDevice;
import com.phillippitts.multiroomaudio.domain.AudioDiagnostics;
import com.phillippitts.multiroomaudio.domain.OperationResult;
import com.phillippitts.multiroomaudio.domain.PortAudioListing;

import java.util.List;
import java.util.OptionalInt;

/**
 * Enumerates audio outputs and reads or writes hardware mixer volume.
 *
 * <p>Implementations never throw for tool failures: listing operations return what could be
 * determined and mutating operations report failure in their {@link OperationResult}.
 */
public interface AudioDeviceService {

    /** Output devices, always including the virtual {@code default} and {@code null} sinks. */
    List<AudioDevice> getDevices();

    /** Simple mixer control names of the card behind {@code deviceId}; empty if unknown. */
    List<String> getMixerControls(String deviceId);

    /**
     * Current volume percentage of {@code control} on {@code device}; empty when the mixer cannot
     * be read.
     */
    OptionalInt getVolume(String device, String control);

    OperationResult setVolume(String device, int percent, String control);

    /** Plays a short test tone on {@code device}. */
    OperationResult playTestTone(String device);

    /**
     * Outputs sendspin can address, as listed by {@code sendspin --list-audio-devices}; failures
     * are reported in the listing, never thrown.
     */
    PortAudioListing getPortAudioDevices();

    /** Raw tool output and detection results for troubleshooting. */
    AudioDiagnostics diagnostics();
}
