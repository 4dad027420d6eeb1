package com.phillippitts.multiroomaudio.domain;

/**
 * An output as listed by {@code sendspin --list-audio-devices}, or a PulseAudio sink standing in
 * for one.
 *
 * @param index device index (or sink index) as printed by the tool
 * @param name  device name; for PulseAudio sinks the sink name sendspin accepts
 * @param raw   the line the entry was parsed from
 * @param type  {@code portaudio} or {@code pulseaudio}
 */
public record PortAudioDevice(String index, String name, String raw, String type) {

    public static final String PORTAUDIO = "portaudio";
    public static final String PULSEAUDIO = "pulseaudio";

    public boolean isPulseAudio() {
        return PULSEAUDIO.equals(type);
    }
}
