package com.phillippitts.multiroomaudio.service.audio;

import com.phillippitts.multiroomaudio.domain.AudioDevice;
import com.phillippitts.multiroomaudio.domain.PortAudioDevice;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the text output of {@code aplay -l}, {@code amixer}, {@code sendspin --list-audio-devices}
 * and {@code pactl list sinks short}.
 */
public final class AlsaOutputParser {

    // card 0: PCH [HDA Intel PCH], device 0: ALC892 Analog [ALC892 Analog]
    private static final Pattern APLAY_DEVICE = Pattern.compile(
            "^card (\\d+): [^\\[]*\\[([^\\]]*)\\], device (\\d+): [^\\[]*\\[([^\\]]*)\\]");

    // Simple mixer control 'Master',0
    private static final Pattern SIMPLE_CONTROL = Pattern.compile("^Simple mixer control '([^']+)',\\d+");

    // Front Left: Playback 49 [75%] [-19.50dB] [on]
    private static final Pattern PERCENT = Pattern.compile("\\[(\\d{1,3})%\\]");

    // [0] USB Audio Device
    private static final Pattern INDEXED_DEVICE = Pattern.compile("^\\[(\\d+)\\]\\s*(.+)$");

    private AlsaOutputParser() {
    }

    /** Hardware playback devices as {@code hw:<card>,<device>}. */
    public static List<AudioDevice> parseAplayDevices(String output) {
        List<AudioDevice> devices = new ArrayList<>();
        if (output == null) {
            return devices;
        }
        for (String line : output.split("\\R")) {
            Matcher m = APLAY_DEVICE.matcher(line.trim());
            if (m.find()) {
                String id = "hw:" + m.group(1) + "," + m.group(3);
                String name = m.group(2).trim() + " - " + m.group(4).trim();
                devices.add(new AudioDevice(id, name));
            }
        }
        return devices;
    }

    public static List<String> parseMixerControls(String output) {
        List<String> controls = new ArrayList<>();
        if (output == null) {
            return controls;
        }
        for (String line : output.split("\\R")) {
            Matcher m = SIMPLE_CONTROL.matcher(line.trim());
            if (m.find() && !controls.contains(m.group(1))) {
                controls.add(m.group(1));
            }
        }
        return controls;
    }

    /** First percentage in {@code amixer sget} output (the first channel). */
    public static OptionalInt parseVolumePercent(String output) {
        if (output == null) {
            return OptionalInt.empty();
        }
        Matcher m = PERCENT.matcher(output);
        if (!m.find()) {
            return OptionalInt.empty();
        }
        int value = Integer.parseInt(m.group(1));
        return OptionalInt.of(Math.max(0, Math.min(100, value)));
    }

    /** Entries of the form {@code [N] Name}, one per line. */
    public static List<PortAudioDevice> parseIndexedDevices(String output) {
        List<PortAudioDevice> devices = new ArrayList<>();
        if (output == null) {
            return devices;
        }
        for (String line : output.split("\\R")) {
            String trimmed = line.trim();
            Matcher m = INDEXED_DEVICE.matcher(trimmed);
            if (m.matches()) {
                devices.add(new PortAudioDevice(m.group(1), m.group(2).trim(), trimmed,
                        PortAudioDevice.PORTAUDIO));
            }
        }
        return devices;
    }

    /** Sinks from {@code pactl list sinks short}: tab-separated index, name, driver, format, state. */
    public static List<PortAudioDevice> parsePulseSinks(String output) {
        List<PortAudioDevice> sinks = new ArrayList<>();
        if (output == null) {
            return sinks;
        }
        for (String line : output.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            String[] parts = line.split("\t");
            if (parts.length >= 2 && !parts[1].isBlank()) {
                sinks.add(new PortAudioDevice(parts[0].trim(), parts[1].trim(), line,
                        PortAudioDevice.PULSEAUDIO));
            }
        }
        return sinks;
    }
}
