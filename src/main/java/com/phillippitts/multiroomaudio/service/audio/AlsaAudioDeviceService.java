package com.phillippitts.multiroomaudio.service.audio;

import com.phillippitts.multiroomaudio.config.properties.AudioProperties;
import com.phillippitts.multiroomaudio.domain.AudioDevice;
import com.phillippitts.multiroomaudio.domain.AudioDiagnostics;
import com.phillippitts.multiroomaudio.domain.OperationResult;
import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.domain.PortAudioDevice;
import com.phillippitts.multiroomaudio.domain.PortAudioListing;
import com.phillippitts.multiroomaudio.exception.DeviceCommandException;
import com.phillippitts.multiroomaudio.service.process.CommandResult;
import com.phillippitts.multiroomaudio.service.process.CommandRunner;
import com.phillippitts.multiroomaudio.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link AudioDeviceService} driving the ALSA command-line tools.
 *
 * <ul>
 *   <li>devices: {@code aplay -l}</li>
 *   <li>mixer controls: {@code amixer -c <card> scontrols}</li>
 *   <li>volume: {@code amixer -c <card> sget|sset <control> [N%]}</li>
 *   <li>test tone: {@code speaker-test -D <device> -c 2 -t sine -l 1}</li>
 *   <li>sendspin outputs: {@code sendspin --list-audio-devices}, optionally falling back to
 *       {@code pactl list sinks short}</li>
 * </ul>
 *
 * <p>Device and control names are checked against a conservative character set before they
 * reach a command line.
 */
public class AlsaAudioDeviceService implements AudioDeviceService {

    private static final Logger LOG = LogManager.getLogger(AlsaAudioDeviceService.class);

    static final String DEFAULT_DEVICE = "default";
    static final String NULL_DEVICE = "null";

    private static final Pattern DEVICE_ID = Pattern.compile("^[A-Za-z0-9_:,=.\\-]+$");
    private static final Pattern CONTROL_NAME = Pattern.compile("^[A-Za-z0-9 _.\\-]+$");
    private static final Pattern HW_CARD = Pattern.compile("^(?:plug)?hw:(?:CARD=)?([^,]+)");
    private static final int ERROR_TAIL_CHARS = 200;

    static final String PORTAUDIO_NOTE = "Use device index (0, 1, 2) with --audio-device for sendspin";
    static final String PULSEAUDIO_NOTE = "Using PulseAudio sinks. Use sink name with sendspin on HAOS.";

    private final CommandRunner runner;
    private final Duration commandTimeout;
    private final Duration testToneTimeout;
    private final String defaultControl;
    private final Duration deviceListTimeout;
    private final boolean pulseaudioFallback;

    public AlsaAudioDeviceService(CommandRunner runner, AudioProperties props) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.commandTimeout = props.getCommandTimeout();
        this.testToneTimeout = props.getTestToneDuration();
        this.defaultControl = props.getDefaultMixerControl();
        this.deviceListTimeout = props.getDeviceListTimeout();
        this.pulseaudioFallback = props.isPulseaudioFallback();
    }

    @Override
    public List<AudioDevice> getDevices() {
        List<AudioDevice> devices = new ArrayList<>();
        devices.add(new AudioDevice(DEFAULT_DEVICE, "Default audio device"));
        devices.add(new AudioDevice(NULL_DEVICE, "Null output (no sound)"));
        try {
            CommandResult result = runner.run(List.of("aplay", "-l"), commandTimeout);
            if (result.succeeded()) {
                devices.addAll(AlsaOutputParser.parseAplayDevices(result.stdout()));
            } else {
                LOG.warn("aplay -l failed: {}", LogSanitizer.tail(result.errorText(), ERROR_TAIL_CHARS));
            }
        } catch (DeviceCommandException e) {
            LOG.warn("Cannot enumerate ALSA devices: {}", e.getMessage());
        }
        LOG.debug("Found {} audio device(s)", devices.size());
        return devices;
    }

    @Override
    public List<String> getMixerControls(String deviceId) {
        if (!isValidDevice(deviceId) || NULL_DEVICE.equals(deviceId)) {
            return List.of();
        }
        List<String> cmd = amixer(deviceId);
        cmd.add("scontrols");
        try {
            CommandResult result = runner.run(cmd, commandTimeout);
            if (result.succeeded()) {
                return AlsaOutputParser.parseMixerControls(result.stdout());
            }
            LOG.warn("Listing mixer controls of {} failed: {}", deviceId,
                    LogSanitizer.tail(result.errorText(), ERROR_TAIL_CHARS));
        } catch (DeviceCommandException e) {
            LOG.warn("Cannot list mixer controls of {}: {}", deviceId, e.getMessage());
        }
        return List.of();
    }

    @Override
    public OptionalInt getVolume(String device, String control) {
        String ctl = controlOrDefault(control);
        if (!isValidDevice(device) || NULL_DEVICE.equals(device) || !isValidControl(ctl)) {
            return OptionalInt.empty();
        }
        List<String> cmd = amixer(device);
        cmd.add("sget");
        cmd.add(ctl);
        try {
            CommandResult result = runner.run(cmd, commandTimeout);
            if (result.succeeded()) {
                OptionalInt percent = AlsaOutputParser.parseVolumePercent(result.stdout());
                if (percent.isPresent()) {
                    return percent;
                }
                LOG.debug("No volume reported for {} '{}'", device, ctl);
            } else {
                LOG.debug("amixer sget {} on {} failed: {}", ctl, device,
                        LogSanitizer.tail(result.errorText(), ERROR_TAIL_CHARS));
            }
        } catch (DeviceCommandException e) {
            LOG.warn("Cannot read volume of {}: {}", device, e.getMessage());
        }
        return OptionalInt.empty();
    }

    @Override
    public OperationResult setVolume(String device, int percent, String control) {
        if (percent < PlayerConfig.MIN_VOLUME || percent > PlayerConfig.MAX_VOLUME) {
            return OperationResult.failure("Volume must be between 0 and 100");
        }
        String ctl = controlOrDefault(control);
        if (!isValidDevice(device)) {
            return OperationResult.failure("Invalid device identifier: " + device);
        }
        if (NULL_DEVICE.equals(device)) {
            return OperationResult.failure("Device 'null' has no mixer");
        }
        if (!isValidControl(ctl)) {
            return OperationResult.failure("Invalid mixer control: " + ctl);
        }
        List<String> cmd = amixer(device);
        cmd.add("sset");
        cmd.add(ctl);
        cmd.add(percent + "%");
        try {
            CommandResult result = runner.run(cmd, commandTimeout);
            if (result.succeeded()) {
                LOG.info("Set {} '{}' to {}%", device, ctl, percent);
                return OperationResult.ok("Volume set to " + percent + "%");
            }
            String error = LogSanitizer.tail(result.errorText(), ERROR_TAIL_CHARS);
            LOG.warn("amixer sset {} on {} failed: {}", ctl, device, error);
            return OperationResult.failure("Failed to set volume: " + error);
        } catch (DeviceCommandException e) {
            LOG.warn("Cannot set volume of {}: {}", device, e.getMessage());
            return OperationResult.failure("Failed to set volume: " + e.getMessage());
        }
    }

    @Override
    public OperationResult playTestTone(String device) {
        if (!isValidDevice(device)) {
            return OperationResult.failure("Invalid device identifier: " + device);
        }
        List<String> cmd = List.of("speaker-test", "-D", device, "-c", "2", "-t", "sine", "-f", "440", "-l", "1");
        try {
            CommandResult result = runner.run(cmd, testToneTimeout);
            if (result.succeeded()) {
                return OperationResult.ok("Test tone played on " + device);
            }
            if (result.timedOut()) {
                return OperationResult.failure("Test tone on " + device + " timed out");
            }
            return OperationResult.failure("Test tone failed: "
                    + LogSanitizer.tail(result.errorText(), ERROR_TAIL_CHARS));
        } catch (DeviceCommandException e) {
            LOG.warn("Cannot play test tone on {}: {}", device, e.getMessage());
            return OperationResult.failure("Test tone failed: " + e.getMessage());
        }
    }

    @Override
    public PortAudioListing getPortAudioDevices() {
        CommandResult result;
        try {
            result = runner.run(List.of("sendspin", "--list-audio-devices"), deviceListTimeout);
        } catch (DeviceCommandException e) {
            LOG.error("sendspin binary not found: {}", e.getMessage());
            return PortAudioListing.failure("sendspin binary not found");
        }
        if (result.timedOut()) {
            LOG.error("Timeout running sendspin --list-audio-devices");
            return PortAudioListing.failure("Timeout listing audio devices");
        }
        String stdout = result.stdout() == null ? "" : result.stdout();
        String stderr = result.stderr() == null ? "" : result.stderr();
        LOG.debug("sendspin --list-audio-devices stdout: {}", LogSanitizer.tail(stdout, ERROR_TAIL_CHARS));
        if (!stderr.isBlank()) {
            LOG.warn("sendspin --list-audio-devices stderr: {}", LogSanitizer.tail(stderr, ERROR_TAIL_CHARS));
        }

        // Some sendspin versions print the listing on stderr
        List<PortAudioDevice> devices = AlsaOutputParser.parseIndexedDevices(stdout);
        if (devices.isEmpty()) {
            devices = AlsaOutputParser.parseIndexedDevices(stderr);
        }
        if (devices.isEmpty() && pulseaudioFallback) {
            LOG.info("No PortAudio devices found, falling back to PulseAudio sinks");
            devices = pulseSinks();
        }

        if (devices.isEmpty() && !stderr.isBlank()) {
            return new PortAudioListing(false, devices, stdout, stderr, PORTAUDIO_NOTE, null,
                    "No devices found. Check stderr for errors.");
        }
        boolean pulse = devices.stream().anyMatch(PortAudioDevice::isPulseAudio);
        return new PortAudioListing(true, devices, stdout, null,
                pulse ? PULSEAUDIO_NOTE : PORTAUDIO_NOTE, pulse ? PortAudioDevice.PULSEAUDIO : null, null);
    }

    private List<PortAudioDevice> pulseSinks() {
        try {
            CommandResult result = runner.run(List.of("pactl", "list", "sinks", "short"), deviceListTimeout);
            if (!result.succeeded()) {
                LOG.warn("pactl list sinks failed: {}", LogSanitizer.tail(result.errorText(), ERROR_TAIL_CHARS));
                return List.of();
            }
            List<PortAudioDevice> sinks = AlsaOutputParser.parsePulseSinks(result.stdout());
            LOG.info("Found {} PulseAudio sink(s) as fallback", sinks.size());
            return sinks;
        } catch (DeviceCommandException e) {
            LOG.warn("Failed to get PulseAudio sinks as fallback: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public AudioDiagnostics diagnostics() {
        List<AudioDevice> detected = getDevices();
        ToolRun aplay = runTool(List.of("aplay", "-l"));
        ToolRun amixer = runTool(List.of("amixer"));
        Map<String, List<String>> controls = new LinkedHashMap<>();
        for (AudioDevice device : detected) {
            if (device.id().startsWith("hw:")) {
                controls.put(device.id(), getMixerControls(device.id()));
            }
        }
        return new AudioDiagnostics(detected, aplay.available(), aplay.output(),
                amixer.available(), amixer.output(), controls);
    }

    private ToolRun runTool(List<String> cmd) {
        try {
            CommandResult result = runner.run(cmd, commandTimeout);
            if (result.succeeded()) {
                return new ToolRun(true, result.stdout());
            }
            return new ToolRun(false, result.errorText());
        } catch (DeviceCommandException e) {
            LOG.debug("{} unavailable: {}", cmd.get(0), e.getMessage());
            return new ToolRun(false, e.getMessage());
        }
    }

    private record ToolRun(boolean available, String output) {
    }

    /** amixer invocation addressing the card behind {@code device}. */
    static List<String> amixer(String device) {
        List<String> cmd = new ArrayList<>();
        cmd.add("amixer");
        if (DEFAULT_DEVICE.equals(device)) {
            return cmd;
        }
        Matcher hw = HW_CARD.matcher(device);
        if (hw.find()) {
            cmd.add("-c");
            cmd.add(hw.group(1));
        } else {
            cmd.add("-D");
            cmd.add(device);
        }
        return cmd;
    }

    private String controlOrDefault(String control) {
        return control == null || control.isBlank() ? defaultControl : control.trim();
    }

    static boolean isValidDevice(String device) {
        return device != null && DEVICE_ID.matcher(device).matches();
    }

    private static boolean isValidControl(String control) {
        return CONTROL_NAME.matcher(control).matches();
    }
}
