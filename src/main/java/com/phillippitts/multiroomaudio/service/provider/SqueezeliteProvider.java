package com.phillippitts.multiroomaudio.service.provider;

import com.phillippitts.multiroomaudio.domain.OperationResult;
import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.service.audio.AudioDeviceService;
import com.phillippitts.multiroomaudio.util.BinaryLocator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Logitech Media Server compatible player.
 *
 * <p>CLI contract:
 * <pre>
 * squeezelite -n ${name} -o ${device} -m ${mac} [-s ${server}] -f ${log} [-V ${mixerControl}]
 * </pre>
 * Without {@code -s} squeezelite discovers the server on the local network. The fallback runs
 * against the {@code null} output so the player at least registers with the server.
 */
public final class SqueezeliteProvider extends AbstractPlayerProvider {

    static final String FALLBACK_DEVICE = "null";

    public SqueezeliteProvider(BinaryLocator binaryLocator, AudioDeviceService audioDevices) {
        super(binaryLocator, audioDevices);
    }

    @Override
    public String type() {
        return ProviderTypes.SQUEEZELITE;
    }

    @Override
    public String displayName() {
        return "Squeezelite";
    }

    @Override
    public String description() {
        return "Logitech Media Server compatible player";
    }

    @Override
    public String binaryName() {
        return "squeezelite";
    }

    @Override
    protected Optional<String> validateBackend(PlayerConfig config) {
        if (config.device().isEmpty()) {
            return Optional.of("Device is required for Squeezelite");
        }
        return Optional.empty();
    }

    @Override
    public List<String> buildCommand(PlayerConfig config, Path logPath) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binaryName());
        cmd.add("-n");
        cmd.add(config.name());
        cmd.add("-o");
        cmd.add(config.device());
        cmd.add("-m");
        cmd.add(config.hardwareAddress());
        if (!config.serverAddress().isEmpty()) {
            cmd.add("-s");
            cmd.add(config.serverAddress());
        }
        cmd.add("-f");
        cmd.add(logPath.toString());
        String mixer = config.extra(MIXER_CONTROL, "");
        if (!mixer.isEmpty()) {
            cmd.add("-V");
            cmd.add(mixer);
        }
        return cmd;
    }

    @Override
    protected String fallbackDevice() {
        return FALLBACK_DEVICE;
    }

    @Override
    public OptionalInt getVolume(PlayerConfig config) {
        return mixerVolume(config);
    }

    @Override
    public OperationResult setVolume(PlayerConfig config, int percent) {
        return setMixerVolume(config, percent);
    }
}
