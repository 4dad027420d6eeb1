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
 * Snapcast multi-room client.
 *
 * <p>CLI contract:
 * <pre>
 * snapclient --host ${server} --hostID ${clientId} --soundcard ${device} --logsink file:${log}
 *            [--latency ${latencyMs}]
 * </pre>
 */
public final class SnapcastProvider extends AbstractPlayerProvider {

    /** Extra field with the soundcard latency in milliseconds. */
    public static final String LATENCY_MS = "latencyMs";

    static final String FALLBACK_DEVICE = "default";
    static final String CLIENT_ID_PREFIX = "snapcast";

    public SnapcastProvider(BinaryLocator binaryLocator, AudioDeviceService audioDevices) {
        super(binaryLocator, audioDevices);
    }

    @Override
    public String type() {
        return ProviderTypes.SNAPCAST;
    }

    @Override
    public String displayName() {
        return "Snapcast";
    }

    @Override
    public String description() {
        return "Synchronous multi-room audio client";
    }

    @Override
    public String binaryName() {
        return "snapclient";
    }

    @Override
    protected Optional<String> validateBackend(PlayerConfig config) {
        if (config.serverAddress().isEmpty()) {
            return Optional.of("Server address is required for Snapcast");
        }
        try {
            Optional<Integer> latency = intExtra(config, LATENCY_MS);
            if (latency.isPresent() && latency.get() < 0) {
                return Optional.of("latencyMs must not be negative");
            }
        } catch (NumberFormatException e) {
            return Optional.of("latencyMs must be an integer");
        }
        return Optional.empty();
    }

    @Override
    protected PlayerConfig prepareBackend(PlayerConfig config) {
        if (!config.clientId().isEmpty()) {
            return config;
        }
        return config.withClientId(HardwareIdentifiers.generateClientId(CLIENT_ID_PREFIX, config.name()));
    }

    @Override
    public List<String> buildCommand(PlayerConfig config, Path logPath) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binaryName());
        cmd.add("--host");
        cmd.add(config.serverAddress());
        cmd.add("--hostID");
        cmd.add(config.clientId());
        cmd.add("--soundcard");
        cmd.add(effectiveDevice(config));
        cmd.add("--logsink");
        cmd.add("file:" + logPath);
        intExtra(config, LATENCY_MS).ifPresent(latency -> {
            cmd.add("--latency");
            cmd.add(String.valueOf(latency));
        });
        return cmd;
    }

    @Override
    protected String fallbackDevice() {
        return FALLBACK_DEVICE;
    }

    @Override
    protected String effectiveDevice(PlayerConfig config) {
        return config.device().isEmpty() ? FALLBACK_DEVICE : config.device();
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
