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
 * Music Assistant synchronized stream client.
 *
 * <p>CLI contract:
 * <pre>
 * sendspin --url ${serverUrl} --name ${name} --id ${clientId} --audio-device ${device}
 *          [--static-delay-ms ${delayMs}]
 * </pre>
 * Volume is controlled by the server over the stream protocol, so this provider has no
 * hardware volume: it reports the stored value and accepts every change.
 */
public final class SendspinProvider extends AbstractPlayerProvider {

    static final String FALLBACK_DEVICE = "default";
    static final String CLIENT_ID_PREFIX = "sendspin";

    public SendspinProvider(BinaryLocator binaryLocator, AudioDeviceService audioDevices) {
        super(binaryLocator, audioDevices);
    }

    @Override
    public String type() {
        return ProviderTypes.SENDSPIN;
    }

    @Override
    public String displayName() {
        return "Sendspin";
    }

    @Override
    public String description() {
        return "Music Assistant synchronized audio protocol";
    }

    @Override
    public String binaryName() {
        return "sendspin";
    }

    @Override
    protected Optional<String> validateBackend(PlayerConfig config) {
        String url = config.serverUrl();
        if (url.isEmpty()) {
            return Optional.of("Server URL is required for Sendspin");
        }
        if (!url.startsWith("ws://") && !url.startsWith("wss://")) {
            return Optional.of("Server URL must start with ws:// or wss://");
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
        cmd.add("--url");
        cmd.add(config.serverUrl());
        cmd.add("--name");
        cmd.add(config.name());
        cmd.add("--id");
        cmd.add(config.clientId());
        cmd.add("--audio-device");
        cmd.add(effectiveDevice(config));
        if (config.delayMs() != 0) {
            cmd.add("--static-delay-ms");
            cmd.add(String.valueOf(config.delayMs()));
        }
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
        // No mixer of its own: the stored value is all there is
        Integer stored = config.volumePercent();
        return stored == null ? OptionalInt.empty() : OptionalInt.of(stored);
    }

    @Override
    public OperationResult setVolume(PlayerConfig config, int percent) {
        return OperationResult.ok("Volume set to " + percent + "%");
    }
}
