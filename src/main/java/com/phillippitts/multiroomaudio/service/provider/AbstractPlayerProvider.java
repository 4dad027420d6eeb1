package com.phillippitts.multiroomaudio.service.provider;

import com.phillippitts.multiroomaudio.domain.OperationResult;
import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.service.audio.AudioDeviceService;
import com.phillippitts.multiroomaudio.util.BinaryLocator;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Base class for providers, implementing the checks and derivations all backends share.
 *
 * <p><b>Template Method:</b> {@link #validateConfig(PlayerConfig)} runs the common range and
 * address checks, then {@link #validateBackend(PlayerConfig)}; {@link #prepareConfig(PlayerConfig)}
 * derives the hardware address, then calls {@link #prepareBackend(PlayerConfig)}.
 *
 * <p>Fallback handling is shared too: a subclass names its {@link #fallbackDevice()} and the
 * fallback command is the primary command built for that device.
 */
public abstract class AbstractPlayerProvider implements PlayerProvider {

    /** Extra field naming the ALSA mixer control a player's volume is applied to. */
    public static final String MIXER_CONTROL = "mixerControl";

    protected final BinaryLocator binaryLocator;
    protected final AudioDeviceService audioDevices;

    protected AbstractPlayerProvider(BinaryLocator binaryLocator, AudioDeviceService audioDevices) {
        this.binaryLocator = Objects.requireNonNull(binaryLocator, "binaryLocator");
        this.audioDevices = Objects.requireNonNull(audioDevices, "audioDevices");
    }

    @Override
    public boolean isAvailable() {
        return binaryLocator.isAvailable(binaryName());
    }

    @Override
    public final Optional<String> validateConfig(PlayerConfig config) {
        Integer volume = config.volumePercent();
        if (volume != null && (volume < PlayerConfig.MIN_VOLUME || volume > PlayerConfig.MAX_VOLUME)) {
            return Optional.of("Volume must be between 0 and 100");
        }
        if (config.delayMs() < PlayerConfig.MIN_DELAY_MS || config.delayMs() > PlayerConfig.MAX_DELAY_MS) {
            return Optional.of("delay_ms must be between -1000 and 1000");
        }
        if (!config.hardwareAddress().isEmpty() && !HardwareIdentifiers.isValidMac(config.hardwareAddress())) {
            return Optional.of("Invalid MAC address: " + config.hardwareAddress());
        }
        return validateBackend(config);
    }

    /** Backend-specific required fields. */
    protected abstract Optional<String> validateBackend(PlayerConfig config);

    @Override
    public final PlayerConfig prepareConfig(PlayerConfig config) {
        PlayerConfig prepared = config;
        if (prepared.hardwareAddress().isEmpty()) {
            prepared = prepared.withHardwareAddress(HardwareIdentifiers.generateMac(prepared.name()));
        }
        return prepareBackend(prepared);
    }

    /** Hook for backend-specific derived fields; the default derives nothing. */
    protected PlayerConfig prepareBackend(PlayerConfig config) {
        return config;
    }

    /** Device used by the fallback command. */
    protected abstract String fallbackDevice();

    /** Device the primary command actually opens; subclasses that substitute a blank device override this. */
    protected String effectiveDevice(PlayerConfig config) {
        return config.device();
    }

    @Override
    public boolean supportsFallback() {
        return true;
    }

    @Override
    public List<String> buildFallbackCommand(PlayerConfig config, Path logPath) {
        if (!supportsFallback() || fallbackDevice().equals(effectiveDevice(config))) {
            return List.of();
        }
        return buildCommand(config.withDevice(fallbackDevice()), logPath);
    }

    /** Mixer control of the player; blank lets the device service use its default. */
    protected String mixerControl(PlayerConfig config) {
        return config.extra(MIXER_CONTROL, "");
    }

    /** Reads the hardware mixer of the player's device. */
    protected OptionalInt mixerVolume(PlayerConfig config) {
        return audioDevices.getVolume(effectiveDevice(config), mixerControl(config));
    }

    /** Writes the hardware mixer of the player's device. */
    protected OperationResult setMixerVolume(PlayerConfig config, int percent) {
        return audioDevices.setVolume(effectiveDevice(config), percent, mixerControl(config));
    }

    /** Parses an integer extra field; empty when absent, error text via the exception. */
    protected static Optional<Integer> intExtra(PlayerConfig config, String key) {
        Object value = config.extras().get(key);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(n.intValue());
        }
        return Optional.of(Integer.parseInt(value.toString().trim()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + type() + "]";
    }
}
