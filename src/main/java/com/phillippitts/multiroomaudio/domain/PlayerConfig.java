package com.phillippitts.multiroomaudio.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable declarative configuration of one room player.
 *
 * <p>Instances are never mutated in place: providers and the orchestrator derive new
 * configurations through the {@code with*} methods, so a configuration read from the store
 * can be handed to a provider without aliasing concerns.
 *
 * @param name            unique player name, also the process key
 * @param device          backend-specific audio sink identifier (e.g. {@code hw:0,0})
 * @param providerType    provider type name; blank means the default provider
 * @param serverAddress   upstream server host/IP (squeezelite, snapcast)
 * @param serverUrl       upstream server URL (sendspin)
 * @param hardwareAddress stable pseudo-MAC address, derived when blank
 * @param clientId        session identifier for providers that need one
 * @param enabled         whether the player is enabled
 * @param volumePercent   last desired volume (0-100), {@code null} until known
 * @param delayMs         sync offset in milliseconds, applied on next start
 * @param extras          provider-specific fields
 */
public record PlayerConfig(
        String name,
        String device,
        String providerType,
        String serverAddress,
        String serverUrl,
        String hardwareAddress,
        String clientId,
        boolean enabled,
        Integer volumePercent,
        int delayMs,
        Map<String, Object> extras
) {

    public static final int DEFAULT_VOLUME = 75;
    public static final int MIN_VOLUME = 0;
    public static final int MAX_VOLUME = 100;
    public static final int MIN_DELAY_MS = -1000;
    public static final int MAX_DELAY_MS = 1000;

    public PlayerConfig {
        Objects.requireNonNull(name, "Player name must not be null");
        device = blankToEmpty(device);
        providerType = blankToEmpty(providerType);
        serverAddress = blankToEmpty(serverAddress);
        serverUrl = blankToEmpty(serverUrl);
        hardwareAddress = blankToEmpty(hardwareAddress);
        clientId = blankToEmpty(clientId);
        extras = extras == null || extras.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public PlayerConfig withName(String newName) {
        return new PlayerConfig(newName, device, providerType, serverAddress, serverUrl,
                hardwareAddress, clientId, enabled, volumePercent, delayMs, extras);
    }

    public PlayerConfig withDevice(String newDevice) {
        return new PlayerConfig(name, newDevice, providerType, serverAddress, serverUrl,
                hardwareAddress, clientId, enabled, volumePercent, delayMs, extras);
    }

    public PlayerConfig withProviderType(String newProviderType) {
        return new PlayerConfig(name, device, newProviderType, serverAddress, serverUrl,
                hardwareAddress, clientId, enabled, volumePercent, delayMs, extras);
    }

    public PlayerConfig withServerAddress(String newServerAddress) {
        return new PlayerConfig(name, device, providerType, newServerAddress, serverUrl,
                hardwareAddress, clientId, enabled, volumePercent, delayMs, extras);
    }

    public PlayerConfig withServerUrl(String newServerUrl) {
        return new PlayerConfig(name, device, providerType, serverAddress, newServerUrl,
                hardwareAddress, clientId, enabled, volumePercent, delayMs, extras);
    }

    public PlayerConfig withHardwareAddress(String newHardwareAddress) {
        return new PlayerConfig(name, device, providerType, serverAddress, serverUrl,
                newHardwareAddress, clientId, enabled, volumePercent, delayMs, extras);
    }

    public PlayerConfig withClientId(String newClientId) {
        return new PlayerConfig(name, device, providerType, serverAddress, serverUrl,
                hardwareAddress, newClientId, enabled, volumePercent, delayMs, extras);
    }

    public PlayerConfig withVolumePercent(Integer newVolumePercent) {
        return new PlayerConfig(name, device, providerType, serverAddress, serverUrl,
                hardwareAddress, clientId, enabled, newVolumePercent, delayMs, extras);
    }

    public PlayerConfig withDelayMs(int newDelayMs) {
        return new PlayerConfig(name, device, providerType, serverAddress, serverUrl,
                hardwareAddress, clientId, enabled, volumePercent, newDelayMs, extras);
    }

    /**
     * Returns a copy whose extras are this config's extras overlaid with {@code overrides}.
     */
    public PlayerConfig withExtras(Map<String, Object> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(extras);
        merged.putAll(overrides);
        return new PlayerConfig(name, device, providerType, serverAddress, serverUrl,
                hardwareAddress, clientId, enabled, volumePercent, delayMs, merged);
    }

    /**
     * Reads a provider-specific string field, falling back to {@code defaultValue} when absent or blank.
     */
    public String extra(String key, String defaultValue) {
        Object value = extras.get(key);
        if (value == null || value.toString().isBlank()) {
            return defaultValue;
        }
        return value.toString();
    }

    /** Stored volume, or {@link #DEFAULT_VOLUME} when none has been recorded yet. */
    public int volumeOrDefault() {
        return volumePercent == null ? DEFAULT_VOLUME : volumePercent;
    }

    private static String blankToEmpty(String s) {
        return s == null || s.isBlank() ? "" : s.trim();
    }

    /**
     * Builder for new player configurations. Defaults: enabled, no stored volume, zero delay.
     */
    public static final class Builder {
        private final String name;
        private String device = "";
        private String providerType = "";
        private String serverAddress = "";
        private String serverUrl = "";
        private String hardwareAddress = "";
        private String clientId = "";
        private boolean enabled = true;
        private Integer volumePercent;
        private int delayMs;
        private final Map<String, Object> extras = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder device(String device) {
            this.device = device;
            return this;
        }

        public Builder providerType(String providerType) {
            this.providerType = providerType;
            return this;
        }

        public Builder serverAddress(String serverAddress) {
            this.serverAddress = serverAddress;
            return this;
        }

        public Builder serverUrl(String serverUrl) {
            this.serverUrl = serverUrl;
            return this;
        }

        public Builder hardwareAddress(String hardwareAddress) {
            this.hardwareAddress = hardwareAddress;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder volumePercent(Integer volumePercent) {
            this.volumePercent = volumePercent;
            return this;
        }

        public Builder delayMs(int delayMs) {
            this.delayMs = delayMs;
            return this;
        }

        public Builder extras(Map<String, Object> extras) {
            if (extras != null) {
                this.extras.putAll(extras);
            }
            return this;
        }

        public PlayerConfig build() {
            return new PlayerConfig(name, device, providerType, serverAddress, serverUrl,
                    hardwareAddress, clientId, enabled, volumePercent, delayMs, extras);
        }
    }
}
