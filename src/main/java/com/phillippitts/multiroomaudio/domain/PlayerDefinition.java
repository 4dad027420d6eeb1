package com.phillippitts.multiroomaudio.domain;

import java.util.Map;

/**
 * Caller-supplied description of a player for create and update requests.
 *
 * <p>On create, a blank {@code providerType} selects the default provider. On update, a blank
 * {@code providerType} or {@code hardwareAddress} keeps the stored value.
 *
 * @param name            player name (the new name on update)
 * @param device          audio device identifier; blank means {@code default}
 * @param providerType    provider type name
 * @param serverAddress   upstream server host/IP
 * @param serverUrl       upstream server URL
 * @param hardwareAddress pseudo-MAC address
 * @param extras          provider-specific fields merged into the stored configuration
 */
public record PlayerDefinition(
        String name,
        String device,
        String providerType,
        String serverAddress,
        String serverUrl,
        String hardwareAddress,
        Map<String, Object> extras
) {

    public static final String DEFAULT_DEVICE = "default";

    public PlayerDefinition {
        extras = extras == null ? Map.of() : extras;
    }

    public static PlayerDefinition of(String name, String device, String providerType) {
        return new PlayerDefinition(name, device, providerType, "", "", "", Map.of());
    }

    /** Device identifier with blank mapped to {@link #DEFAULT_DEVICE}. */
    public String deviceOrDefault() {
        return device == null || device.isBlank() ? DEFAULT_DEVICE : device.trim();
    }
}
