package com.phillippitts.multiroomaudio.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Converts {@link PlayerConfig} to and from the flat key-value form used in {@code players.yaml}
 * and in API responses.
 *
 * <p>Keys not in {@link #KNOWN_FIELDS} round-trip through {@link PlayerConfig#extras()}.
 */
public final class PlayerConfigMapper {

    public static final String NAME = "name";
    public static final String DEVICE = "device";
    public static final String PROVIDER = "provider";
    public static final String SERVER_IP = "server_ip";
    public static final String SERVER_URL = "server_url";
    public static final String MAC_ADDRESS = "mac_address";
    public static final String CLIENT_ID = "client_id";
    public static final String ENABLED = "enabled";
    public static final String VOLUME = "volume";
    public static final String DELAY_MS = "delay_ms";

    public static final Set<String> KNOWN_FIELDS = Set.of(
            NAME, DEVICE, PROVIDER, SERVER_IP, SERVER_URL, MAC_ADDRESS, CLIENT_ID, ENABLED, VOLUME, DELAY_MS);

    private PlayerConfigMapper() {
    }

    public static Map<String, Object> toMap(PlayerConfig config) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(NAME, config.name());
        map.put(DEVICE, config.device());
        map.put(PROVIDER, config.providerType());
        map.put(SERVER_IP, config.serverAddress());
        map.put(SERVER_URL, config.serverUrl());
        map.put(MAC_ADDRESS, config.hardwareAddress());
        if (!config.clientId().isEmpty()) {
            map.put(CLIENT_ID, config.clientId());
        }
        map.put(ENABLED, config.enabled());
        if (config.volumePercent() != null) {
            map.put(VOLUME, config.volumePercent());
        }
        map.put(DELAY_MS, config.delayMs());
        config.extras().forEach(map::putIfAbsent);
        return map;
    }

    /**
     * Builds a configuration from stored fields.
     *
     * @param name   the key the record is stored under; wins over a {@code name} field
     * @param fields stored fields (may be {@code null})
     * @throws IllegalArgumentException if a numeric field holds a non-numeric value
     */
    public static PlayerConfig fromMap(String name, Map<String, ?> fields) {
        Map<String, ?> f = fields == null ? Map.of() : fields;
        Map<String, Object> extras = new LinkedHashMap<>();
        f.forEach((key, value) -> {
            if (!KNOWN_FIELDS.contains(key)) {
                extras.put(key, value);
            }
        });
        return PlayerConfig.builder(name)
                .device(string(f.get(DEVICE)))
                .providerType(string(f.get(PROVIDER)))
                .serverAddress(string(f.get(SERVER_IP)))
                .serverUrl(string(f.get(SERVER_URL)))
                .hardwareAddress(string(f.get(MAC_ADDRESS)))
                .clientId(string(f.get(CLIENT_ID)))
                .enabled(f.get(ENABLED) == null || Boolean.parseBoolean(f.get(ENABLED).toString()))
                .volumePercent(integerOrNull(VOLUME, f.get(VOLUME)))
                .delayMs(integerOrZero(DELAY_MS, f.get(DELAY_MS)))
                .extras(extras)
                .build();
    }

    private static String string(Object value) {
        return value == null ? "" : value.toString();
    }

    private static Integer integerOrNull(String field, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " must be an integer, got: " + value, e);
        }
    }

    private static int integerOrZero(String field, Object value) {
        Integer parsed = integerOrNull(field, value);
        return parsed == null ? 0 : parsed;
    }
}
