package com.phillippitts.multiroomaudio.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.multiroomaudio.domain.PlayerDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of {@code POST /api/players} and {@code PUT /api/players/{name}}.
 *
 * <p>Fields other than the named ones (e.g. {@code volume}, {@code latencyMs}) are collected
 * as provider-specific extras.
 */
public class PlayerRequest {

    private String name;
    private String device;
    private String provider;
    @JsonProperty("server_ip")
    private String serverIp;
    @JsonProperty("server_url")
    private String serverUrl;
    @JsonProperty("mac_address")
    private String macAddress;
    private final Map<String, Object> extras = new LinkedHashMap<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDevice() {
        return device;
    }

    public void setDevice(String device) {
        this.device = device;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getServerIp() {
        return serverIp;
    }

    public void setServerIp(String serverIp) {
        this.serverIp = serverIp;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public String getMacAddress() {
        return macAddress;
    }

    public void setMacAddress(String macAddress) {
        this.macAddress = macAddress;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    @JsonAnySetter
    public void setExtra(String key, Object value) {
        extras.put(key, value);
    }

    /**
     * @param fallbackName name to use when the body carries none (update without rename)
     */
    public PlayerDefinition toDefinition(String fallbackName) {
        String effectiveName = name == null ? fallbackName : name;
        return new PlayerDefinition(effectiveName, device, provider,
                nullToEmpty(serverIp), nullToEmpty(serverUrl), nullToEmpty(macAddress),
                Collections.unmodifiableMap(new LinkedHashMap<>(extras)));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
