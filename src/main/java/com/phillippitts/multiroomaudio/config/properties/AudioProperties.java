package com.phillippitts.multiroomaudio.config.properties;

import com.phillippitts.multiroomaudio.util.ProcessTimeouts;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * ALSA tool settings ({@code audio.*}).
 *
 * <p>Note: Bean created via {@code @EnableConfigurationProperties} on the application class.
 */
@ConfigurationProperties(prefix = "audio")
@Validated
public class AudioProperties {

    /** Upper bound for aplay/amixer invocations. */
    @NotNull
    private Duration commandTimeout = ProcessTimeouts.HELPER_COMMAND_TIMEOUT;

    /** Mixer control used when a player does not configure one. */
    @NotBlank
    private String defaultMixerControl = "Master";

    /** Upper bound for playing the speaker-test tone. */
    @NotNull
    private Duration testToneDuration = Duration.ofSeconds(10);

    /** Upper bound for {@code sendspin --list-audio-devices}. */
    @NotNull
    private Duration deviceListTimeout = Duration.ofSeconds(10);

    /** List PulseAudio sinks when sendspin reports no PortAudio devices (Home Assistant OS). */
    private boolean pulseaudioFallback = false;

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    public String getDefaultMixerControl() {
        return defaultMixerControl;
    }

    public void setDefaultMixerControl(String defaultMixerControl) {
        this.defaultMixerControl = defaultMixerControl;
    }

    public Duration getTestToneDuration() {
        return testToneDuration;
    }

    public void setTestToneDuration(Duration testToneDuration) {
        this.testToneDuration = testToneDuration;
    }

    public Duration getDeviceListTimeout() {
        return deviceListTimeout;
    }

    public void setDeviceListTimeout(Duration deviceListTimeout) {
        this.deviceListTimeout = deviceListTimeout;
    }

    public boolean isPulseaudioFallback() {
        return pulseaudioFallback;
    }

    public void setPulseaudioFallback(boolean pulseaudioFallback) {
        this.pulseaudioFallback = pulseaudioFallback;
    }
}
