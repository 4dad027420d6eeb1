package com.phillippitts.multiroomaudio.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Player status polling ({@code player.status.*}).
 */
@ConfigurationProperties(prefix = "player.status")
@Validated
public class StatusMonitorProperties {

    /** Enable/disable the status monitor globally. */
    private boolean enabled = true;

    /** Delay between two polls, in milliseconds. */
    @Positive(message = "Status interval must be positive")
    private long intervalMs = 2000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
        this.intervalMs = intervalMs;
    }
}
