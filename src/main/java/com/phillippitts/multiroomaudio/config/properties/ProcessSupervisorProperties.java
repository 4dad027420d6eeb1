package com.phillippitts.multiroomaudio.config.properties;

import com.phillippitts.multiroomaudio.util.ProcessTimeouts;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Player process supervision settings ({@code player.process.*}).
 *
 * <p>Note: Bean created via {@code @EnableConfigurationProperties} on the application class.
 */
@ConfigurationProperties(prefix = "player.process")
@Validated
public class ProcessSupervisorProperties {

    /** Directory holding one {@code <name>.log} per player. Created at startup. */
    @NotBlank(message = "Process log directory must not be blank")
    private String logDir = "logs/players";

    /** How long a new process must survive to count as started. */
    @NotNull
    private Duration startupGrace = ProcessTimeouts.STARTUP_GRACE;

    /** Wait after SIGTERM before escalating to SIGKILL. */
    @NotNull
    private Duration stopTimeout = ProcessTimeouts.GRACEFUL_STOP_TIMEOUT;

    /** Wait after SIGKILL before dropping the process from tracking. */
    @NotNull
    private Duration killTimeout = ProcessTimeouts.FORCED_KILL_TIMEOUT;

    /** Process group signalling: auto, posix or tree. */
    @Pattern(regexp = "auto|posix|tree", message = "process-groups must be one of auto, posix, tree")
    private String processGroups = "auto";

    public static ProcessSupervisorProperties withLogDir(String logDir) {
        ProcessSupervisorProperties props = new ProcessSupervisorProperties();
        props.setLogDir(logDir);
        return props;
    }

    public String getLogDir() {
        return logDir;
    }

    public void setLogDir(String logDir) {
        this.logDir = logDir;
    }

    public Duration getStartupGrace() {
        return startupGrace;
    }

    public void setStartupGrace(Duration startupGrace) {
        this.startupGrace = startupGrace;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public void setStopTimeout(Duration stopTimeout) {
        this.stopTimeout = stopTimeout;
    }

    public Duration getKillTimeout() {
        return killTimeout;
    }

    public void setKillTimeout(Duration killTimeout) {
        this.killTimeout = killTimeout;
    }

    public String getProcessGroups() {
        return processGroups;
    }

    public void setProcessGroups(String processGroups) {
        this.processGroups = processGroups;
    }
}
