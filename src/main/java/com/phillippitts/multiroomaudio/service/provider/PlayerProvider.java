package com.phillippitts.multiroomaudio.service.provider;

import com.phillippitts.multiroomaudio.domain.OperationResult;
import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.domain.ProviderInfo;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Strategy for one audio backend family: validates a player's declarative configuration and
 * turns it into the command line of the player binary.
 *
 * <p>Providers are stateless and shared by every player of their type. Everything except
 * {@link #isAvailable()} and the volume operations is a pure data transform and must not touch
 * the operating system.
 *
 * @see AbstractPlayerProvider
 * @see ProviderRegistry
 */
public interface PlayerProvider {

    /** Registry key, e.g. {@code squeezelite}. */
    String type();

    /** Human label only. */
    String displayName();

    String description();

    /** Executable looked up on the search path for {@link #isAvailable()}. */
    String binaryName();

    /** Whether the player binary can be found in this environment. */
    boolean isAvailable();

    /**
     * Checks required backend fields and value ranges.
     *
     * @return an error message, or empty when the configuration is valid
     */
    Optional<String> validateConfig(PlayerConfig config);

    /**
     * Returns a copy with derivable fields (hardware address, client id) filled in. Fields that
     * are already present are kept, so calling this twice yields the same configuration.
     */
    PlayerConfig prepareConfig(PlayerConfig config);

    /** Exact argv for a prepared, valid configuration. */
    List<String> buildCommand(PlayerConfig config, Path logPath);

    boolean supportsFallback();

    /**
     * Argv that trades the declared device for a generic one; empty when the provider has no
     * fallback or the declared device already is the fallback device.
     */
    List<String> buildFallbackCommand(PlayerConfig config, Path logPath);

    /** Current volume percentage for the player; empty when it cannot be determined. */
    OptionalInt getVolume(PlayerConfig config);

    OperationResult setVolume(PlayerConfig config, int percent);

    default ProviderInfo info() {
        return new ProviderInfo(type(), displayName(), description(), isAvailable());
    }
}
