package com.phillippitts.multiroomaudio.service.player;

import com.phillippitts.multiroomaudio.domain.AudioDevice;
import com.phillippitts.multiroomaudio.domain.AudioDiagnostics;
import com.phillippitts.multiroomaudio.domain.OperationResult;
import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.domain.PlayerDefinition;
import com.phillippitts.multiroomaudio.domain.PortAudioListing;
import com.phillippitts.multiroomaudio.domain.ProviderInfo;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Single entry point for player management used by the web layer and the status monitor.
 *
 * <p>Composes the provider registry, the process supervisor, the configuration store and the
 * device service, and enforces the rules that span them: unique names, stop before delete,
 * volume intent persisted even when the mixer refuses it.
 *
 * <p>Operations never throw for expected failures; they report them in an
 * {@link OperationResult}. Operations on the same player are serialized; different players
 * proceed in parallel.
 *
 * @see DefaultPlayerOrchestrator
 */
public interface PlayerOrchestrator {

    /** Failure message of every operation addressed to an unknown player. */
    String PLAYER_NOT_FOUND = "Player not found";

    OperationResult createPlayer(PlayerDefinition definition);

    /**
     * Updates (and possibly renames) {@code oldName}. A running player is stopped and restarted
     * under the new configuration; a failed restart is a success with a warning.
     */
    OperationResult updatePlayer(String oldName, PlayerDefinition definition);

    /** Stops the process if any, then removes the configuration. */
    OperationResult deletePlayer(String name);

    OperationResult startPlayer(String name);

    OperationResult stopPlayer(String name);

    boolean getPlayerStatus(String name);

    /** Running flag of every configured player, including players never started. */
    Map<String, Boolean> getAllStatuses();

    /** Current volume; empty if the player does not exist. */
    Optional<Integer> getPlayerVolume(String name);

    OperationResult setPlayerVolume(String name, int volume);

    /** Persists a sync offset; applied on the next start. */
    OperationResult updatePlayerOffset(String name, int delayMs);

    Map<String, PlayerConfig> players();

    Optional<PlayerConfig> getPlayer(String name);

    /** Providers whose binary is present, or all registered providers when none is. */
    List<ProviderInfo> getAvailableProviders();

    List<AudioDevice> getAudioDevices();

    List<String> getMixerControls(String device);

    /** Raw mixer volume of a device; empty when the mixer cannot be read. */
    OptionalInt getDeviceVolume(String device, String control);

    OperationResult setDeviceVolume(String device, int volume, String control);

    OperationResult playTestTone(String device);

    /** Outputs addressable by sendspin. */
    PortAudioListing getPortAudioDevices();

    AudioDiagnostics getAudioDiagnostics();

    /** Whether the player runs from its fallback command. */
    boolean isDegraded(String name);

    /** Reaps processes that exited on their own; returns their names. */
    List<String> cleanupDeadProcesses();

    /** Stops every process. Never throws. */
    int shutdown();
}
