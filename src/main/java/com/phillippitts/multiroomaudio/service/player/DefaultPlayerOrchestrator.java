package com.phillippitts.multiroomaudio.service.player;

import com.phillippitts.multiroomaudio.domain.AudioDevice;
import com.phillippitts.multiroomaudio.domain.AudioDiagnostics;
import com.phillippitts.multiroomaudio.domain.OperationResult;
import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.domain.PlayerConfigMapper;
import com.phillippitts.multiroomaudio.domain.PlayerDefinition;
import com.phillippitts.multiroomaudio.domain.PortAudioListing;
import com.phillippitts.multiroomaudio.domain.ProviderInfo;
import com.phillippitts.multiroomaudio.exception.PlayerConfigStoreException;
import com.phillippitts.multiroomaudio.service.audio.AudioDeviceService;
import com.phillippitts.multiroomaudio.service.process.ProcessSupervisor;
import com.phillippitts.multiroomaudio.service.process.StartOutcome;
import com.phillippitts.multiroomaudio.service.provider.PlayerProvider;
import com.phillippitts.multiroomaudio.service.provider.ProviderRegistry;
import com.phillippitts.multiroomaudio.service.provider.ProviderTypes;
import com.phillippitts.multiroomaudio.service.store.PlayerConfigStore;
import com.phillippitts.multiroomaudio.util.KeyedLocks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Supplier;

/**
 * Default implementation of {@link PlayerOrchestrator}.
 *
 * <p><b>Locking:</b> every read-mutate-persist sequence for a player runs under that player's
 * lock; a rename holds the locks of both names, taken in sorted order. Status checks take no
 * lock.
 *
 * <p><b>Error Handling:</b> store failures and unexpected runtime exceptions are logged and
 * reported as failed results at this boundary, so the web layer only ever sees
 * {@link OperationResult}s.
 *
 * @since 1.0
 */
public class DefaultPlayerOrchestrator implements PlayerOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultPlayerOrchestrator.class);

    private final ProviderRegistry providers;
    private final ProcessSupervisor supervisor;
    private final PlayerConfigStore store;
    private final AudioDeviceService audioDevices;
    private final KeyedLocks locks = new KeyedLocks();

    public DefaultPlayerOrchestrator(ProviderRegistry providers,
                                     ProcessSupervisor supervisor,
                                     PlayerConfigStore store,
                                     AudioDeviceService audioDevices) {
        this.providers = Objects.requireNonNull(providers, "providers must not be null");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.audioDevices = Objects.requireNonNull(audioDevices, "audioDevices must not be null");
    }

    @Override
    public OperationResult createPlayer(PlayerDefinition definition) {
        String name = definition.name();
        Optional<String> nameError = PlayerNameValidator.validate(name);
        if (nameError.isPresent()) {
            return OperationResult.failure(nameError.get());
        }
        return guarded("creating player", () -> locks.withLock(name, () -> createLocked(definition)));
    }

    private OperationResult createLocked(PlayerDefinition definition) {
        String name = definition.name();
        if (store.playerExists(name)) {
            return OperationResult.failure("Player with this name already exists");
        }
        String type = blankToDefaultType(definition.providerType());
        Optional<PlayerProvider> provider = providers.get(type);
        if (provider.isEmpty()) {
            return OperationResult.failure("Unknown provider type: " + type);
        }

        PlayerConfig config;
        try {
            config = applyExtras(PlayerConfig.builder(name)
                    .device(definition.deviceOrDefault())
                    .providerType(type)
                    .serverAddress(definition.serverAddress())
                    .serverUrl(definition.serverUrl())
                    .hardwareAddress(definition.hardwareAddress())
                    .enabled(true)
                    .volumePercent(PlayerConfig.DEFAULT_VOLUME)
                    .build(), definition.extras());
        } catch (IllegalArgumentException e) {
            return OperationResult.failure(e.getMessage());
        }

        Optional<String> invalid = provider.get().validateConfig(config);
        if (invalid.isPresent()) {
            return OperationResult.failure(invalid.get());
        }
        PlayerConfig prepared = provider.get().prepareConfig(config);

        store.setPlayer(name, prepared);
        try {
            store.save();
        } catch (PlayerConfigStoreException e) {
            store.deletePlayer(name);
            throw e;
        }
        LOG.info("Created player '{}' (provider={}, device={})", name, type, prepared.device());
        return OperationResult.ok("Player created successfully");
    }

    @Override
    public OperationResult updatePlayer(String oldName, PlayerDefinition definition) {
        String newName = definition.name() == null || definition.name().isBlank() ? oldName : definition.name();
        Optional<String> nameError = PlayerNameValidator.validate(newName);
        if (nameError.isPresent()) {
            return OperationResult.failure(nameError.get());
        }
        return guarded("updating player",
                () -> locks.withLocks(oldName, newName, () -> updateLocked(oldName, newName, definition)));
    }

    private OperationResult updateLocked(String oldName, String newName, PlayerDefinition definition) {
        Optional<PlayerConfig> existing = store.getPlayer(oldName);
        if (existing.isEmpty()) {
            return OperationResult.failure(PLAYER_NOT_FOUND);
        }
        boolean renamed = !oldName.equals(newName);
        if (renamed && store.playerExists(newName)) {
            return OperationResult.failure("Player with this name already exists");
        }

        PlayerConfig previous = existing.get();
        PlayerConfig updated = previous.withName(newName)
                .withDevice(definition.deviceOrDefault())
                .withServerAddress(definition.serverAddress())
                .withServerUrl(definition.serverUrl());
        if (definition.hardwareAddress() != null && !definition.hardwareAddress().isBlank()) {
            updated = updated.withHardwareAddress(definition.hardwareAddress());
        }
        if (definition.providerType() != null && !definition.providerType().isBlank()) {
            updated = updated.withProviderType(definition.providerType());
        }
        try {
            updated = applyExtras(updated, definition.extras());
        } catch (IllegalArgumentException e) {
            return OperationResult.failure(e.getMessage());
        }

        // A player may reference a provider that is no longer registered; only validation blocks
        Optional<PlayerProvider> provider = providers.getForPlayer(updated);
        if (provider.isPresent()) {
            Optional<String> invalid = provider.get().validateConfig(updated);
            if (invalid.isPresent()) {
                return OperationResult.failure(invalid.get());
            }
            updated = provider.get().prepareConfig(updated);
        } else {
            LOG.warn("Player '{}' references unknown provider '{}'; saving without validation",
                    newName, updated.providerType());
        }

        boolean wasRunning = supervisor.isRunning(oldName);
        if (wasRunning) {
            OperationResult stopped = supervisor.stop(oldName);
            LOG.info("Stopped '{}' for reconfiguration: {}", oldName, stopped.message());
        }

        if (renamed) {
            store.deletePlayer(oldName);
        }
        store.setPlayer(newName, updated);
        try {
            store.save();
        } catch (PlayerConfigStoreException e) {
            store.deletePlayer(newName);
            store.setPlayer(oldName, previous);
            if (wasRunning) {
                OperationResult restored = startLocked(oldName);
                LOG.info("Restarted '{}' with its previous configuration: {}", oldName, restored.message());
            }
            throw e;
        }
        LOG.info("Updated player '{}'{}", oldName, renamed ? " -> '" + newName + "'" : "");

        if (!wasRunning) {
            return OperationResult.ok("Player updated successfully");
        }
        OperationResult restarted = startLocked(newName);
        if (restarted.success()) {
            return OperationResult.ok("Player updated and restarted successfully");
        }
        LOG.warn("Player '{}' updated but failed to restart: {}", newName, restarted.message());
        return OperationResult.okWithWarning(
                "Player updated successfully, but failed to restart: " + restarted.message(),
                restarted.message());
    }

    @Override
    public OperationResult deletePlayer(String name) {
        return guarded("deleting player", () -> locks.withLock(name, () -> {
            if (!store.playerExists(name)) {
                return OperationResult.failure(PLAYER_NOT_FOUND);
            }
            if (supervisor.isRunning(name)) {
                OperationResult stopped = supervisor.stop(name);
                LOG.info("Stopped '{}' before delete: {}", name, stopped.message());
            }
            store.deletePlayer(name);
            store.save();
            LOG.info("Deleted player '{}'", name);
            return OperationResult.ok("Player deleted successfully");
        }));
    }

    @Override
    public OperationResult startPlayer(String name) {
        return guarded("starting player", () -> locks.withLock(name, () -> startLocked(name)));
    }

    private OperationResult startLocked(String name) {
        Optional<PlayerConfig> stored = store.getPlayer(name);
        if (stored.isEmpty()) {
            return OperationResult.failure(PLAYER_NOT_FOUND);
        }
        PlayerConfig config = stored.get();
        if (supervisor.isRunning(name)) {
            return OperationResult.failure("Player already running");
        }
        Optional<PlayerProvider> resolved = providers.getForPlayer(config);
        if (resolved.isEmpty()) {
            return OperationResult.failure("Unknown provider type: " + blankToDefaultType(config.providerType()));
        }
        PlayerProvider provider = resolved.get();

        Path logPath = supervisor.getLogPath(name);
        List<String> command = provider.buildCommand(config, logPath);
        List<String> fallback = provider.supportsFallback()
                ? provider.buildFallbackCommand(config, logPath)
                : List.of();
        LOG.info("Starting player '{}' ({})", name, provider.displayName());

        StartOutcome outcome = supervisor.start(name, command, fallback);
        if (outcome.success() && outcome.usedFallback()) {
            return OperationResult.ok("Player " + name + " started with fallback (audio device '"
                    + config.device() + "' not available)");
        }
        return outcome.success()
                ? OperationResult.ok(outcome.message())
                : OperationResult.failure(outcome.message());
    }

    @Override
    public OperationResult stopPlayer(String name) {
        return guarded("stopping player", () -> locks.withLock(name, () -> supervisor.stop(name)));
    }

    @Override
    public boolean getPlayerStatus(String name) {
        return supervisor.isRunning(name);
    }

    @Override
    public Map<String, Boolean> getAllStatuses() {
        return supervisor.getAllStatuses(store.listPlayers());
    }

    @Override
    public Optional<Integer> getPlayerVolume(String name) {
        Optional<PlayerConfig> stored = store.getPlayer(name);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        PlayerConfig config = stored.get();
        Optional<PlayerProvider> provider = providers.getForPlayer(config);
        if (provider.isEmpty()) {
            return Optional.of(config.volumeOrDefault());
        }
        OptionalInt actual;
        try {
            actual = provider.get().getVolume(config);
        } catch (RuntimeException e) {
            LOG.warn("Reading volume of '{}' failed: {}", name, e.toString());
            actual = OptionalInt.empty();
        }
        if (actual.isEmpty()) {
            // Unreadable mixer: the stored intent stands and nothing is backfilled
            return Optional.of(config.volumeOrDefault());
        }
        if (config.volumePercent() == null) {
            backfillVolume(name, actual.getAsInt());
        }
        return Optional.of(actual.getAsInt());
    }

    /** Records a volume read from the hardware for players stored before volume was tracked. */
    private void backfillVolume(String name, int volume) {
        try {
            locks.withLock(name, () -> {
                Optional<PlayerConfig> current = store.getPlayer(name);
                if (current.isPresent() && current.get().volumePercent() == null) {
                    store.updatePlayerField(name, PlayerConfigMapper.VOLUME, volume);
                }
                return null;
            });
        } catch (RuntimeException e) {
            LOG.warn("Could not record volume {}% for '{}': {}", volume, name, e.toString());
        }
    }

    @Override
    public OperationResult setPlayerVolume(String name, int volume) {
        if (volume < PlayerConfig.MIN_VOLUME || volume > PlayerConfig.MAX_VOLUME) {
            return OperationResult.failure("Volume must be between 0 and 100");
        }
        return guarded("setting volume", () -> locks.withLock(name, () -> {
            Optional<PlayerConfig> stored = store.getPlayer(name);
            if (stored.isEmpty()) {
                return OperationResult.failure(PLAYER_NOT_FOUND);
            }
            PlayerConfig config = stored.get();
            Optional<PlayerProvider> provider = providers.getForPlayer(config);
            if (provider.isEmpty()) {
                persistVolume(config, volume);
                return OperationResult.ok("Volume set to " + volume + "% (provider not available)");
            }

            OperationResult hardware;
            try {
                hardware = provider.get().setVolume(config, volume);
            } catch (RuntimeException e) {
                LOG.warn("Hardware volume for '{}' failed: {}", name, e.toString());
                hardware = OperationResult.failure("Failed to set volume: " + e.getMessage());
            }
            // The stored value is the user's intent and wins over the mixer outcome
            persistVolume(config, volume);
            if (hardware.success()) {
                return hardware;
            }
            return OperationResult.okWithWarning("Volume set to " + volume + "%", hardware.message());
        }));
    }

    private void persistVolume(PlayerConfig config, int volume) {
        store.setPlayer(config.name(), config.withVolumePercent(volume));
        store.save();
    }

    @Override
    public OperationResult updatePlayerOffset(String name, int delayMs) {
        if (delayMs < PlayerConfig.MIN_DELAY_MS || delayMs > PlayerConfig.MAX_DELAY_MS) {
            return OperationResult.failure("delay_ms must be between -1000 and 1000");
        }
        return guarded("updating offset", () -> locks.withLock(name, () -> {
            if (!store.updatePlayerField(name, PlayerConfigMapper.DELAY_MS, delayMs)) {
                return OperationResult.failure(PLAYER_NOT_FOUND);
            }
            LOG.info("Offset of '{}' set to {}ms", name, delayMs);
            return OperationResult.ok("Offset updated to " + delayMs + "ms. Restart player to apply.");
        }));
    }

    @Override
    public Map<String, PlayerConfig> players() {
        return store.players();
    }

    @Override
    public Optional<PlayerConfig> getPlayer(String name) {
        return store.getPlayer(name);
    }

    @Override
    public List<ProviderInfo> getAvailableProviders() {
        List<ProviderInfo> available = providers.getProviderInfo(true);
        if (available.isEmpty()) {
            LOG.warn("No provider binaries found; returning all registered providers");
            return providers.getProviderInfo(false);
        }
        return available;
    }

    @Override
    public List<AudioDevice> getAudioDevices() {
        return audioDevices.getDevices();
    }

    @Override
    public List<String> getMixerControls(String device) {
        return audioDevices.getMixerControls(device);
    }

    @Override
    public OptionalInt getDeviceVolume(String device, String control) {
        return audioDevices.getVolume(device, control);
    }

    @Override
    public OperationResult setDeviceVolume(String device, int volume, String control) {
        return audioDevices.setVolume(device, volume, control);
    }

    @Override
    public OperationResult playTestTone(String device) {
        return audioDevices.playTestTone(device);
    }

    @Override
    public PortAudioListing getPortAudioDevices() {
        return audioDevices.getPortAudioDevices();
    }

    @Override
    public AudioDiagnostics getAudioDiagnostics() {
        return audioDevices.diagnostics();
    }

    @Override
    public boolean isDegraded(String name) {
        return supervisor.isDegraded(name);
    }

    @Override
    public List<String> cleanupDeadProcesses() {
        return supervisor.cleanupDeadProcesses();
    }

    @Override
    public int shutdown() {
        try {
            int stopped = supervisor.stopAll();
            LOG.info("Stopped {} player(s) on shutdown", stopped);
            return stopped;
        } catch (RuntimeException e) {
            LOG.error("Error stopping players on shutdown", e);
            return 0;
        }
    }

    /** Overlays caller-supplied fields; known keys such as {@code volume} update the typed fields. */
    private static PlayerConfig applyExtras(PlayerConfig config, Map<String, Object> extras) {
        if (extras == null || extras.isEmpty()) {
            return config;
        }
        Map<String, Object> fields = PlayerConfigMapper.toMap(config);
        fields.putAll(extras);
        return PlayerConfigMapper.fromMap(config.name(), fields);
    }

    private static String blankToDefaultType(String type) {
        return type == null || type.isBlank() ? ProviderTypes.DEFAULT : type.trim();
    }

    private static OperationResult guarded(String action, Supplier<OperationResult> operation) {
        try {
            return operation.get();
        } catch (PlayerConfigStoreException e) {
            LOG.error("Configuration store failure while {}: {}", action, e.getMessage(), e);
            return OperationResult.failure("Failed to save configuration: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected error while {}", action, e);
            return OperationResult.failure("Error " + action + ": " + e.getMessage());
        }
    }
}
