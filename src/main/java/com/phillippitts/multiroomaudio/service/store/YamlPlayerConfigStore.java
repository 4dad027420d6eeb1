package com.phillippitts.multiroomaudio.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.domain.PlayerConfigMapper;
import com.phillippitts.multiroomaudio.exception.PlayerConfigStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link PlayerConfigStore} backed by a YAML document:
 *
 * <pre>
 * players:
 *   Kitchen:
 *     name: Kitchen
 *     device: hw:0,0
 *     provider: squeezelite
 *     mac_address: 1A:2B:3C:4D:5E:6F
 *     volume: 75
 * </pre>
 *
 * <p>Writes go to a temporary file in the same directory which then replaces the document, so a
 * crash mid-write never leaves a truncated file. All access is synchronized on the store.
 */
public class YamlPlayerConfigStore implements PlayerConfigStore {

    private static final Logger LOG = LogManager.getLogger(YamlPlayerConfigStore.class);

    static final String ROOT_KEY = "players";

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper yaml;
    private final Map<String, PlayerConfig> players = new LinkedHashMap<>();

    public YamlPlayerConfigStore(Path path) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        this.yaml = new ObjectMapper(YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .build());
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void load() {
        players.clear();
        if (!Files.exists(path)) {
            LOG.info("No player configuration at {}; starting empty", path);
            return;
        }
        JsonNode root;
        try {
            root = yaml.readTree(path.toFile());
        } catch (IOException e) {
            throw new PlayerConfigStoreException("Failed to read player configuration", path, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            LOG.info("Player configuration {} is empty", path);
            return;
        }
        if (!root.isObject()) {
            throw new PlayerConfigStoreException("Player configuration must be a mapping", path);
        }
        Map<String, Object> document = yaml.convertValue(root, DOCUMENT);
        Object section = document.get(ROOT_KEY);
        if (section != null && !(section instanceof Map<?, ?>)) {
            throw new PlayerConfigStoreException("'" + ROOT_KEY + "' must be a mapping", path);
        }
        if (section instanceof Map<?, ?> entries) {
            entries.forEach((key, value) -> loadEntry(String.valueOf(key), value));
        }
        LOG.info("Loaded {} player(s) from {}", players.size(), path);
    }

    /**
     * Loads the document, or, when it cannot be parsed, moves it aside as
     * {@code <name>.corrupt-<millis>} and starts empty so the next save cannot overwrite it.
     *
     * @return the quarantined file, if the document was unreadable
     */
    public synchronized Optional<Path> loadOrQuarantine() {
        try {
            load();
            return Optional.empty();
        } catch (PlayerConfigStoreException e) {
            players.clear();
            Path aside = path.resolveSibling(path.getFileName() + ".corrupt-" + System.currentTimeMillis());
            LOG.error("Unreadable player configuration {}: {}; moving it to {} and starting empty",
                    path, e.getMessage(), aside, e);
            try {
                Files.move(path, aside);
                return Optional.of(aside);
            } catch (IOException moveFailure) {
                throw new PlayerConfigStoreException("Cannot move unreadable player configuration aside",
                        path, moveFailure);
            }
        }
    }

    private void loadEntry(String name, Object value) {
        if (value != null && !(value instanceof Map<?, ?>)) {
            LOG.warn("Skipping player '{}': expected a mapping, got {}", name, value.getClass().getSimpleName());
            return;
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> raw) {
            raw.forEach((k, v) -> fields.put(String.valueOf(k), v));
        }
        try {
            players.put(name, PlayerConfigMapper.fromMap(name, fields));
        } catch (IllegalArgumentException e) {
            LOG.warn("Skipping player '{}': {}", name, e.getMessage());
        }
    }

    @Override
    public synchronized void save() {
        Map<String, Object> entries = new LinkedHashMap<>();
        players.forEach((name, config) -> entries.put(name, PlayerConfigMapper.toMap(config)));
        Map<String, Object> document = Map.of(ROOT_KEY, entries);

        Path tmp = null;
        try {
            Path dir = path.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, ".players", ".yaml.tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                yaml.writeValue(out, document);
            }
            moveIntoPlace(tmp);
            LOG.debug("Saved {} player(s) to {}", players.size(), path);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PlayerConfigStoreException("Failed to write player configuration", path, e);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}; replacing in place", path);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.debug("Could not delete temp file {}: {}", file, e.toString());
        }
    }

    @Override
    public synchronized boolean playerExists(String name) {
        return players.containsKey(name);
    }

    @Override
    public synchronized Optional<PlayerConfig> getPlayer(String name) {
        return Optional.ofNullable(players.get(name));
    }

    @Override
    public synchronized void setPlayer(String name, PlayerConfig config) {
        Objects.requireNonNull(config, "config");
        players.put(name, name.equals(config.name()) ? config : config.withName(name));
    }

    @Override
    public synchronized boolean deletePlayer(String name) {
        return players.remove(name) != null;
    }

    @Override
    public synchronized List<String> listPlayers() {
        return new ArrayList<>(players.keySet());
    }

    @Override
    public synchronized boolean updatePlayerField(String name, String field, Object value) {
        PlayerConfig current = players.get(name);
        if (current == null) {
            return false;
        }
        Map<String, Object> fields = PlayerConfigMapper.toMap(current);
        fields.put(field, value);
        players.put(name, PlayerConfigMapper.fromMap(name, fields));
        save();
        return true;
    }

    @Override
    public synchronized Map<String, PlayerConfig> players() {
        return new LinkedHashMap<>(players);
    }
}
