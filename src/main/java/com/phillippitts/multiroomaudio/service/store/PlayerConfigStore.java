package com.phillippitts.multiroomaudio.service.store;

import com.phillippitts.multiroomaudio.domain.PlayerConfig;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage of player configurations keyed by player name.
 *
 * <p>Mutations ({@link #setPlayer}, {@link #deletePlayer}) change the in-memory view only;
 * callers persist with {@link #save()}. {@link #updatePlayerField} persists on its own.
 *
 * @throws com.phillippitts.multiroomaudio.exception.PlayerConfigStoreException from
 *         {@link #load()} and {@link #save()} when the backing file cannot be read or written
 */
public interface PlayerConfigStore {

    void load();

    void save();

    boolean playerExists(String name);

    Optional<PlayerConfig> getPlayer(String name);

    /** Stores {@code config} under {@code name}; the stored record carries {@code name}. */
    void setPlayer(String name, PlayerConfig config);

    /** @return whether a record was removed */
    boolean deletePlayer(String name);

    /** Player names in insertion order. */
    List<String> listPlayers();

    /**
     * Sets one stored field (snake_case key, see
     * {@link com.phillippitts.multiroomaudio.domain.PlayerConfigMapper}) and saves.
     *
     * @return {@code false} if the player does not exist
     */
    boolean updatePlayerField(String name, String field, Object value);

    /** Snapshot of every player, in insertion order. */
    Map<String, PlayerConfig> players();
}
