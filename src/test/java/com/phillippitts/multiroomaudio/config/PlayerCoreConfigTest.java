package com.phillippitts.multiroomaudio.config;

import com.phillippitts.multiroomaudio.config.properties.PlayerStoreProperties;
import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.service.store.PlayerConfigStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class PlayerCoreConfigTest {

    @TempDir
    Path dir;

    @Test
    void corruptStoreDoesNotPreventStartup() throws IOException {
        Path file = dir.resolve("players.yaml");
        Files.writeString(file, "players: [unclosed\n  Kitchen: {device: hw:0,0\n");
        PlayerStoreProperties props = new PlayerStoreProperties();
        props.setPath(file.toString());

        PlayerConfigStore store = new PlayerCoreConfig().playerConfigStore(props);

        assertThat(store.listPlayers()).isEmpty();
        store.setPlayer("Patio", PlayerConfig.builder("Patio").device("hw:1,0").build());
        store.save();
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .contains("players.yaml")
                    .anyMatch(name -> name.startsWith("players.yaml.corrupt-"));
        }
    }
}
