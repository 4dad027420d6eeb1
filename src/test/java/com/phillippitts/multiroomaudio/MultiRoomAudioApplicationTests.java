package com.phillippitts.multiroomaudio;

import com.phillippitts.multiroomaudio.service.player.PlayerOrchestrator;
import com.phillippitts.multiroomaudio.service.status.PlayerStatusMonitor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "player.status.enabled=false" // no background polling in tests
    }
)
class MultiRoomAudioApplicationTests {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void dataLocations(DynamicPropertyRegistry registry) {
        registry.add("player.store.path", () -> dataDir.resolve("players.yaml").toString());
        registry.add("player.process.log-dir", () -> dataDir.resolve("logs").toString());
    }

    @Autowired
    private ApplicationContext context;

    @Autowired
    private PlayerOrchestrator orchestrator;

    @Test
    void contextLoads() {
        assertThat(orchestrator.players()).isEmpty();
        assertThat(context.getBeanNamesForType(PlayerStatusMonitor.class)).isEmpty();
    }
}
