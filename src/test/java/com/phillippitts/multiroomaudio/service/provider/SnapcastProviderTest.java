package com.phillippitts.multiroomaudio.service.provider;

import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.service.audio.AudioDeviceService;
import com.phillippitts.multiroomaudio.util.BinaryLocator;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class SnapcastProviderTest {

    private static final Path LOG = Path.of("/tmp/Office.log");

    private final SnapcastProvider provider =
            new SnapcastProvider(new BinaryLocator(""), mock(AudioDeviceService.class));

    private static PlayerConfig office() {
        return PlayerConfig.builder("Office")
                .providerType("snapcast")
                .device("hw:0,0")
                .serverAddress("10.0.0.5")
                .clientId("snapcast-office-1234abcd")
                .build();
    }

    @Test
    void buildsCommandWithLogSink() {
        assertThat(provider.buildCommand(office(), LOG)).containsExactly(
                "snapclient", "--host", "10.0.0.5", "--hostID", "snapcast-office-1234abcd",
                "--soundcard", "hw:0,0", "--logsink", "file:" + LOG);
    }

    @Test
    void fallbackSwitchesToDefaultSoundcard() {
        assertThat(provider.buildFallbackCommand(office(), LOG)).containsSequence("--soundcard", "default");
    }

    @Test
    void blankDeviceAlreadyOpensDefaultSoNoFallback() {
        PlayerConfig blank = office().withDevice("");

        assertThat(provider.buildCommand(blank, LOG)).containsSequence("--soundcard", "default");
        assertThat(provider.buildFallbackCommand(blank, LOG)).isEmpty();
    }

    @Test
    void latencyExtraIsPassedThrough() {
        PlayerConfig config = office().withExtras(Map.of(SnapcastProvider.LATENCY_MS, 120));

        assertThat(provider.buildCommand(config, LOG)).endsWith("--latency", "120");
    }

    @Test
    void validatesServerAndLatency() {
        assertThat(provider.validateConfig(office())).isEmpty();
        assertThat(provider.validateConfig(office().withServerAddress("")))
                .contains("Server address is required for Snapcast");
        assertThat(provider.validateConfig(office().withExtras(Map.of(SnapcastProvider.LATENCY_MS, -5))))
                .contains("latencyMs must not be negative");
        assertThat(provider.validateConfig(office().withExtras(Map.of(SnapcastProvider.LATENCY_MS, "fast"))))
                .contains("latencyMs must be an integer");
    }

    @Test
    void prepareDerivesClientIdAndMac() {
        PlayerConfig prepared = provider.prepareConfig(office().withClientId(""));

        assertThat(prepared.clientId()).startsWith("snapcast-office-").hasSize("snapcast-office-".length() + 8);
        assertThat(prepared.hardwareAddress()).isEqualTo(HardwareIdentifiers.generateMac("Office"));
    }

    @Test
    void binaryIsSnapclient() {
        assertThat(provider.binaryName()).isEqualTo("snapclient");
        assertThat(provider.type()).isEqualTo(ProviderTypes.SNAPCAST);
    }
}
