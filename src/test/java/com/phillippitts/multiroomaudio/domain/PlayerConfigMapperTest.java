package com.phillippitts.multiroomaudio.domain;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlayerConfigMapperTest {

    @Test
    void unknownFieldsBecomeExtras() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("device", "hw:0,0");
        fields.put("provider", "snapcast");
        fields.put("latencyMs", 80);

        PlayerConfig config = PlayerConfigMapper.fromMap("Office", fields);

        assertThat(config.extras()).containsExactly(Map.entry("latencyMs", 80));
        assertThat(config.providerType()).isEqualTo("snapcast");
    }

    @Test
    void keyWinsOverNameField() {
        PlayerConfig config = PlayerConfigMapper.fromMap("Kitchen", Map.of("name", "Old Kitchen"));

        assertThat(config.name()).isEqualTo("Kitchen");
    }

    @Test
    void numericStringsAreAccepted() {
        PlayerConfig config = PlayerConfigMapper.fromMap("Kitchen", Map.of("volume", "40", "delay_ms", " -100 "));

        assertThat(config.volumePercent()).isEqualTo(40);
        assertThat(config.delayMs()).isEqualTo(-100);
    }

    @Test
    void nonNumericVolumeIsRejected() {
        assertThatThrownBy(() -> PlayerConfigMapper.fromMap("Kitchen", Map.of("volume", "loud")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("volume");
    }

    @Test
    void absentVolumeStaysUnknown() {
        PlayerConfig config = PlayerConfigMapper.fromMap("Kitchen", null);

        assertThat(config.volumePercent()).isNull();
        assertThat(config.volumeOrDefault()).isEqualTo(PlayerConfig.DEFAULT_VOLUME);
        assertThat(PlayerConfigMapper.toMap(config)).doesNotContainKey("volume");
    }

    @Test
    void toMapUsesSnakeCaseKeys() {
        PlayerConfig config = PlayerConfig.builder("Patio")
                .serverUrl("ws://ma:8927")
                .hardwareAddress("AA:BB:CC:DD:EE:FF")
                .clientId("sendspin-patio-12345678")
                .volumePercent(30)
                .build();

        assertThat(PlayerConfigMapper.toMap(config))
                .containsEntry("server_url", "ws://ma:8927")
                .containsEntry("mac_address", "AA:BB:CC:DD:EE:FF")
                .containsEntry("client_id", "sendspin-patio-12345678")
                .containsEntry("volume", 30)
                .containsEntry("delay_ms", 0);
    }
}
