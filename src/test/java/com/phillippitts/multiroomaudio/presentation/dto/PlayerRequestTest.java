package com.phillippitts.multiroomaudio.presentation.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.multiroomaudio.domain.PlayerDefinition;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlayerRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void unknownFieldsBecomeExtras() throws Exception {
        PlayerRequest request = mapper.readValue(
                "{\"name\":\"Patio\",\"provider\":\"sendspin\",\"server_url\":\"ws://ma:8927\",\"volume\":30,\"note\":null}",
                PlayerRequest.class);

        PlayerDefinition definition = request.toDefinition(null);

        assertThat(definition.serverUrl()).isEqualTo("ws://ma:8927");
        assertThat(definition.serverAddress()).isEmpty();
        assertThat(definition.extras()).containsEntry("volume", 30).containsKey("note");
    }

    @Test
    void missingNameFallsBack() throws Exception {
        PlayerRequest request = mapper.readValue("{\"device\":\"hw:0,0\"}", PlayerRequest.class);

        assertThat(request.toDefinition("Kitchen").name()).isEqualTo("Kitchen");
        assertThat(request.toDefinition("Kitchen").hardwareAddress()).isEmpty();
    }
}
