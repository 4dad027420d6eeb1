package com.phillippitts.multiroomaudio.service.provider;

import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.domain.ProviderInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProviderRegistryTest {

    private ProviderRegistry registry;
    private PlayerProvider squeezelite;
    private PlayerProvider snapcast;

    @BeforeEach
    void setUp() {
        squeezelite = stub("squeezelite", true);
        snapcast = stub("snapcast", false);
        registry = new ProviderRegistry();
        registry.register(squeezelite);
        registry.register(snapcast);
    }

    private static PlayerProvider stub(String type, boolean available) {
        PlayerProvider provider = mock(PlayerProvider.class);
        when(provider.type()).thenReturn(type);
        when(provider.info()).thenReturn(new ProviderInfo(type, type, type + " provider", available));
        return provider;
    }

    @Test
    void listsInRegistrationOrder() {
        assertThat(registry.listProviders()).containsExactly("squeezelite", "snapcast");
    }

    @Test
    void blankProviderResolvesToDefault() {
        PlayerConfig legacy = PlayerConfig.builder("Kitchen").device("hw:0,0").build();

        assertThat(registry.getForPlayer(legacy)).containsSame(squeezelite);
    }

    @Test
    void unknownTypeResolvesToEmpty() {
        PlayerConfig config = PlayerConfig.builder("Kitchen").providerType("airplay").build();

        assertThat(registry.getForPlayer(config)).isEmpty();
        assertThat(registry.get(null)).isEmpty();
    }

    @Test
    void reRegistrationReplaces() {
        PlayerProvider replacement = stub("snapcast", true);

        registry.register(replacement);

        assertThat(registry.get("snapcast")).containsSame(replacement);
        assertThat(registry.listProviders()).containsExactly("squeezelite", "snapcast");
    }

    @Test
    void infoCanBeFilteredByAvailability() {
        assertThat(registry.getProviderInfo(true)).extracting(ProviderInfo::type).containsExactly("squeezelite");
        assertThat(registry.getProviderInfo(false)).hasSize(2);
    }
}
