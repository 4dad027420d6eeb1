package com.phillippitts.multiroomaudio.service.provider;

import com.phillippitts.multiroomaudio.domain.PlayerConfig;
import com.phillippitts.multiroomaudio.domain.ProviderInfo;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name-keyed catalog of provider implementations, in registration order.
 *
 * <p>Availability is a query, not a registration precondition: a provider whose binary is
 * missing stays registered so existing players keep resolving to it.
 */
public class ProviderRegistry {

    private static final Logger LOG = LogManager.getLogger(ProviderRegistry.class);

    private final Map<String, PlayerProvider> providers = new LinkedHashMap<>();

    /** Registers under the provider's own type. */
    public void register(PlayerProvider provider) {
        register(provider.type(), provider);
    }

    /** Registers {@code provider} under {@code type}, replacing any previous registration. */
    public synchronized void register(String type, PlayerProvider provider) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(provider, "provider");
        PlayerProvider previous = providers.put(type, provider);
        if (previous != null) {
            LOG.info("Provider '{}' replaced: {} -> {}", type, previous, provider);
        }
    }

    public synchronized Optional<PlayerProvider> get(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(type));
    }

    /**
     * Resolves the provider of a stored player. A blank provider field means
     * {@link ProviderTypes#DEFAULT}; an unknown explicit type resolves to empty.
     */
    public Optional<PlayerProvider> getForPlayer(PlayerConfig config) {
        String type = config.providerType().isEmpty() ? ProviderTypes.DEFAULT : config.providerType();
        return get(type);
    }

    public synchronized List<String> listProviders() {
        return List.copyOf(providers.keySet());
    }

    /**
     * Describes registered providers.
     *
     * @param availableOnly only include providers whose binary is present
     */
    public List<ProviderInfo> getProviderInfo(boolean availableOnly) {
        List<PlayerProvider> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(providers.values());
        }
        List<ProviderInfo> infos = new ArrayList<>();
        for (PlayerProvider provider : snapshot) {
            ProviderInfo info = provider.info();
            if (!availableOnly || info.available()) {
                infos.add(info);
            }
        }
        return infos;
    }
}
