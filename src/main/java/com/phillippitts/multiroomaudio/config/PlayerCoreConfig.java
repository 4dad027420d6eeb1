package com.phillippitts.multiroomaudio.config;

import com.phillippitts.multiroomaudio.config.properties.AudioProperties;
import com.phillippitts.multiroomaudio.config.properties.PlayerStoreProperties;
import com.phillippitts.multiroomaudio.config.properties.ProcessSupervisorProperties;
import com.phillippitts.multiroomaudio.service.audio.AlsaAudioDeviceService;
import com.phillippitts.multiroomaudio.service.audio.AudioDeviceService;
import com.phillippitts.multiroomaudio.service.player.DefaultPlayerOrchestrator;
import com.phillippitts.multiroomaudio.service.player.PlayerOrchestrator;
import com.phillippitts.multiroomaudio.service.process.CommandRunner;
import com.phillippitts.multiroomaudio.service.process.DefaultCommandRunner;
import com.phillippitts.multiroomaudio.service.process.DefaultProcessFactory;
import com.phillippitts.multiroomaudio.service.process.ProcessGroupStrategies;
import com.phillippitts.multiroomaudio.service.process.ProcessGroupStrategy;
import com.phillippitts.multiroomaudio.service.process.ProcessSupervisor;
import com.phillippitts.multiroomaudio.service.provider.ProviderRegistry;
import com.phillippitts.multiroomaudio.service.provider.SendspinProvider;
import com.phillippitts.multiroomaudio.service.provider.SnapcastProvider;
import com.phillippitts.multiroomaudio.service.provider.SqueezeliteProvider;
import com.phillippitts.multiroomaudio.service.store.PlayerConfigStore;
import com.phillippitts.multiroomaudio.service.store.YamlPlayerConfigStore;
import com.phillippitts.multiroomaudio.util.BinaryLocator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the player core explicitly: process plumbing, device service, providers, store and
 * the orchestrator that composes them.
 */
@Configuration
public class PlayerCoreConfig {

    private static final Logger LOG = LogManager.getLogger(PlayerCoreConfig.class);

    @Bean
    public BinaryLocator binaryLocator() {
        return BinaryLocator.fromEnvironment();
    }

    @Bean
    public CommandRunner commandRunner() {
        return new DefaultCommandRunner();
    }

    @Bean
    public ProcessGroupStrategy processGroupStrategy(ProcessSupervisorProperties props,
                                                     BinaryLocator binaryLocator,
                                                     CommandRunner commandRunner) {
        ProcessGroupStrategy strategy = ProcessGroupStrategies.select(
                props.getProcessGroups(), binaryLocator, commandRunner);
        LOG.info("Process group handling: mode={}, strategy={}", props.getProcessGroups(), strategy.name());
        return strategy;
    }

    @Bean
    public ProcessSupervisor processSupervisor(ProcessGroupStrategy strategy, ProcessSupervisorProperties props) {
        return new ProcessSupervisor(new DefaultProcessFactory(), strategy, props);
    }

    @Bean
    public AudioDeviceService audioDeviceService(CommandRunner commandRunner, AudioProperties props) {
        return new AlsaAudioDeviceService(commandRunner, props);
    }

    /**
     * The closed set of providers. Providers whose binary is missing stay registered; they are
     * reported as unavailable and fail at start.
     */
    @Bean
    public ProviderRegistry providerRegistry(BinaryLocator binaryLocator, AudioDeviceService audioDevices) {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new SqueezeliteProvider(binaryLocator, audioDevices));
        registry.register(new SendspinProvider(binaryLocator, audioDevices));
        registry.register(new SnapcastProvider(binaryLocator, audioDevices));
        return registry;
    }

    /** A corrupt document is quarantined rather than failing startup. */
    @Bean
    public PlayerConfigStore playerConfigStore(PlayerStoreProperties props) {
        YamlPlayerConfigStore store = new YamlPlayerConfigStore(Path.of(props.getPath()));
        store.loadOrQuarantine().ifPresent(aside ->
                LOG.warn("Starting without players; previous configuration kept at {}", aside));
        LOG.info("Loaded {} player(s) from {}", store.listPlayers().size(), store.getPath());
        return store;
    }

    @Bean
    public PlayerOrchestrator playerOrchestrator(ProviderRegistry providers,
                                                 ProcessSupervisor supervisor,
                                                 PlayerConfigStore store,
                                                 AudioDeviceService audioDevices) {
        return new DefaultPlayerOrchestrator(providers, supervisor, store, audioDevices);
    }
}
