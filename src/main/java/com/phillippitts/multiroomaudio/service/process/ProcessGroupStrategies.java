package com.phillippitts.multiroomaudio.service.process;

import com.phillippitts.multiroomaudio.util.BinaryLocator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Chooses the {@link ProcessGroupStrategy} for the running platform.
 */
public final class ProcessGroupStrategies {

    private static final Logger LOG = LogManager.getLogger(ProcessGroupStrategies.class);

    public static final String AUTO = "auto";
    public static final String POSIX = "posix";
    public static final String TREE = "tree";

    private ProcessGroupStrategies() {
    }

    /**
     * Resolves {@code mode} ({@code auto|posix|tree}). {@code auto} picks the POSIX strategy when
     * not on Windows and both {@code setsid} and {@code kill} are on the search path.
     *
     * @throws IllegalArgumentException for an unknown mode
     */
    public static ProcessGroupStrategy select(String mode, BinaryLocator locator, CommandRunner runner) {
        String normalized = mode == null || mode.isBlank() ? AUTO : mode.trim().toLowerCase(Locale.ROOT);
        ProcessGroupStrategy strategy = switch (normalized) {
            case POSIX -> new PosixProcessGroupStrategy(runner);
            case TREE -> new ProcessTreeStrategy();
            case AUTO -> posixSupported(locator) ? new PosixProcessGroupStrategy(runner) : new ProcessTreeStrategy();
            default -> throw new IllegalArgumentException(
                    "Unknown process group mode '" + mode + "' (expected auto, posix or tree)");
        };
        LOG.info("Process group strategy: {} (mode={})", strategy.name(), normalized);
        return strategy;
    }

    private static boolean posixSupported(BinaryLocator locator) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return false;
        }
        return locator.isAvailable("setsid") && locator.isAvailable("kill");
    }
}
