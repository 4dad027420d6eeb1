package com.phillippitts.multiroomaudio.util;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves executables against a {@code PATH}-style search list.
 *
 * <p>Used to report provider availability and to pick a process-group strategy; never a
 * precondition for registering a provider.
 */
public final class BinaryLocator {

    private final List<Path> searchPath;

    public BinaryLocator(String pathVariable) {
        List<Path> dirs = new ArrayList<>();
        if (pathVariable != null) {
            for (String entry : pathVariable.split(File.pathSeparator)) {
                if (entry.isBlank() || entry.indexOf('\0') >= 0) {
                    continue;
                }
                dirs.add(Path.of(entry));
            }
        }
        this.searchPath = List.copyOf(dirs);
    }

    public static BinaryLocator fromEnvironment() {
        return new BinaryLocator(System.getenv("PATH"));
    }

    /**
     * Finds an executable by bare name on the search path, or checks an explicit path directly.
     */
    public Optional<Path> locate(String binary) {
        if (binary == null || binary.isBlank()) {
            return Optional.empty();
        }
        if (binary.contains("/") || binary.contains(File.separator)) {
            Path direct = Path.of(binary);
            return Files.isExecutable(direct) ? Optional.of(direct) : Optional.empty();
        }
        for (Path dir : searchPath) {
            Path candidate = dir.resolve(binary);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public boolean isAvailable(String binary) {
        return locate(binary).isPresent();
    }
}
