package com.phillippitts.multiroomaudio.service.player;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Player name rules. Names double as process keys and log file names, so they are limited to
 * letters, digits, spaces, dashes, underscores and apostrophes.
 */
public final class PlayerNameValidator {

    public static final int MAX_NAME_LENGTH = 100;

    private PlayerNameValidator() {
    }

    /**
     * @return an error message, or empty when {@code name} is acceptable
     */
    public static Optional<String> validate(String name) {
        if (name == null || name.isBlank()) {
            return Optional.of("Name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            return Optional.of("Name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        Set<Character> invalid = new LinkedHashSet<>();
        for (char c : name.toCharArray()) {
            if (!isAllowed(c)) {
                invalid.add(c);
            }
        }
        if (!invalid.isEmpty()) {
            StringJoiner chars = new StringJoiner(", ");
            invalid.forEach(c -> chars.add("'" + c + "'"));
            return Optional.of("Name contains invalid characters: " + chars);
        }
        if (!name.equals(name.strip())) {
            return Optional.of("Name must not start or end with a space");
        }
        return Optional.empty();
    }

    private static boolean isAllowed(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == ' ' || c == '-' || c == '_' || c == '\'';
    }
}
