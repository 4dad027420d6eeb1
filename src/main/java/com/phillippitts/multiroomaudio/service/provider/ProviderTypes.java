package com.phillippitts.multiroomaudio.service.provider;

/**
 * Registry keys of the built-in providers.
 *
 * @since 1.0
 */
public final class ProviderTypes {

    /** Logitech Media Server compatible player. */
    public static final String SQUEEZELITE = "squeezelite";

    /** Music Assistant synchronized stream client. */
    public static final String SENDSPIN = "sendspin";

    /** Snapcast multi-room client. */
    public static final String SNAPCAST = "snapcast";

    /** Used when a stored player has no provider field. */
    public static final String DEFAULT = SQUEEZELITE;

    private ProviderTypes() {
        // Utility class - prevent instantiation
    }
}
