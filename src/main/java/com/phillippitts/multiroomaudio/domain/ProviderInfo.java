package com.phillippitts.multiroomaudio.domain;

/**
 * Descriptive entry for a registered provider.
 *
 * @param type        registry key, e.g. {@code squeezelite}
 * @param name        human label
 * @param description one-line description
 * @param available   whether the provider's binary was found in this environment
 */
public record ProviderInfo(String type, String name, String description, boolean available) {
}
