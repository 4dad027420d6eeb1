package com.phillippitts.multiroomaudio.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the persisted player configuration ({@code player.store.*}).
 */
@ConfigurationProperties(prefix = "player.store")
@Validated
public class PlayerStoreProperties {

    /** YAML file holding every player, keyed by name. */
    @NotBlank(message = "Player store path must not be blank")
    private String path = "config/players.yaml";

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
