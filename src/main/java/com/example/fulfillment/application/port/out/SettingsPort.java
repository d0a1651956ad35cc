package com.example.fulfillment.application.port.out;

import java.util.Optional;

/**
 * Outbound port for named runtime settings.
 */
public interface SettingsPort {

    /**
     * Raw value of a setting, if configured anywhere.
     */
    Optional<String> get(String key);
}
