package com.example.fulfillment.support.fakes;

import com.example.fulfillment.application.port.out.SettingsPort;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class InMemorySettings implements SettingsPort {

    private final Map<String, String> values = new HashMap<>();

    public InMemorySettings set(String key, Object value) {
        values.put(key, String.valueOf(value));
        return this;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }
}
