package com.example.fulfillment.infrastructure.persistence;

import com.example.fulfillment.application.port.out.SettingsPort;
import com.example.fulfillment.infrastructure.persistence.entity.SettingEntity;
import com.example.fulfillment.infrastructure.persistence.repository.SettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Settings lookup: a row of the settings table wins over the application
 * properties, which in turn carry the deployment defaults.
 */
@Component
public class SettingsAdapter implements SettingsPort {

    private static final Logger log = LoggerFactory.getLogger(SettingsAdapter.class);

    private final SettingRepository repository;
    private final Environment environment;

    public SettingsAdapter(SettingRepository repository, Environment environment) {
        this.repository = repository;
        this.environment = environment;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> get(String key) {
        Optional<String> stored = repository.findById(key).map(SettingEntity::getValue);
        if (stored.isPresent()) {
            return stored;
        }
        return Optional.ofNullable(environment.getProperty(key));
    }

    /**
     * Inserts or replaces a runtime setting.
     */
    @Transactional
    public void put(String key, String value) {
        SettingEntity entity = repository.findById(key).orElseGet(() -> {
            SettingEntity created = new SettingEntity();
            created.setKey(key);
            return created;
        });
        entity.setValue(value);
        repository.save(entity);
        log.info("Setting {} updated to '{}'", key, value);
    }

    @Transactional
    public void remove(String key) {
        repository.deleteById(key);
    }
}
