package com.restopos.kitchen.config;

import com.google.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * One shot migration from the legacy configuration key names to the canonical names in {@link ConfigKey}.
 * <p>
 * For every legacy key found, its value is copied to the canonical key unless the canonical key already has a value,
 * and the legacy key is removed. Running it again is a no-op. After the migration only canonical keys are read.
 */
@Slf4j public class ConfigKeyMigration {

    private final SystemConfiguration configuration;

    @Inject public ConfigKeyMigration(SystemConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * @return number of legacy keys removed.
     */
    public int migrate() {
        int migrated = 0;
        for (ConfigKey configKey : ConfigKey.values()) {
            for (String legacyKey : configKey.getLegacyKeys()) {
                Optional<String> legacyValue = configuration.get(legacyKey);
                if (!legacyValue.isPresent()) {
                    continue;
                }
                if (!configuration.get(configKey.getKey()).isPresent()) {
                    configuration.put(configKey.getKey(), legacyValue.get());
                    log.info("Migrated configuration legacyKey={} to key={} value={}", legacyKey, configKey.getKey(), legacyValue.get());
                } else {
                    log.info("Dropping legacyKey={}, key={} already has a value", legacyKey, configKey.getKey());
                }
                configuration.remove(legacyKey);
                migrated++;
            }
        }
        return migrated;
    }
}
