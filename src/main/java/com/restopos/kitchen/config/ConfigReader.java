package com.restopos.kitchen.config;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Reads integer settings from {@link SystemConfiguration}.
 * <p>
 * Reads never fail: a missing key, an unparsable value, a value below the key's minimum, or an exception raised by the
 * configuration storage all resolve to the key's hardcoded default. Nothing is cached, so each call observes the current
 * value.
 */
@Slf4j @Singleton public class ConfigReader {

    private final SystemConfiguration configuration;

    @Inject public ConfigReader(SystemConfiguration configuration) {
        this.configuration = configuration;
    }

    public int readInt(ConfigKey configKey) {
        Optional<String> raw;
        try {
            raw = configuration.get(configKey.getKey());
        } catch (RuntimeException e) {
            log.warn("Could not read configuration key={}, using default={}", configKey.getKey(), configKey.getDefaultValue(), e);
            return configKey.getDefaultValue();
        }
        if (!raw.isPresent()) {
            return configKey.getDefaultValue();
        }
        try {
            int value = Integer.parseInt(raw.get().trim());
            if (value < configKey.getMinValue()) {
                log.warn("Configuration key={} has value={} below minimum={}, using default={}", configKey.getKey(), value,
                    configKey.getMinValue(), configKey.getDefaultValue());
                return configKey.getDefaultValue();
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Configuration key={} has non numeric value={}, using default={}", configKey.getKey(), raw.get(),
                configKey.getDefaultValue());
            return configKey.getDefaultValue();
        }
    }

    /**
     * Writes the value for the key. Unlike reads, failures propagate to the caller.
     *
     * @param configKey
     * @param value
     */
    public void writeInt(ConfigKey configKey, int value) {
        configuration.put(configKey.getKey(), String.valueOf(value));
    }

    /**
     * Stores the value only if the key has no value yet.
     *
     * @param configKey
     * @param value
     * @return true if the value was stored.
     */
    public boolean writeIntIfAbsent(ConfigKey configKey, int value) {
        if (configuration.get(configKey.getKey()).isPresent()) {
            return false;
        }
        writeInt(configKey, value);
        return true;
    }
}
