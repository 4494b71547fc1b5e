package com.restopos.kitchen.config;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Canonical keys of the runtime system configuration read by the scheduling engine.
 * <p>
 * Each key carries its hardcoded default, which is used whenever the stored value is missing, unparsable or below
 * {@link #getMinValue()}. Keys that were renamed over time keep their previous names in {@link #getLegacyKeys()}, so
 * {@link ConfigKeyMigration} can move old values to the canonical key once at startup.
 */
public enum ConfigKey {

    MaxConcurrentPreparations("max_concurrent_preparations", 8, 1, "MAX_PEDIDOS_EN_PREPARACION", "max_pedidos_en_preparacion"),
    TickIntervalSeconds("tick_interval_seconds", 30, 1, "INTERVALO_WORKER_SEGUNDOS", "worker_interval_segundos"),
    BasePreparationDurationMinutes("base_preparation_duration_minutes", 15, 1, "TIEMPO_BASE_PEDIDO_MINUTOS",
        "tiempo_base_preparacion_minutos"),
    KitchenDelayMinutes("kitchen_delay_minutes", 0, 0, "DEMORA_COCINA_MANUAL_MINUTOS", "demora_cocina_minutos");

    private final String key;
    private final int defaultValue;
    private final int minValue;
    private final List<String> legacyKeys;

    ConfigKey(String key, int defaultValue, int minValue, String... legacyKeys) {
        this.key = key;
        this.defaultValue = defaultValue;
        this.minValue = minValue;
        this.legacyKeys = ImmutableList.copyOf(legacyKeys);
    }

    public String getKey() {
        return key;
    }

    public int getDefaultValue() {
        return defaultValue;
    }

    public int getMinValue() {
        return minValue;
    }

    public List<String> getLegacyKeys() {
        return legacyKeys;
    }
}
