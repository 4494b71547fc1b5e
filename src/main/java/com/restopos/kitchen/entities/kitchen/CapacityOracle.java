package com.restopos.kitchen.entities.kitchen;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.restopos.kitchen.config.ConfigKey;
import com.restopos.kitchen.config.ConfigReader;
import com.restopos.kitchen.store.IOrderStore;

import java.time.Clock;

/**
 * Answers how much concurrent preparation capacity the kitchen has and how much of it is in use.
 * <p>
 * Nothing is cached: every call reads the configured ceiling and counts the in-preparation orders of the current
 * operating day again. The ceiling read never fails (see {@link ConfigReader}); a failing load count propagates as
 * {@link com.restopos.kitchen.store.StoreException} since a guessed load could overfill the kitchen.
 */
@Singleton public class CapacityOracle {

    private final IOrderStore orderStore;
    private final ConfigReader configReader;
    private final Clock clock;

    @Inject public CapacityOracle(IOrderStore orderStore, ConfigReader configReader, Clock clock) {
        this.orderStore = orderStore;
        this.configReader = configReader;
        this.clock = clock;
    }

    public int maxCapacity() {
        return configReader.readInt(ConfigKey.MaxConcurrentPreparations);
    }

    public int currentLoad() {
        return orderStore.countInPreparation(OperatingDay.of(clock));
    }

    public int availableSlots() {
        return snapshot().getAvailableSlots();
    }

    public boolean isFull() {
        return availableSlots() == 0;
    }

    public CapacitySnapshot snapshot() {
        return new CapacitySnapshot(maxCapacity(), currentLoad());
    }
}
