package com.restopos.kitchen.entities.kitchen;

import com.google.common.base.MoreObjects;

import javax.annotation.concurrent.ThreadSafe;

/**
 * Kitchen capacity at one point in time: ceiling, load and what is left.
 */
@ThreadSafe public class CapacitySnapshot {

    private final int maxCapacity;
    private final int currentLoad;

    public CapacitySnapshot(int maxCapacity, int currentLoad) {
        this.maxCapacity = maxCapacity;
        this.currentLoad = currentLoad;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    public int getCurrentLoad() {
        return currentLoad;
    }

    public int getAvailableSlots() {
        return Math.max(0, maxCapacity - currentLoad);
    }

    public boolean isFull() {
        return getAvailableSlots() == 0;
    }

    /**
     * @return load as a rounded percentage of the ceiling, 0 when the ceiling is not positive.
     */
    public int getUtilizationPercent() {
        return maxCapacity > 0 ? (int) Math.round(currentLoad * 100.0 / maxCapacity) : 0;
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(CapacitySnapshot.class).add("maxCapacity", maxCapacity).add("currentLoad", currentLoad)
            .add("availableSlots", getAvailableSlots()).add("utilizationPercent", getUtilizationPercent()).toString();
    }
}
