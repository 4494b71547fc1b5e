package com.restopos.kitchen.tuning;

import com.google.common.base.MoreObjects;

/**
 * Advisory capacity suggestion derived from recent kitchen behaviour. It is never applied automatically.
 */
public class CapacityRecommendation {

    public enum Trend {
        Increase, Maintain, Decrease
    }

    private final int currentCapacity;
    private final int recommendedCapacity;
    private final Trend trend;
    private final long sampleCount;
    private final double averageMinutes;
    private final int lateOrders;
    private final int ordersInPreparation;

    public CapacityRecommendation(int currentCapacity, int recommendedCapacity, Trend trend, long sampleCount, double averageMinutes,
        int lateOrders, int ordersInPreparation) {
        this.currentCapacity = currentCapacity;
        this.recommendedCapacity = recommendedCapacity;
        this.trend = trend;
        this.sampleCount = sampleCount;
        this.averageMinutes = averageMinutes;
        this.lateOrders = lateOrders;
        this.ordersInPreparation = ordersInPreparation;
    }

    public static CapacityRecommendation maintain(int currentCapacity) {
        return new CapacityRecommendation(currentCapacity, currentCapacity, Trend.Maintain, 0, Double.NaN, 0, 0);
    }

    public int getCurrentCapacity() {
        return currentCapacity;
    }

    public int getRecommendedCapacity() {
        return recommendedCapacity;
    }

    public Trend getTrend() {
        return trend;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    /**
     * @return average actual preparation minutes of the analysed deliveries, NaN without samples.
     */
    public double getAverageMinutes() {
        return averageMinutes;
    }

    public int getLateOrders() {
        return lateOrders;
    }

    public int getOrdersInPreparation() {
        return ordersInPreparation;
    }

    public double getLatePercent() {
        return ordersInPreparation == 0 ? 0 : lateOrders * 100.0 / ordersInPreparation;
    }

    public boolean isAdjustmentNeeded() {
        return trend != Trend.Maintain;
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(CapacityRecommendation.class).add("currentCapacity", currentCapacity)
            .add("recommendedCapacity", recommendedCapacity).add("trend", trend).add("sampleCount", sampleCount)
            .add("averageMinutes", averageMinutes).add("lateOrders", lateOrders).add("ordersInPreparation", ordersInPreparation)
            .toString();
    }
}
