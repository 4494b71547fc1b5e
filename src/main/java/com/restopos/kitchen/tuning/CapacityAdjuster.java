package com.restopos.kitchen.tuning;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.restopos.kitchen.config.SchedulerConfig;
import com.restopos.kitchen.entities.kitchen.CapacityOracle;
import com.restopos.kitchen.entities.kitchen.OperatingDay;
import com.restopos.kitchen.store.IOrderStore;
import com.restopos.kitchen.tuning.CapacityRecommendation.Trend;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Suggests a capacity ceiling from the last hours of kitchen activity.
 * <ul>
 * <li>More than 30% of the orders in preparation are late: decrease.</li>
 * <li>Recent deliveries took less than 10 minutes on average: increase.</li>
 * <li>Recent deliveries took more than 25 minutes on average: decrease.</li>
 * </ul>
 * A step is at most 2 slots and at most 25% of the current ceiling. The suggestion is only logged, the configured
 * ceiling is left alone.
 */
@Slf4j @Singleton public class CapacityAdjuster {

    static final double LATE_PERCENT_THRESHOLD = 30;
    static final double FAST_AVERAGE_MINUTES = 10;
    static final double SLOW_AVERAGE_MINUTES = 25;
    static final int MAX_STEP = 2;
    static final double MAX_STEP_RATIO = 0.25;

    private final IOrderStore orderStore;
    private final CapacityOracle capacityOracle;
    private final SchedulerConfig schedulerConfig;
    private final Clock clock;

    @Inject public CapacityAdjuster(IOrderStore orderStore, CapacityOracle capacityOracle, SchedulerConfig schedulerConfig, Clock clock) {
        this.orderStore = orderStore;
        this.capacityOracle = capacityOracle;
        this.schedulerConfig = schedulerConfig;
        this.clock = clock;
    }

    public CapacityRecommendation recommend() {
        int current = capacityOracle.maxCapacity();
        try {
            Instant now = clock.instant();
            OperatingDay day = OperatingDay.of(clock);
            int inPreparation = orderStore.countInPreparation(day);
            int late = orderStore.findLate(now, day).size();

            Instant since = now.minus(Duration.ofHours(schedulerConfig.getCapacityLookbackHours()));
            DescriptiveStatistics durations = PreparationHistory.actualDurations(orderStore.findDeliveredSince(since, Integer.MAX_VALUE));
            boolean enoughHistory = durations.getN() >= schedulerConfig.getMinHistorySamples();
            double average = durations.getN() > 0 ? durations.getMean() : Double.NaN;

            Trend trend = Trend.Maintain;
            if (inPreparation > 0 && late * 100.0 / inPreparation > LATE_PERCENT_THRESHOLD) {
                trend = Trend.Decrease;
            } else if (enoughHistory && average < FAST_AVERAGE_MINUTES) {
                trend = Trend.Increase;
            } else if (enoughHistory && average > SLOW_AVERAGE_MINUTES) {
                trend = Trend.Decrease;
            }

            CapacityRecommendation recommendation =
                new CapacityRecommendation(current, recommendedCapacity(current, trend), trend, durations.getN(), average, late,
                    inPreparation);
            if (recommendation.isAdjustmentNeeded()) {
                log.info("Capacity adjustment suggested, recommendation={}", recommendation);
            }
            return recommendation;
        } catch (RuntimeException e) {
            log.warn("Could not analyse the kitchen load, keeping capacity={}", current, e);
            return CapacityRecommendation.maintain(current);
        }
    }

    @VisibleForTesting static int recommendedCapacity(int current, Trend trend) {
        switch (trend) {
            case Increase:
                return (int) Math.round(Math.min(current + MAX_STEP, current * (1 + MAX_STEP_RATIO)));
            case Decrease:
                return Math.max(1, (int) Math.round(Math.max(current - MAX_STEP, current * (1 - MAX_STEP_RATIO))));
            default:
                return current;
        }
    }
}
