package com.restopos.kitchen.tuning;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.restopos.kitchen.config.ConfigKey;
import com.restopos.kitchen.config.ConfigReader;
import com.restopos.kitchen.config.SchedulerConfig;
import com.restopos.kitchen.entities.kitchen.CapacityOracle;
import com.restopos.kitchen.entities.kitchen.OperatingDay;
import com.restopos.kitchen.entities.kitchen.TimingCalculator;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.store.IOrderStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Predicts how long a new order has to wait for a kitchen slot.
 * <p>
 * Zero while there are free slots. Otherwise the minutes until the earliest expected finish among the orders in
 * preparation, plus half of the recent average preparation time, capped at 60 minutes.
 */
@Slf4j @Singleton public class DelayPredictor {

    static final int MAX_DELAY_MINUTES = 60;
    static final double BUFFER_RATIO = 0.5;

    private final IOrderStore orderStore;
    private final CapacityOracle capacityOracle;
    private final TimingCalculator timingCalculator;
    private final ConfigReader configReader;
    private final SchedulerConfig schedulerConfig;
    private final Clock clock;

    @Inject public DelayPredictor(IOrderStore orderStore, CapacityOracle capacityOracle, TimingCalculator timingCalculator,
        ConfigReader configReader, SchedulerConfig schedulerConfig, Clock clock) {
        this.orderStore = orderStore;
        this.capacityOracle = capacityOracle;
        this.timingCalculator = timingCalculator;
        this.configReader = configReader;
        this.schedulerConfig = schedulerConfig;
        this.clock = clock;
    }

    public int predictDelayMinutes() {
        try {
            Instant now = clock.instant();
            List<Order> inPreparation = orderStore.findInPreparation(OperatingDay.of(clock));
            if (capacityOracle.maxCapacity() - inPreparation.size() > 0) {
                return 0;
            }

            long untilFirstRelease = 0;
            // Sorted by expected finish, so the first order with one frees the earliest slot.
            for (Order order : inPreparation) {
                if (order.getExpectedFinishAt() != null) {
                    untilFirstRelease = Math.max(0, Math.round(Duration.between(now, order.getExpectedFinishAt()).toMillis() / 60000.0));
                    break;
                }
            }

            Instant since = now.minus(Duration.ofDays(schedulerConfig.getDelayLookbackDays()));
            DescriptiveStatistics durations = PreparationHistory.actualDurations(orderStore.findDeliveredSince(since, Integer.MAX_VALUE));
            double average = durations.getN() > 0 ? durations.getMean() : timingCalculator.baseDurationMinutes();

            long delay = untilFirstRelease + Math.round(average * BUFFER_RATIO);
            return (int) Math.max(0, Math.min(delay, MAX_DELAY_MINUTES));
        } catch (RuntimeException e) {
            log.warn("Could not predict the kitchen delay, assuming none", e);
            return 0;
        }
    }

    /**
     * Stores the predicted delay under {@link ConfigKey#KitchenDelayMinutes}, where intake and the POS screens read it.
     *
     * @return the predicted delay.
     */
    public int publishDelay() {
        int delay = predictDelayMinutes();
        try {
            configReader.writeInt(ConfigKey.KitchenDelayMinutes, delay);
            log.info("Kitchen delay updated, delayMinutes={}", delay);
        } catch (RuntimeException e) {
            log.warn("Could not store the kitchen delay={}", delay, e);
        }
        return delay;
    }
}
