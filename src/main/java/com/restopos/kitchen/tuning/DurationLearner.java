package com.restopos.kitchen.tuning;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.restopos.kitchen.config.ConfigKey;
import com.restopos.kitchen.config.ConfigReader;
import com.restopos.kitchen.config.SchedulerConfig;
import com.restopos.kitchen.store.IOrderStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Learns the base preparation estimate from how long recently delivered orders actually took.
 */
@Slf4j @Singleton public class DurationLearner {

    static final int MIN_ESTIMATE_MINUTES = 10;
    static final int MAX_ESTIMATE_MINUTES = 45;
    static final int SIGNIFICANT_CHANGE_MINUTES = 2;
    static final double MAX_ITEMS_FACTOR = 1.5;
    static final double ITEM_FACTOR = 0.05;

    private final IOrderStore orderStore;
    private final ConfigReader configReader;
    private final SchedulerConfig schedulerConfig;
    private final Clock clock;

    @Inject public DurationLearner(IOrderStore orderStore, ConfigReader configReader, SchedulerConfig schedulerConfig, Clock clock) {
        this.orderStore = orderStore;
        this.configReader = configReader;
        this.schedulerConfig = schedulerConfig;
        this.clock = clock;
    }

    /**
     * Mean actual duration of the most recent deliveries, clamped to [10, 45] minutes.
     *
     * @return empty when there is not enough history, or the history can not be read.
     */
    public Optional<Integer> learnedDuration() {
        try {
            Instant since = clock.instant().minus(Duration.ofDays(schedulerConfig.getLearningLookbackDays()));
            DescriptiveStatistics durations =
                PreparationHistory.actualDurations(orderStore.findDeliveredSince(since, schedulerConfig.getLearningSampleLimit()));
            if (durations.getN() < schedulerConfig.getMinHistorySamples()) {
                log.info("Not enough history to learn the preparation duration, samples={}", durations.getN());
                return Optional.empty();
            }
            return Optional.of(clamp((int) Math.round(durations.getMean())));
        } catch (RuntimeException e) {
            log.warn("Could not learn the preparation duration", e);
            return Optional.empty();
        }
    }

    /**
     * Replaces the configured base estimate with the learned one when they differ by more than 2 minutes.
     *
     * @return the base estimate in effect after the call.
     */
    public int recalibrateBaseDuration() {
        int current = configReader.readInt(ConfigKey.BasePreparationDurationMinutes);
        Optional<Integer> learned = learnedDuration();
        if (!learned.isPresent() || Math.abs(learned.get() - current) <= SIGNIFICANT_CHANGE_MINUTES) {
            return current;
        }
        try {
            configReader.writeInt(ConfigKey.BasePreparationDurationMinutes, learned.get());
            log.info("Base preparation duration updated from={} to={} minutes", current, learned.get());
            return learned.get();
        } catch (RuntimeException e) {
            log.warn("Could not store the learned preparation duration={}", learned.get(), e);
            return current;
        }
    }

    /**
     * Quote for an order with the given number of items: the learned estimate (or the configured base) grown by 5% per
     * item, at most 50%, clamped to [10, 45] minutes. Only used for quotes, admission always uses
     * {@link com.restopos.kitchen.entities.kitchen.TimingCalculator#estimatedDuration}.
     *
     * @param itemCount
     * @return
     */
    public int estimateForItems(int itemCount) {
        int base = learnedDuration().orElseGet(() -> configReader.readInt(ConfigKey.BasePreparationDurationMinutes));
        return itemsAdjusted(base, itemCount);
    }

    @VisibleForTesting static int itemsAdjusted(int baseMinutes, int itemCount) {
        double factor = Math.min(MAX_ITEMS_FACTOR, 1 + Math.max(0, itemCount) * ITEM_FACTOR);
        return clamp((int) Math.round(baseMinutes * factor));
    }

    private static int clamp(int minutes) {
        return Math.max(MIN_ESTIMATE_MINUTES, Math.min(MAX_ESTIMATE_MINUTES, minutes));
    }
}
