package com.restopos.kitchen.entities.kitchen;

import com.google.common.base.Preconditions;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.restopos.kitchen.config.ConfigKey;
import com.restopos.kitchen.config.ConfigReader;
import com.restopos.kitchen.entities.orders.Order;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Derives the scheduling timestamps of an order.
 * <p>
 * For a scheduled order: preparationStart = requestedDeliveryTime - estimatedDuration. Once promoted:
 * expectedFinish = preparationStartAt + estimatedDuration. "As soon as possible" orders have no start gate.
 * <p>
 * The only I/O is the read of the base duration estimate, which falls back to its default on failure.
 */
@Singleton public class TimingCalculator {

    private final ConfigReader configReader;
    private final Clock clock;

    @Inject public TimingCalculator(ConfigReader configReader, Clock clock) {
        this.configReader = configReader;
        this.clock = clock;
    }

    public int baseDurationMinutes() {
        return configReader.readInt(ConfigKey.BasePreparationDurationMinutes);
    }

    /**
     * @param order
     * @return the order's own estimate if it has one, otherwise the system base estimate.
     */
    public int estimatedDuration(Order order) {
        Integer override = order.getEstimatedDurationMinutes();
        return override != null ? override : baseDurationMinutes();
    }

    /**
     * @param deliveryTime
     * @param durationMinutes
     * @return empty for "as soon as possible" orders (null deliveryTime).
     */
    public Optional<Instant> computePreparationStart(Instant deliveryTime, int durationMinutes) {
        if (deliveryTime == null)
            return Optional.empty();
        return Optional.of(deliveryTime.minus(Duration.ofMinutes(durationMinutes)));
    }

    public Instant computeExpectedFinish(Instant startTimestamp, int durationMinutes) {
        Preconditions.checkNotNull(startTimestamp, "startTimestamp");
        return startTimestamp.plus(Duration.ofMinutes(durationMinutes));
    }

    public boolean readyToStart(Order order) {
        return readyToStart(order, clock.instant());
    }

    /**
     * "As soon as possible" orders can always start. Scheduled orders can start once now reaches their preparation start.
     *
     * @param order
     * @param now
     * @return
     */
    public boolean readyToStart(Order order, Instant now) {
        Optional<Instant> preparationStart = computePreparationStart(order.getRequestedDeliveryTime(), estimatedDuration(order));
        return !preparationStart.isPresent() || !now.isBefore(preparationStart.get());
    }
}
