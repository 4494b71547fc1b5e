package com.restopos.kitchen.tuning;

import com.restopos.kitchen.entities.orders.Order;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.Duration;
import java.util.List;

/**
 * Turns delivered orders into statistics of their actual preparation time, from preparation start until the order was
 * last modified (delivery). Durations outside [5, 60] minutes are treated as bookkeeping errors and dropped.
 */
class PreparationHistory {

    static final int MIN_PLAUSIBLE_MINUTES = 5;
    static final int MAX_PLAUSIBLE_MINUTES = 60;

    private PreparationHistory() {
    }

    static DescriptiveStatistics actualDurations(List<Order> deliveredOrders) {
        DescriptiveStatistics statistics = new DescriptiveStatistics();
        for (Order order : deliveredOrders) {
            if (order.getPreparationStartAt() == null)
                continue;
            long minutes = Duration.between(order.getPreparationStartAt(), order.getLastModifiedAt()).toMinutes();
            if (minutes >= MIN_PLAUSIBLE_MINUTES && minutes <= MAX_PLAUSIBLE_MINUTES)
                statistics.addValue(minutes);
        }
        return statistics;
    }
}
