package com.restopos.kitchen.entities.kitchen.observers;

import com.google.common.base.MoreObjects;

import java.time.Duration;
import java.time.Instant;

/**
 * An order still in preparation after its expected finish.
 */
public class LateOrder {

    private final String orderId;
    private final String customerName;
    private final Instant expectedFinishAt;
    private final long minutesLate;

    public LateOrder(String orderId, String customerName, Instant expectedFinishAt, Instant now) {
        this.orderId = orderId;
        this.customerName = customerName;
        this.expectedFinishAt = expectedFinishAt;
        this.minutesLate = Duration.between(expectedFinishAt, now).toMinutes();
    }

    public String getOrderId() {
        return orderId;
    }

    public String getCustomerName() {
        return customerName;
    }

    public Instant getExpectedFinishAt() {
        return expectedFinishAt;
    }

    public long getMinutesLate() {
        return minutesLate;
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(LateOrder.class).add("orderId", orderId).add("expectedFinishAt", expectedFinishAt)
            .add("minutesLate", minutesLate).toString();
    }
}
