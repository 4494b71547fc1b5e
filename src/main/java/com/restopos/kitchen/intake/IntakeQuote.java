package com.restopos.kitchen.intake;

import com.google.common.base.MoreObjects;
import com.restopos.kitchen.entities.orders.OrderPriority;

import java.time.Instant;

/**
 * What the customer is told when an order is taken.
 */
public class IntakeQuote {

    private final String orderId;
    private final OrderPriority priority;
    private final int estimatedDurationMinutes;
    private final int kitchenDelayMinutes;
    private final Instant estimatedReadyAt;
    private final boolean startedImmediately;

    public IntakeQuote(String orderId, OrderPriority priority, int estimatedDurationMinutes, int kitchenDelayMinutes,
        Instant estimatedReadyAt, boolean startedImmediately) {
        this.orderId = orderId;
        this.priority = priority;
        this.estimatedDurationMinutes = estimatedDurationMinutes;
        this.kitchenDelayMinutes = kitchenDelayMinutes;
        this.estimatedReadyAt = estimatedReadyAt;
        this.startedImmediately = startedImmediately;
    }

    public String getOrderId() {
        return orderId;
    }

    public OrderPriority getPriority() {
        return priority;
    }

    public int getEstimatedDurationMinutes() {
        return estimatedDurationMinutes;
    }

    public int getKitchenDelayMinutes() {
        return kitchenDelayMinutes;
    }

    public Instant getEstimatedReadyAt() {
        return estimatedReadyAt;
    }

    /**
     * @return true if the order went into preparation while it was taken.
     */
    public boolean isStartedImmediately() {
        return startedImmediately;
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(IntakeQuote.class).add("orderId", orderId).add("priority", priority)
            .add("estimatedDurationMinutes", estimatedDurationMinutes).add("kitchenDelayMinutes", kitchenDelayMinutes)
            .add("estimatedReadyAt", estimatedReadyAt).add("startedImmediately", startedImmediately).toString();
    }
}
