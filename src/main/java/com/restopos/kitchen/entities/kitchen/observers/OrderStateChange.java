package com.restopos.kitchen.entities.kitchen.observers;

import com.google.common.base.MoreObjects;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.entities.orders.OrderState;

import java.time.Instant;

/**
 * A state transition of one order, with a copy of the order as it was right after the transition.
 */
public class OrderStateChange {

    private final String orderId;
    private final OrderState previousState;
    private final OrderState newState;
    private final Instant changedAt;
    private final Order order;

    public OrderStateChange(Order order, OrderState previousState, Instant changedAt) {
        this.orderId = order.getId();
        this.order = order;
        this.previousState = previousState;
        this.newState = order.getOrderState();
        this.changedAt = changedAt;
    }

    public String getOrderId() {
        return orderId;
    }

    public OrderState getPreviousState() {
        return previousState;
    }

    public OrderState getNewState() {
        return newState;
    }

    public Instant getChangedAt() {
        return changedAt;
    }

    public Order getOrder() {
        return order;
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(OrderStateChange.class).add("orderId", orderId).add("previousState", previousState)
            .add("newState", newState).add("changedAt", changedAt).toString();
    }
}
