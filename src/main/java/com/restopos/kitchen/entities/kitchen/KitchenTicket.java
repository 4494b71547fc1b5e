package com.restopos.kitchen.entities.kitchen;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.entities.orders.OrderLine;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.List;

/**
 * Kitchen facing copy of a promoted order, used by the kitchen floor for visualization and printing. The ticket has no
 * state of its own; the order's state is the source of truth.
 */
@ThreadSafe public class KitchenTicket {

    public static final String SYSTEM_USER = "SYSTEM";

    private final long id;
    private final String orderId;
    private final Instant createdAt;
    private final String customerName;
    private final Instant requestedDeliveryTime;
    private final String notes;
    private final String createdBy;
    private final List<OrderLine> lines;

    public KitchenTicket(long id, Order order, Instant createdAt) {
        this.id = id;
        this.orderId = order.getId();
        this.createdAt = createdAt;
        this.customerName = order.getCustomerName();
        this.requestedDeliveryTime = order.getRequestedDeliveryTime();
        this.notes = order.getNotes();
        this.createdBy = SYSTEM_USER;
        this.lines = ImmutableList.copyOf(order.getLines());
    }

    public long getId() {
        return id;
    }

    public String getOrderId() {
        return orderId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getCustomerName() {
        return customerName;
    }

    public Instant getRequestedDeliveryTime() {
        return requestedDeliveryTime;
    }

    public String getNotes() {
        return notes;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public List<OrderLine> getLines() {
        return lines;
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(KitchenTicket.class).add("id", id).add("orderId", orderId).add("createdAt", createdAt)
            .add("lines", lines.size()).toString();
    }
}
