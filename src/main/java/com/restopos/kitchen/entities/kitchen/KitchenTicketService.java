package com.restopos.kitchen.entities.kitchen;

import com.restopos.kitchen.entities.orders.Order;

import java.util.Optional;

/**
 * Creates the kitchen ticket of a promoted order.
 * <p>
 * Implementations must be idempotent per order: a second call for an order that already has a ticket creates nothing.
 */
public interface KitchenTicketService {

    /**
     * @param order
     * @return true if a ticket was created, false if the order already had one.
     */
    boolean createTicket(Order order);

    Optional<KitchenTicket> findByOrderId(String orderId);
}
