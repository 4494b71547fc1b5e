package com.restopos.kitchen.store;

import com.restopos.kitchen.entities.kitchen.OperatingDay;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.entities.orders.OrderState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Defines the contract of the order storage used by the scheduling engine.
 * <p>
 * All reads return copies, a caller can never mutate a stored order directly. The only way the engine changes an order
 * is an {@link AdmissionTransaction}, which holds exclusive row leases on the orders it selected until it commits or
 * rolls back.
 */
public interface IOrderStore {

    /**
     * Inserts or replaces an order. Used by order intake.
     *
     * @param order
     */
    void save(Order order);

    Optional<Order> findById(String orderId);

    /**
     * Counts orders in {@link OrderState#InPreparation} created within the given day.
     *
     * @param day
     * @return
     */
    int countInPreparation(OperatingDay day);

    /**
     * Returns orders in {@link OrderState#InPreparation} created within the given day, ordered by expected finish
     * ascending.
     *
     * @param day
     * @return
     */
    List<Order> findInPreparation(OperatingDay day);

    /**
     * Returns orders in {@link OrderState#InPreparation} created within the given day whose expected finish is before
     * now, ordered by expected finish ascending.
     *
     * @param now
     * @param day
     * @return
     */
    List<Order> findLate(Instant now, OperatingDay day);

    /**
     * Returns delivered orders that have a preparation start and were last modified at or after since, most recently
     * modified first.
     *
     * @param since
     * @param limit
     * @return
     */
    List<Order> findDeliveredSince(Instant since, int limit);

    /**
     * State change performed by collaborators outside the scheduling engine (kitchen floor marking an order ready,
     * delivery, cancellation). Waits for any admission pass holding the order's row lease.
     *
     * @param orderId
     * @param expected
     * @param newState
     * @param at
     * @return true if the order was in the expected state and got updated.
     */
    boolean updateState(String orderId, OrderState expected, OrderState newState, Instant at);

    /**
     * Starts an admission pass. Blocks while another admission pass on this store is running.
     *
     * @return
     */
    AdmissionTransaction beginAdmission();
}
