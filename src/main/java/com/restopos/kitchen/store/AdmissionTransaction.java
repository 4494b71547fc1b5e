package com.restopos.kitchen.store;

import com.restopos.kitchen.entities.kitchen.OperatingDay;
import com.restopos.kitchen.entities.orders.Order;

import java.time.Instant;
import java.util.List;

/**
 * One admission pass against the order storage.
 * <p>
 * Reads inside the transaction see committed data. {@link #selectBacklogForUpdate(OperatingDay, int)} takes exclusive
 * row leases on the returned orders; a competing pass asking for the same rows waits until this one finishes and then
 * re-reads them, so rows promoted here no longer match the backlog filter. Promotions are buffered and become visible
 * all together on {@link #commit()}; {@link #rollback()} and {@link #close()} without commit discard them.
 */
public interface AdmissionTransaction extends AutoCloseable {

    int countInPreparation(OperatingDay day);

    /**
     * Selects up to limit backlog orders (Received, autoPromote, created within the day) in admission order, and locks
     * them for the rest of the transaction.
     *
     * @param day
     * @param limit
     * @return copies of the locked orders.
     */
    List<Order> selectBacklogForUpdate(OperatingDay day, int limit);

    /**
     * Buffers the Received -> InPreparation transition of a row locked by this transaction.
     *
     * @param orderId
     * @param startAt
     * @param expectedFinishAt
     * @throws IllegalStateException if the row is not locked by this transaction.
     */
    void promote(String orderId, Instant startAt, Instant expectedFinishAt);

    void commit();

    void rollback();

    /**
     * Rolls back if neither {@link #commit()} nor {@link #rollback()} was called, and releases every lease.
     */
    @Override void close();
}
