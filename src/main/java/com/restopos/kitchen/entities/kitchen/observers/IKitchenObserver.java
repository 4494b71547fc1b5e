package com.restopos.kitchen.entities.kitchen.observers;

import com.restopos.kitchen.entities.kitchen.CapacitySnapshot;

import java.util.List;

/**
 * An observer that listens to kitchen events published by the scheduling engine, e.g. the POS screens refreshing the
 * kitchen board, or the kitchen floor picking up newly promoted orders.
 * <p>
 * Notifications are sent from the scheduler thread after the corresponding changes are committed. Implementers should
 * not block it; any heavy duty work should be offloaded from the notifying thread.
 */
public interface IKitchenObserver {

    /**
     * Called once per order an admission pass moved to a new state.
     *
     * @param stateChange
     */
    void onOrderStateChanged(OrderStateChange stateChange);

    /**
     * Called after an admission pass promoted at least one order.
     *
     * @param capacity
     */
    void onCapacityUpdated(CapacitySnapshot capacity);

    /**
     * Called by the late order sweep when at least one order has passed its expected finish.
     *
     * @param lateOrders
     */
    void onLateOrders(List<LateOrder> lateOrders);
}
