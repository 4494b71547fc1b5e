package com.restopos.kitchen.scheduling;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.restopos.kitchen.entities.kitchen.OperatingDay;
import com.restopos.kitchen.entities.kitchen.observers.KitchenNotifier;
import com.restopos.kitchen.entities.kitchen.observers.LateOrder;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.store.IOrderStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Finds today's orders that are still in preparation after their expected finish. It only reads and reports, late
 * orders are left untouched.
 */
@Slf4j @Singleton public class LateOrderSweep {

    private final IOrderStore orderStore;
    private final KitchenNotifier kitchenNotifier;
    private final Clock clock;

    @Inject public LateOrderSweep(IOrderStore orderStore, KitchenNotifier kitchenNotifier, Clock clock) {
        this.orderStore = orderStore;
        this.kitchenNotifier = kitchenNotifier;
        this.clock = clock;
    }

    /**
     * @return late orders, most overdue first.
     * @throws com.restopos.kitchen.store.StoreException if the orders can not be read.
     */
    public List<LateOrder> sweep() {
        Instant now = clock.instant();
        List<Order> orders = orderStore.findLate(now, OperatingDay.of(clock));
        List<LateOrder> lateOrders = orders.stream()
            .map(order -> new LateOrder(order.getId(), order.getCustomerName(), order.getExpectedFinishAt(), now))
            .collect(Collectors.toList());
        if (!lateOrders.isEmpty()) {
            log.warn("Found lateOrders={}", lateOrders);
            kitchenNotifier.notifyLateOrders(lateOrders);
        }
        return lateOrders;
    }
}
