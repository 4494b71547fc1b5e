package com.restopos.kitchen.daemons;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import com.restopos.kitchen.common.ExecutorServicesUtil;
import com.restopos.kitchen.entities.kitchen.CapacitySnapshot;
import com.restopos.kitchen.entities.kitchen.observers.IKitchenObserver;
import com.restopos.kitchen.entities.kitchen.observers.KitchenNotifier;
import com.restopos.kitchen.entities.kitchen.observers.LateOrder;
import com.restopos.kitchen.entities.kitchen.observers.OrderStateChange;
import com.restopos.kitchen.entities.orders.OrderState;
import com.restopos.kitchen.store.IOrderStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Plays the kitchen staff in the simulation. It listens to orders entering preparation and, after a random delay, marks
 * them ready, then delivered after another random delay (mimicking cooks and pickups). This produces the delivery
 * history the adaptive tuning learns from.
 */
@Slf4j @Singleton public class KitchenFloorSimulator implements IKitchenObserver {

    private static final String FLOOR_THREAD_NAME_PREFIX = "kitchen-floor-";
    private static final int THREAD_COUNT = 4;
    private final Random random = new Random();

    private final int minDelayForReadyInSecs, maxDelayForReadyInSecs;
    private final IOrderStore orderStore;
    private final KitchenNotifier kitchenNotifier;
    private final Clock clock;
    private volatile ScheduledExecutorService scheduledExecutorService;

    @Inject public KitchenFloorSimulator(IOrderStore orderStore, KitchenNotifier kitchenNotifier, Clock clock,
        @Named("minDelayForReadyInSecs") int minDelayForReadyInSecs, @Named("maxDelayForReadyInSecs") int maxDelayForReadyInSecs) {
        this.orderStore = orderStore;
        this.kitchenNotifier = kitchenNotifier;
        this.clock = clock;
        this.minDelayForReadyInSecs = minDelayForReadyInSecs;
        this.maxDelayForReadyInSecs = maxDelayForReadyInSecs;
    }

    public void startBackgroundActivities() {
        this.scheduledExecutorService = ExecutorServicesUtil
            .createScheduledThreadPool(FLOOR_THREAD_NAME_PREFIX, THREAD_COUNT, ExecutorServicesUtil.WAIT_TIME_TO_SHUTDOWN_MS);
        kitchenNotifier.addObserver(this);
        log.info("Started background activities - done.");
    }

    public void stopBackgroundActivities() {
        kitchenNotifier.removeObserver(this);
        if (scheduledExecutorService != null)
            ExecutorServicesUtil.shutdownNow(scheduledExecutorService);
    }

    @Override public void onOrderStateChanged(OrderStateChange stateChange) {
        if (stateChange.getNewState() != OrderState.InPreparation || scheduledExecutorService == null)
            return;
        String orderId = stateChange.getOrderId();
        scheduledExecutorService.schedule(() -> {
            if (orderStore.updateState(orderId, OrderState.InPreparation, OrderState.Ready, clock.instant())) {
                log.info("Order ready, orderId={}", orderId);
                scheduledExecutorService.schedule(() -> deliver(orderId), randomDelay(), TimeUnit.SECONDS);
            }
        }, randomDelay(), TimeUnit.SECONDS);
    }

    @Override public void onCapacityUpdated(CapacitySnapshot capacity) {
        log.debug("Kitchen capacity={}", capacity);
    }

    @Override public void onLateOrders(List<LateOrder> lateOrders) {
        log.debug("Kitchen is running late on lateOrders={}", lateOrders.size());
    }

    private void deliver(String orderId) {
        if (orderStore.updateState(orderId, OrderState.Ready, OrderState.Delivered, clock.instant()))
            log.info("Order delivered, orderId={}", orderId);
    }

    /**
     * @return a random delay between minDelayForReadyInSecs and maxDelayForReadyInSecs, both inclusive.
     */
    private int randomDelay() {
        return minDelayForReadyInSecs + random.nextInt(maxDelayForReadyInSecs - minDelayForReadyInSecs + 1);
    }
}
