package com.restopos.kitchen.intake;

import com.google.common.base.Preconditions;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.restopos.kitchen.config.ConfigKey;
import com.restopos.kitchen.config.ConfigReader;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.entities.orders.OrderState;
import com.restopos.kitchen.scheduling.AdmissionEngine;
import com.restopos.kitchen.scheduling.AdmissionResult;
import com.restopos.kitchen.store.IOrderStore;
import com.restopos.kitchen.tuning.DurationLearner;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Entry point for new orders. Stores them in the backlog and, for "as soon as possible" orders, asks the admission
 * engine for an immediate pass instead of waiting for the next scheduler tick.
 */
@Slf4j @Singleton public class OrderIntakeService {

    private final IOrderStore orderStore;
    private final AdmissionEngine admissionEngine;
    private final DurationLearner durationLearner;
    private final ConfigReader configReader;
    private final Clock clock;

    @Inject public OrderIntakeService(IOrderStore orderStore, AdmissionEngine admissionEngine, DurationLearner durationLearner,
        ConfigReader configReader, Clock clock) {
        this.orderStore = orderStore;
        this.admissionEngine = admissionEngine;
        this.durationLearner = durationLearner;
        this.configReader = configReader;
        this.clock = clock;
    }

    /**
     * @param order a new order, in state Received.
     * @return the quote for the customer.
     */
    public IntakeQuote accept(Order order) {
        Preconditions.checkArgument(order.getOrderState() == OrderState.Received, "orderId:%s must be Received, was %s", order.getId(),
            order.getOrderState());
        orderStore.save(order);
        log.info("Accepted orderId={}, priority={}, requestedDeliveryTime={}", order.getId(), order.getPriority(),
            order.getRequestedDeliveryTime());

        int duration = order.getEstimatedDurationMinutes() != null ?
            order.getEstimatedDurationMinutes() :
            durationLearner.estimateForItems(order.getItemCount());
        int delay = configReader.readInt(ConfigKey.KitchenDelayMinutes);

        boolean startedImmediately = false;
        if (order.isAsap() && order.isAutoPromote()) {
            AdmissionResult result = admissionEngine.evaluateNow();
            startedImmediately = result.getPromotedOrderIds().contains(order.getId());
        }

        Instant estimatedReadyAt;
        if (!order.isAsap()) {
            estimatedReadyAt = order.getRequestedDeliveryTime();
        } else {
            int wait = startedImmediately ? 0 : delay;
            estimatedReadyAt = clock.instant().plus(Duration.ofMinutes((long) wait + duration));
        }
        return new IntakeQuote(order.getId(), order.getPriority(), duration, delay, estimatedReadyAt, startedImmediately);
    }
}
