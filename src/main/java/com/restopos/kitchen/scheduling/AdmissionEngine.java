package com.restopos.kitchen.scheduling;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.restopos.kitchen.entities.kitchen.CapacityOracle;
import com.restopos.kitchen.entities.kitchen.CapacitySnapshot;
import com.restopos.kitchen.entities.kitchen.KitchenTicketService;
import com.restopos.kitchen.entities.kitchen.OperatingDay;
import com.restopos.kitchen.entities.kitchen.TimingCalculator;
import com.restopos.kitchen.entities.kitchen.observers.KitchenNotifier;
import com.restopos.kitchen.entities.kitchen.observers.OrderStateChange;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.entities.orders.OrderPriority;
import com.restopos.kitchen.entities.orders.OrderState;
import com.restopos.kitchen.store.AdmissionTransaction;
import com.restopos.kitchen.store.IOrderStore;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Moves orders from the backlog into active preparation while respecting the kitchen capacity.
 * <p>
 * A pass works as follows:
 * <ol>
 * <li>If the kitchen has no free slot, return without starting a transaction.</li>
 * <li>Inside one {@link AdmissionTransaction}, count the orders in preparation again and lock up to that many free
 * slots worth of backlog orders, High before Normal, oldest first.</li>
 * <li>Promote every locked order that can start now. A Normal order whose preparation start is still in the future is
 * left in the backlog; its slot stays unused until the next pass.</li>
 * <li>Commit. Any failure up to here rolls the whole pass back.</li>
 * <li>After the commit, create the kitchen tickets and notify observers, both best effort.</li>
 * </ol>
 * Passes may overlap (scheduler tick and a manual evaluation, several processes on one store); the transaction makes
 * sure an order is promoted at most once and the kitchen ceiling is never exceeded.
 */
@Slf4j @ThreadSafe @Singleton public class AdmissionEngine {

    private final IOrderStore orderStore;
    private final CapacityOracle capacityOracle;
    private final TimingCalculator timingCalculator;
    private final KitchenTicketService kitchenTicketService;
    private final KitchenNotifier kitchenNotifier;
    private final Clock clock;

    @Inject public AdmissionEngine(IOrderStore orderStore, CapacityOracle capacityOracle, TimingCalculator timingCalculator,
        KitchenTicketService kitchenTicketService, KitchenNotifier kitchenNotifier, Clock clock) {
        this.orderStore = orderStore;
        this.capacityOracle = capacityOracle;
        this.timingCalculator = timingCalculator;
        this.kitchenTicketService = kitchenTicketService;
        this.kitchenNotifier = kitchenNotifier;
        this.clock = clock;
    }

    /**
     * Runs one admission pass. Never throws; a failed pass is reported through {@link AdmissionResult#getError()}.
     *
     * @return
     */
    public AdmissionResult evaluate() {
        Instant now = clock.instant();
        OperatingDay day = OperatingDay.of(clock);

        int maxCapacity = capacityOracle.maxCapacity();
        CapacitySnapshot before;
        try {
            before = new CapacitySnapshot(maxCapacity, capacityOracle.currentLoad());
        } catch (RuntimeException e) {
            log.error("Could not read the kitchen load, skipping admission pass", e);
            return AdmissionResult.failed(e);
        }
        if (before.isFull()) {
            log.debug("Kitchen is full, capacity={}", before);
            return AdmissionResult.kitchenFull(before);
        }

        List<Order> promoted = new ArrayList<>();
        int skipped = 0;
        int loadAtCommit;
        try (AdmissionTransaction transaction = orderStore.beginAdmission()) {
            // The load may have changed since the pre-check, only the count taken inside the transaction is reliable.
            int load = transaction.countInPreparation(day);
            int availableSlots = Math.max(0, maxCapacity - load);
            if (availableSlots == 0) {
                transaction.rollback();
                return AdmissionResult.kitchenFull(new CapacitySnapshot(maxCapacity, load));
            }

            List<Order> candidates = transaction.selectBacklogForUpdate(day, availableSlots);
            if (candidates.isEmpty()) {
                transaction.rollback();
                return AdmissionResult.noBacklog(new CapacitySnapshot(maxCapacity, load));
            }

            for (Order candidate : candidates) {
                if (candidate.getPriority() == OrderPriority.Normal && !timingCalculator.readyToStart(candidate, now)) {
                    log.debug("Not yet time to start orderId={}, requestedDeliveryTime={}", candidate.getId(),
                        candidate.getRequestedDeliveryTime());
                    skipped++;
                    continue;
                }
                Instant expectedFinishAt = timingCalculator.computeExpectedFinish(now, timingCalculator.estimatedDuration(candidate));
                transaction.promote(candidate.getId(), now, expectedFinishAt);
                // Selection returns copies, so this only builds the post commit view of the order.
                candidate.applyPromotion(now, expectedFinishAt);
                promoted.add(candidate);
            }

            transaction.commit();
            loadAtCommit = load + promoted.size();
        } catch (RuntimeException e) {
            log.error("Admission pass failed and was rolled back", e);
            return AdmissionResult.failed(e);
        }

        CapacitySnapshot after = new CapacitySnapshot(maxCapacity, loadAtCommit);
        List<String> promotedOrderIds = promoted.stream().map(Order::getId).collect(Collectors.toList());
        log.info("Admission pass done, promotedOrderIds={}, skipped={}, capacity={}", promotedOrderIds, skipped, after);

        for (Order order : promoted) {
            createTicket(order);
        }
        if (!promoted.isEmpty()) {
            for (Order order : promoted) {
                kitchenNotifier.notifyOrderStateChanged(new OrderStateChange(order, OrderState.Received, now));
            }
            kitchenNotifier.notifyCapacityUpdated(after);
        }
        return AdmissionResult.completed(promotedOrderIds, skipped, after);
    }

    /**
     * Out of cycle pass, e.g. right after an "as soon as possible" order was taken. Safe to call while the scheduler is
     * ticking.
     *
     * @return
     */
    public AdmissionResult evaluateNow() {
        log.info("Manual admission pass requested");
        return evaluate();
    }

    private void createTicket(Order order) {
        try {
            kitchenTicketService.createTicket(order);
        } catch (RuntimeException e) {
            log.error("Could not create kitchen ticket for orderId={}, the order stays in preparation", order.getId(), e);
        }
    }
}
