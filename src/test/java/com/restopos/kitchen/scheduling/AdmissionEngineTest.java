package com.restopos.kitchen.scheduling;

import com.google.common.collect.ImmutableList;
import com.restopos.kitchen.KitchenTestSupport;
import com.restopos.kitchen.entities.kitchen.CapacitySnapshot;
import com.restopos.kitchen.entities.kitchen.KitchenTicket;
import com.restopos.kitchen.entities.kitchen.KitchenTicketService;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.entities.orders.OrderState;
import com.restopos.kitchen.store.StoreException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static com.restopos.kitchen.KitchenTestSupport.asapOrder;
import static com.restopos.kitchen.KitchenTestSupport.at;
import static com.restopos.kitchen.KitchenTestSupport.inPreparationOrder;
import static com.restopos.kitchen.KitchenTestSupport.scheduledOrder;

public class AdmissionEngineTest {

    @Test public void testPromotesAsapOrdersUpToCapacity() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.setCapacity(2);
        kitchen.orderStore.save(asapOrder("a", at("09:00")));
        kitchen.orderStore.save(asapOrder("b", at("09:01")));
        kitchen.orderStore.save(asapOrder("c", at("09:02")));

        AdmissionResult result = kitchen.admissionEngine.evaluate();

        Assertions.assertEquals(AdmissionResult.Outcome.Completed, result.getOutcome());
        Assertions.assertEquals(ImmutableList.of("a", "b"), result.getPromotedOrderIds());
        Assertions.assertEquals(OrderState.InPreparation, kitchen.stateOf("a"));
        Assertions.assertEquals(OrderState.InPreparation, kitchen.stateOf("b"));
        Assertions.assertEquals(OrderState.Received, kitchen.stateOf("c"));

        Order promoted = kitchen.orderStore.findById("a").get();
        Assertions.assertEquals(KitchenTestSupport.OPENING, promoted.getPreparationStartAt());
        Assertions.assertEquals(KitchenTestSupport.OPENING.plus(Duration.ofMinutes(15)), promoted.getExpectedFinishAt());
        Assertions.assertTrue(result.getCapacity().get().isFull());
    }

    @Test public void testHighPriorityIsAdmittedBeforeNormal() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.setCapacity(1);
        // Due right now, but still behind any "as soon as possible" order.
        kitchen.orderStore.save(scheduledOrder("normal", at("08:00"), at("10:10")));
        kitchen.orderStore.save(asapOrder("high", at("09:30")));

        AdmissionResult result = kitchen.admissionEngine.evaluate();

        Assertions.assertEquals(ImmutableList.of("high"), result.getPromotedOrderIds());
        Assertions.assertEquals(OrderState.Received, kitchen.stateOf("normal"));
    }

    @Test public void testFifoWithinPriorityClass() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.setCapacity(1);
        kitchen.orderStore.save(asapOrder("late-comer", at("09:40")));
        kitchen.orderStore.save(asapOrder("first", at("09:10")));
        kitchen.orderStore.save(asapOrder("second", at("09:20")));

        Assertions.assertEquals(ImmutableList.of("first"), kitchen.admissionEngine.evaluate().getPromotedOrderIds());
        kitchen.orderStore.updateState("first", OrderState.InPreparation, OrderState.Ready, at("10:05"));
        Assertions.assertEquals(ImmutableList.of("second"), kitchen.admissionEngine.evaluate().getPromotedOrderIds());
    }

    @Test public void testScheduledOrderWaitsForItsPreparationStart() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        // Base duration 15, so preparation can start at 10:15.
        kitchen.orderStore.save(scheduledOrder("dinner", at("09:00"), at("10:30")));

        AdmissionResult result = kitchen.admissionEngine.evaluate();
        Assertions.assertEquals(AdmissionResult.Outcome.Completed, result.getOutcome());
        Assertions.assertEquals(0, result.getPromotedCount());
        Assertions.assertEquals(1, result.getSkippedCount());
        Assertions.assertEquals(OrderState.Received, kitchen.stateOf("dinner"));

        kitchen.clock.set(at("10:14"));
        Assertions.assertEquals(0, kitchen.admissionEngine.evaluate().getPromotedCount());

        kitchen.clock.set(at("10:15"));
        Assertions.assertEquals(ImmutableList.of("dinner"), kitchen.admissionEngine.evaluate().getPromotedOrderIds());
        Assertions.assertEquals(at("10:30"), kitchen.orderStore.findById("dinner").get().getExpectedFinishAt());
    }

    @Test public void testScheduledOrderUsesItsOwnDurationEstimate() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.orderStore.save(Order.builder().id("roast").createdAt(at("08:00")).requestedDeliveryTime(at("10:30"))
            .estimatedDurationMinutes(30).build());

        AdmissionResult result = kitchen.admissionEngine.evaluate();

        Assertions.assertEquals(ImmutableList.of("roast"), result.getPromotedOrderIds());
        Assertions.assertEquals(at("10:30"), kitchen.orderStore.findById("roast").get().getExpectedFinishAt());
    }

    @Test public void testFullKitchenIsANoOpWithoutTransaction() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.setCapacity(1);
        kitchen.orderStore.save(inPreparationOrder("cooking", at("09:50"), 15));
        kitchen.orderStore.save(asapOrder("waiting", at("09:55")));

        AdmissionResult result = kitchen.admissionEngine.evaluate();

        Assertions.assertEquals(AdmissionResult.Outcome.KitchenFull, result.getOutcome());
        Assertions.assertEquals(0, kitchen.orderStore.admissionsBegun.get());
        Assertions.assertEquals(OrderState.Received, kitchen.stateOf("waiting"));
        Assertions.assertTrue(kitchen.observer.events.isEmpty());
    }

    @Test public void testNoBacklog() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        AdmissionResult result = kitchen.admissionEngine.evaluate();
        Assertions.assertEquals(AdmissionResult.Outcome.NoBacklog, result.getOutcome());
        Assertions.assertEquals(8, result.getCapacity().get().getAvailableSlots());
    }

    @Test public void testCapacityOfTwoScenario() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.setCapacity(2);
        kitchen.orderStore.save(asapOrder("1", at("10:00")));
        kitchen.orderStore.save(asapOrder("2", at("10:01")));
        kitchen.orderStore.save(asapOrder("3", at("10:02")));

        kitchen.clock.set(at("10:05"));
        Assertions.assertEquals(ImmutableList.of("1", "2"), kitchen.admissionEngine.evaluate().getPromotedOrderIds());
        Assertions.assertEquals(OrderState.Received, kitchen.stateOf("3"));

        kitchen.clock.set(at("10:10"));
        Assertions.assertEquals(AdmissionResult.Outcome.KitchenFull, kitchen.admissionEngine.evaluate().getOutcome());

        kitchen.orderStore.updateState("1", OrderState.InPreparation, OrderState.Ready, at("10:14"));
        kitchen.orderStore.updateState("2", OrderState.InPreparation, OrderState.Ready, at("10:15"));
        kitchen.clock.set(at("10:16"));
        AdmissionResult result = kitchen.admissionEngine.evaluate();

        Assertions.assertEquals(ImmutableList.of("3"), result.getPromotedOrderIds());
        Assertions.assertEquals(at("10:16"), kitchen.orderStore.findById("3").get().getPreparationStartAt());
        Assertions.assertEquals(at("10:31"), kitchen.orderStore.findById("3").get().getExpectedFinishAt());
    }

    @Test public void testSkippedOrderDoesNotReleaseItsSlotWithinThePass() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.setCapacity(1);
        kitchen.orderStore.save(scheduledOrder("tonight", at("09:00"), at("20:00")));
        // Preparation start 09:50, so it could start, but the only slot was given to the selection of "tonight".
        kitchen.orderStore.save(scheduledOrder("lunch", at("09:10"), at("10:05")));

        AdmissionResult result = kitchen.admissionEngine.evaluate();

        Assertions.assertEquals(0, result.getPromotedCount());
        Assertions.assertEquals(1, result.getSkippedCount());
        Assertions.assertEquals(OrderState.Received, kitchen.stateOf("lunch"));
    }

    @Test public void testOrdersExcludedFromAutomaticAdmission() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.orderStore.save(Order.builder().id("manual").createdAt(at("09:00")).autoPromote(false).build());
        kitchen.orderStore.save(asapOrder("yesterday", at("09:00").minus(Duration.ofDays(1))));

        Assertions.assertEquals(AdmissionResult.Outcome.NoBacklog, kitchen.admissionEngine.evaluate().getOutcome());
        Assertions.assertEquals(OrderState.Received, kitchen.stateOf("manual"));
        Assertions.assertEquals(OrderState.Received, kitchen.stateOf("yesterday"));
    }

    @Test public void testYesterdaysOrdersDoNotTakeTodaysCapacity() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.setCapacity(1);
        kitchen.orderStore.save(inPreparationOrder("forgotten", at("21:00").minus(Duration.ofDays(1)), 15));
        kitchen.orderStore.save(asapOrder("today", at("09:00")));

        Assertions.assertEquals(ImmutableList.of("today"), kitchen.admissionEngine.evaluate().getPromotedOrderIds());
    }

    @Test public void testFailedCommitRollsBackThePass() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.orderStore.save(asapOrder("a", at("09:00")));
        kitchen.orderStore.save(asapOrder("b", at("09:01")));
        kitchen.orderStore.failCommit = true;

        AdmissionResult result = kitchen.admissionEngine.evaluate();

        Assertions.assertEquals(AdmissionResult.Outcome.Failed, result.getOutcome());
        Assertions.assertTrue(result.getError().get() instanceof StoreException);
        Assertions.assertEquals(OrderState.Received, kitchen.stateOf("a"));
        Assertions.assertEquals(OrderState.Received, kitchen.stateOf("b"));
        Assertions.assertFalse(kitchen.ticketService.findByOrderId("a").isPresent());
        Assertions.assertTrue(kitchen.observer.events.isEmpty());

        // The next pass retries.
        kitchen.orderStore.failCommit = false;
        Assertions.assertEquals(ImmutableList.of("a", "b"), kitchen.admissionEngine.evaluate().getPromotedOrderIds());
    }

    @Test public void testUnreadableLoadFailsThePass() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.orderStore.save(asapOrder("a", at("09:00")));
        kitchen.orderStore.failReads = true;

        AdmissionResult result = kitchen.admissionEngine.evaluate();

        Assertions.assertFalse(result.isSuccessful());
        Assertions.assertEquals(0, kitchen.orderStore.admissionsBegun.get());
        Assertions.assertEquals(OrderState.Received, kitchen.stateOf("a"));
    }

    @Test public void testTicketFailureDoesNotRollBackThePromotion() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        KitchenTicketService failingTicketService = new KitchenTicketService() {
            @Override public boolean createTicket(Order order) {
                throw new IllegalStateException("printer queue down");
            }

            @Override public Optional<KitchenTicket> findByOrderId(String orderId) {
                return Optional.empty();
            }
        };
        AdmissionEngine engine =
            new AdmissionEngine(kitchen.orderStore, kitchen.capacityOracle, kitchen.timingCalculator, failingTicketService,
                kitchen.notifier, kitchen.clock);
        kitchen.orderStore.save(asapOrder("a", at("09:00")));

        AdmissionResult result = engine.evaluate();

        Assertions.assertEquals(ImmutableList.of("a"), result.getPromotedOrderIds());
        Assertions.assertEquals(OrderState.InPreparation, kitchen.stateOf("a"));
        Assertions.assertEquals(1, kitchen.observer.stateChanges.size());
    }

    @Test public void testTicketsAreCreatedOncePerPromotedOrder() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.orderStore.save(asapOrder("a", at("09:00")));

        kitchen.admissionEngine.evaluate();
        kitchen.admissionEngine.evaluate();

        KitchenTicket ticket = kitchen.ticketService.findByOrderId("a").get();
        Assertions.assertEquals(KitchenTicket.SYSTEM_USER, ticket.getCreatedBy());
        Assertions.assertEquals(1, ticket.getLines().size());
        Assertions.assertEquals(1, kitchen.ticketService.getTickets().size());
        Assertions.assertFalse(kitchen.ticketService.createTicket(kitchen.orderStore.findById("a").get()));
    }

    @Test public void testNotificationsAfterCommit() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.setCapacity(2);
        kitchen.orderStore.save(asapOrder("a", at("09:00")));
        kitchen.orderStore.save(asapOrder("b", at("09:01")));

        kitchen.admissionEngine.evaluate();

        Assertions.assertEquals(ImmutableList.of("stateChanged:a", "stateChanged:b", "capacityUpdated"), kitchen.observer.events);
        Assertions.assertEquals(OrderState.Received, kitchen.observer.stateChanges.get(0).getPreviousState());
        Assertions.assertEquals(OrderState.InPreparation, kitchen.observer.stateChanges.get(0).getNewState());
        Assertions.assertEquals(KitchenTestSupport.OPENING.plus(Duration.ofMinutes(15)),
            kitchen.observer.stateChanges.get(0).getOrder().getExpectedFinishAt());

        CapacitySnapshot capacity = kitchen.observer.capacityUpdates.get(0);
        Assertions.assertEquals(2, capacity.getMaxCapacity());
        Assertions.assertEquals(2, capacity.getCurrentLoad());
        Assertions.assertEquals(0, capacity.getAvailableSlots());
        Assertions.assertEquals(100, capacity.getUtilizationPercent());
    }

    @Test public void testNoNotificationsWhenNothingIsPromoted() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.orderStore.save(scheduledOrder("tonight", at("09:00"), at("20:00")));

        kitchen.admissionEngine.evaluate();

        Assertions.assertTrue(kitchen.observer.events.isEmpty());
    }

    @Test public void testEvaluateNowRunsAPass() {
        KitchenTestSupport kitchen = new KitchenTestSupport();
        kitchen.orderStore.save(asapOrder("a", at("09:00")));
        Assertions.assertEquals(ImmutableList.of("a"), kitchen.admissionEngine.evaluateNow().getPromotedOrderIds());
    }
}
