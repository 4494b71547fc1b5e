package com.restopos.kitchen.entities.kitchen.observers;

import com.google.common.collect.ImmutableList;
import com.restopos.kitchen.RecordingObserver;
import com.restopos.kitchen.entities.kitchen.CapacitySnapshot;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.restopos.kitchen.KitchenTestSupport.at;

public class KitchenNotifierTest {

    private static class FailingObserver implements IKitchenObserver {
        @Override public void onOrderStateChanged(OrderStateChange stateChange) {
            throw new IllegalStateException("socket closed");
        }

        @Override public void onCapacityUpdated(CapacitySnapshot capacity) {
            throw new IllegalStateException("socket closed");
        }

        @Override public void onLateOrders(List<LateOrder> lateOrders) {
            throw new IllegalStateException("socket closed");
        }
    }

    @Test public void testFailingObserverDoesNotStopTheOthers() {
        KitchenNotifier notifier = new KitchenNotifier();
        RecordingObserver recordingObserver = new RecordingObserver();
        notifier.addObserver(new FailingObserver());
        notifier.addObserver(recordingObserver);

        notifier.notifyCapacityUpdated(new CapacitySnapshot(8, 3));
        notifier.notifyLateOrders(ImmutableList.of(new LateOrder("a", "Lucia", at("10:00"), at("10:05"))));

        Assertions.assertEquals(ImmutableList.of("capacityUpdated", "lateOrders"), recordingObserver.events);
    }

    @Test public void testRemovedObserverIsNotNotified() {
        KitchenNotifier notifier = new KitchenNotifier();
        RecordingObserver recordingObserver = new RecordingObserver();
        Assertions.assertTrue(notifier.addObserver(recordingObserver));
        Assertions.assertTrue(notifier.removeObserver(recordingObserver));

        notifier.notifyCapacityUpdated(new CapacitySnapshot(8, 3));

        Assertions.assertTrue(recordingObserver.events.isEmpty());
        Assertions.assertFalse(notifier.removeObserver(recordingObserver));
    }
}
