package com.restopos.kitchen;

import com.restopos.kitchen.entities.kitchen.CapacitySnapshot;
import com.restopos.kitchen.entities.kitchen.observers.IKitchenObserver;
import com.restopos.kitchen.entities.kitchen.observers.LateOrder;
import com.restopos.kitchen.entities.kitchen.observers.OrderStateChange;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingObserver implements IKitchenObserver {

    public final List<OrderStateChange> stateChanges = new CopyOnWriteArrayList<>();
    public final List<CapacitySnapshot> capacityUpdates = new CopyOnWriteArrayList<>();
    public final List<List<LateOrder>> lateOrderBatches = new CopyOnWriteArrayList<>();
    // Event names in the order they were received.
    public final List<String> events = new CopyOnWriteArrayList<>();

    @Override public void onOrderStateChanged(OrderStateChange stateChange) {
        stateChanges.add(stateChange);
        events.add("stateChanged:" + stateChange.getOrderId());
    }

    @Override public void onCapacityUpdated(CapacitySnapshot capacity) {
        capacityUpdates.add(capacity);
        events.add("capacityUpdated");
    }

    @Override public void onLateOrders(List<LateOrder> lateOrders) {
        lateOrderBatches.add(lateOrders);
        events.add("lateOrders");
    }
}
