package com.restopos.kitchen.entities.kitchen.observers;

import com.google.inject.Singleton;
import com.restopos.kitchen.entities.kitchen.CapacitySnapshot;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Fans kitchen events out to the registered {@link IKitchenObserver}s.
 * <p>
 * Notifications are best effort: they are sent after the state they describe is committed, and a failing observer is
 * logged and skipped without affecting the other observers or the caller.
 */
@Slf4j @ThreadSafe @Singleton public class KitchenNotifier {

    /**
     * Observers can be added or removed while a notification is iterating over them, so a thread-safe queue is used.
     */
    private final Queue<IKitchenObserver> observers = new ConcurrentLinkedQueue<>();

    public boolean addObserver(IKitchenObserver observer) {
        return observers.add(observer);
    }

    public boolean removeObserver(IKitchenObserver observer) {
        return observers.remove(observer);
    }

    public void notifyOrderStateChanged(OrderStateChange stateChange) {
        notifyObservers("orderStateChanged", observer -> observer.onOrderStateChanged(stateChange));
    }

    public void notifyCapacityUpdated(CapacitySnapshot capacity) {
        notifyObservers("capacityUpdated", observer -> observer.onCapacityUpdated(capacity));
    }

    public void notifyLateOrders(List<LateOrder> lateOrders) {
        notifyObservers("lateOrders", observer -> observer.onLateOrders(lateOrders));
    }

    private void notifyObservers(String event, Consumer<IKitchenObserver> notification) {
        for (IKitchenObserver observer : observers) {
            try {
                notification.accept(observer);
            } catch (RuntimeException e) {
                log.warn("Observer={} failed to handle event={}", observer, event, e);
            }
        }
    }
}
