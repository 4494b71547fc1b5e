package com.restopos.kitchen.entities.orders;

import java.time.Instant;

/**
 * Admission priority class. The declaration order is the admission order: {@link #High} orders are considered before
 * {@link #Normal} ones.
 */
public enum OrderPriority {

    // "As soon as possible" orders, no requested delivery time.
    High,
    // Orders scheduled for a requested delivery time.
    Normal;

    public static OrderPriority forDeliveryTime(Instant requestedDeliveryTime) {
        return requestedDeliveryTime == null ? High : Normal;
    }
}
