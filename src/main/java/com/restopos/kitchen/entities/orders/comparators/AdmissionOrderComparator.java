package com.restopos.kitchen.entities.orders.comparators;

import com.restopos.kitchen.entities.orders.Order;

import java.util.Comparator;

/**
 * Orders the backlog the way admission consumes it.
 * <p>
 * -1 if the first order has to be admitted before the second order
 * 1 if the first order has to be admitted after the second order
 * <p>
 * Priority class comes first ({@link com.restopos.kitchen.entities.orders.OrderPriority#High} before Normal), then the
 * creation timestamp (oldest first). In case of a tie, ids decide, so the order is total and every admission pass locks
 * rows in the same sequence.
 */
public class AdmissionOrderComparator implements Comparator<Order> {

    public static final AdmissionOrderComparator INSTANCE = new AdmissionOrderComparator();

    @Override public int compare(Order first, Order second) {
        int result = first.getPriority().compareTo(second.getPriority());
        if (result != 0)
            return result;
        result = first.getCreatedAt().compareTo(second.getCreatedAt());
        if (result != 0)
            return result;
        return first.getId().compareTo(second.getId());
    }
}
