package com.restopos.kitchen.store;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.inject.Singleton;
import com.restopos.kitchen.entities.kitchen.OperatingDay;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.entities.orders.OrderState;
import com.restopos.kitchen.entities.orders.comparators.AdmissionOrderComparator;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In process implementation of {@link IOrderStore}.
 * <p>
 * Every stored order has a fair {@link ReentrantLock} acting as its row lock. Writers ({@link #save(Order)},
 * {@link #updateState(String, OrderState, OrderState, Instant)} and committing admission passes) hold the row lock while
 * they change the row, and an admission pass keeps the row locks of its selected candidates until it finishes. Row locks
 * are only created for stored orders. Orders are never removed, so orders and row locks both live as long as the store.
 * <p>
 * Admission passes are additionally serialized through one kitchen wide lease, taken in {@link #beginAdmission()}. It
 * plays the role the locked capacity row plays in a relational store: the in-preparation count read inside the pass stays
 * valid until the pass commits, so two overlapping passes can never admit more orders than the kitchen ceiling.
 * <p>
 * An {@link AdmissionTransaction} is confined to the thread that began it.
 */
@Slf4j @ThreadSafe @Singleton public class InMemoryOrderStore implements IOrderStore {

    private static final Comparator<Order> EXPECTED_FINISH_COMPARATOR =
        Comparator.comparing(Order::getExpectedFinishAt, Comparator.nullsLast(Comparator.naturalOrder())).thenComparing(Order::getId);

    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> rowLocks = new ConcurrentHashMap<>();
    private final ReentrantLock admissionLease = new ReentrantLock(true);

    @Override public void save(Order order) {
        Preconditions.checkNotNull(order, "order");
        ReentrantLock rowLock = getRowLock(order.getId());
        rowLock.lock();
        try {
            orders.put(order.getId(), order.getDeepCopy());
        } finally {
            rowLock.unlock();
        }
    }

    @Override public Optional<Order> findById(String orderId) {
        return Optional.ofNullable(orders.get(orderId)).map(Order::getDeepCopy);
    }

    @Override public int countInPreparation(OperatingDay day) {
        return (int) orders.values().stream().filter(order -> isInPreparation(order, day)).count();
    }

    @Override public List<Order> findInPreparation(OperatingDay day) {
        return orders.values().stream().filter(order -> isInPreparation(order, day)).map(Order::getDeepCopy)
            .sorted(EXPECTED_FINISH_COMPARATOR).collect(ImmutableList.toImmutableList());
    }

    @Override public List<Order> findLate(Instant now, OperatingDay day) {
        return orders.values().stream()
            .filter(order -> isInPreparation(order, day) && order.getExpectedFinishAt() != null && order.getExpectedFinishAt().isBefore(now))
            .map(Order::getDeepCopy).sorted(EXPECTED_FINISH_COMPARATOR).collect(ImmutableList.toImmutableList());
    }

    @Override public List<Order> findDeliveredSince(Instant since, int limit) {
        return orders.values().stream().filter(
            order -> order.getOrderState() == OrderState.Delivered && order.getPreparationStartAt() != null && !order.getLastModifiedAt()
                .isBefore(since)).map(Order::getDeepCopy).sorted(Comparator.comparing(Order::getLastModifiedAt).reversed()).limit(limit)
            .collect(ImmutableList.toImmutableList());
    }

    @Override public boolean updateState(String orderId, OrderState expected, OrderState newState, Instant at) {
        if (!orders.containsKey(orderId)) {
            log.warn("Can not update unknown orderId={} to={}", orderId, newState);
            return false;
        }
        ReentrantLock rowLock = getRowLock(orderId);
        rowLock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null || !order.compareAndSet(expected, newState)) {
                return false;
            }
            order.setLastModifiedAt(at);
            log.info("Updated orderId={} from={} to={}", orderId, expected, newState);
            return true;
        } finally {
            rowLock.unlock();
        }
    }

    @Override public AdmissionTransaction beginAdmission() {
        admissionLease.lock();
        return new InMemoryAdmissionTransaction();
    }

    @VisibleForTesting int rowLockCount() {
        return rowLocks.size();
    }

    private ReentrantLock getRowLock(String orderId) {
        return rowLocks.computeIfAbsent(orderId, id -> new ReentrantLock(true));
    }

    private static boolean isInPreparation(Order order, OperatingDay day) {
        return order.getOrderState() == OrderState.InPreparation && day.contains(order.getCreatedAt());
    }

    private static boolean isBacklog(Order order, OperatingDay day) {
        return order.getOrderState() == OrderState.Received && order.isAutoPromote() && day.contains(order.getCreatedAt());
    }

    private class InMemoryAdmissionTransaction implements AdmissionTransaction {

        // Insertion ordered, so leases are released in the order they were taken.
        private final Map<String, ReentrantLock> heldRowLocks = new LinkedHashMap<>();
        private final List<PendingPromotion> pendingPromotions = new ArrayList<>();
        private boolean finished;
        private boolean closed;

        @Override public int countInPreparation(OperatingDay day) {
            checkActive();
            return InMemoryOrderStore.this.countInPreparation(day);
        }

        @Override public List<Order> selectBacklogForUpdate(OperatingDay day, int limit) {
            checkActive();
            Preconditions.checkArgument(limit >= 0, "limit must not be negative, was %s", limit);
            List<Order> candidates =
                orders.values().stream().filter(order -> isBacklog(order, day)).sorted(AdmissionOrderComparator.INSTANCE)
                    .collect(Collectors.toList());

            List<Order> selected = new ArrayList<>();
            for (Order candidate : candidates) {
                if (selected.size() >= limit)
                    break;
                if (heldRowLocks.containsKey(candidate.getId()))
                    continue;
                ReentrantLock rowLock = getRowLock(candidate.getId());
                rowLock.lock();
                // The row may have changed while we were waiting for its lock, so lets evaluate it again.
                Order current = orders.get(candidate.getId());
                if (current != null && isBacklog(current, day)) {
                    heldRowLocks.put(candidate.getId(), rowLock);
                    selected.add(current.getDeepCopy());
                } else {
                    rowLock.unlock();
                }
            }
            return selected;
        }

        @Override public void promote(String orderId, Instant startAt, Instant expectedFinishAt) {
            checkActive();
            Preconditions.checkState(heldRowLocks.containsKey(orderId), "orderId:%s is not locked by this admission pass", orderId);
            pendingPromotions.add(new PendingPromotion(orderId, startAt, expectedFinishAt));
        }

        @Override public void commit() {
            checkActive();
            try {
                // Validate everything before touching any row, so a commit either applies all promotions or none.
                for (PendingPromotion promotion : pendingPromotions) {
                    Order order = orders.get(promotion.orderId);
                    if (order == null || order.getOrderState() != OrderState.Received) {
                        throw new StoreException("orderId:" + promotion.orderId + " is no longer in the backlog");
                    }
                }
                for (PendingPromotion promotion : pendingPromotions) {
                    orders.get(promotion.orderId).applyPromotion(promotion.startAt, promotion.expectedFinishAt);
                }
            } finally {
                finish();
            }
        }

        @Override public void rollback() {
            checkActive();
            finish();
        }

        @Override public void close() {
            if (closed)
                return;
            try {
                if (!finished)
                    finish();
            } finally {
                closed = true;
                admissionLease.unlock();
            }
        }

        private void finish() {
            pendingPromotions.clear();
            finished = true;
            for (ReentrantLock rowLock : heldRowLocks.values()) {
                rowLock.unlock();
            }
            heldRowLocks.clear();
        }

        private void checkActive() {
            Preconditions.checkState(!finished && !closed, "admission transaction already finished");
        }
    }


    private static class PendingPromotion {
        private final String orderId;
        private final Instant startAt;
        private final Instant expectedFinishAt;

        public PendingPromotion(String orderId, Instant startAt, Instant expectedFinishAt) {
            this.orderId = orderId;
            this.startAt = startAt;
            this.expectedFinishAt = expectedFinishAt;
        }
    }
}
