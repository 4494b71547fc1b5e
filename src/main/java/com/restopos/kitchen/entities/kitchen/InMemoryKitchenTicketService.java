package com.restopos.kitchen.entities.kitchen;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.restopos.kitchen.entities.orders.Order;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps kitchen tickets in memory, one per order. {@link Map#computeIfAbsent} makes concurrent calls for the same order
 * create a single ticket.
 */
@Slf4j @ThreadSafe @Singleton public class InMemoryKitchenTicketService implements KitchenTicketService {

    private final Map<String, KitchenTicket> ticketsByOrderId = new ConcurrentHashMap<>();
    private final AtomicLong ticketIds = new AtomicLong();
    private final Clock clock;

    @Inject public InMemoryKitchenTicketService(Clock clock) {
        this.clock = clock;
    }

    @Override public boolean createTicket(Order order) {
        boolean[] created = new boolean[1];
        KitchenTicket ticket = ticketsByOrderId.computeIfAbsent(order.getId(), orderId -> {
            created[0] = true;
            return new KitchenTicket(ticketIds.incrementAndGet(), order, clock.instant());
        });
        if (created[0]) {
            log.info("Created kitchen ticket={} for orderId={}", ticket.getId(), order.getId());
        } else {
            log.info("Kitchen ticket={} already exists for orderId={}", ticket.getId(), order.getId());
        }
        return created[0];
    }

    @Override public Optional<KitchenTicket> findByOrderId(String orderId) {
        return Optional.ofNullable(ticketsByOrderId.get(orderId));
    }

    public List<KitchenTicket> getTickets() {
        return ImmutableList.copyOf(ticketsByOrderId.values());
    }
}
