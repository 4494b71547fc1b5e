package com.restopos.kitchen.entities.kitchen;

import com.google.common.collect.ImmutableList;
import com.restopos.kitchen.KitchenTestSupport;
import com.restopos.kitchen.MutableClock;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.entities.orders.OrderLine;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.restopos.kitchen.KitchenTestSupport.at;

public class InMemoryKitchenTicketServiceTest {

    private static Order createOrder() {
        return Order.builder().id("a").customerName("Lucia").createdAt(at("09:00")).requestedDeliveryTime(at("11:00"))
            .notes("ring twice").lines(ImmutableList.of(new OrderLine(1, "Burger", 2, "no onions", null), new OrderLine(7, "Fries", 1)))
            .build();
    }

    @Test public void testTicketCopiesTheOrder() {
        InMemoryKitchenTicketService service =
            new InMemoryKitchenTicketService(new MutableClock(KitchenTestSupport.OPENING, KitchenTestSupport.ZONE));

        Assertions.assertTrue(service.createTicket(createOrder()));

        KitchenTicket ticket = service.findByOrderId("a").get();
        Assertions.assertEquals("Lucia", ticket.getCustomerName());
        Assertions.assertEquals(at("11:00"), ticket.getRequestedDeliveryTime());
        Assertions.assertEquals("ring twice", ticket.getNotes());
        Assertions.assertEquals(KitchenTicket.SYSTEM_USER, ticket.getCreatedBy());
        Assertions.assertEquals(KitchenTestSupport.OPENING, ticket.getCreatedAt());
        Assertions.assertEquals(2, ticket.getLines().size());
        Assertions.assertEquals("no onions", ticket.getLines().get(0).getCustomization());
    }

    @Test public void testTicketCreationIsIdempotent() throws Exception {
        InMemoryKitchenTicketService service =
            new InMemoryKitchenTicketService(new MutableClock(KitchenTestSupport.OPENING, KitchenTestSupport.ZONE));
        ExecutorService executorService = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(executorService.submit(() -> service.createTicket(createOrder())));
            }
            int created = 0;
            for (Future<Boolean> result : results) {
                if (result.get())
                    created++;
            }
            Assertions.assertEquals(1, created);
            Assertions.assertEquals(1, service.getTickets().size());
        } finally {
            executorService.shutdownNow();
        }
    }
}
