package com.restopos.kitchen.entities.kitchen.observers;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.restopos.kitchen.entities.kitchen.CapacitySnapshot;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.entities.orders.OrderLine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * Turns kitchen events into the JSON messages pushed to POS clients. Delivering the messages is up to the sink, e.g. a
 * websocket broadcaster; by default they are only logged.
 */
@Slf4j public class JsonEventPublisher implements IKitchenObserver {

    public static final String ORDER_STATE_CHANGED = "order:state-changed";
    public static final String CAPACITY_UPDATED = "capacity:updated";
    public static final String ORDERS_LATE = "orders:late";

    private final Gson gson = new GsonBuilder().serializeNulls().create();
    private final Clock clock;
    private final Consumer<String> sink;

    public JsonEventPublisher(Clock clock) {
        this(clock, message -> log.info("event={}", message));
    }

    public JsonEventPublisher(Clock clock, Consumer<String> sink) {
        this.clock = clock;
        this.sink = sink;
    }

    @Override public void onOrderStateChanged(OrderStateChange stateChange) {
        JsonObject data = new JsonObject();
        data.addProperty("orderId", stateChange.getOrderId());
        data.addProperty("previousState", stateChange.getPreviousState().name());
        data.addProperty("newState", stateChange.getNewState().name());
        data.addProperty("changedAt", stateChange.getChangedAt().toString());
        data.add("order", toJson(stateChange.getOrder()));
        publish(ORDER_STATE_CHANGED, data);
    }

    @Override public void onCapacityUpdated(CapacitySnapshot capacity) {
        JsonObject data = new JsonObject();
        data.addProperty("maxCapacity", capacity.getMaxCapacity());
        data.addProperty("currentLoad", capacity.getCurrentLoad());
        data.addProperty("availableSlots", capacity.getAvailableSlots());
        data.addProperty("utilizationPercent", capacity.getUtilizationPercent());
        data.addProperty("full", capacity.isFull());
        publish(CAPACITY_UPDATED, data);
    }

    @Override public void onLateOrders(List<LateOrder> lateOrders) {
        JsonArray orders = new JsonArray();
        for (LateOrder lateOrder : lateOrders) {
            JsonObject order = new JsonObject();
            order.addProperty("orderId", lateOrder.getOrderId());
            order.addProperty("customerName", lateOrder.getCustomerName());
            order.addProperty("expectedFinishAt", lateOrder.getExpectedFinishAt().toString());
            order.addProperty("minutesLate", lateOrder.getMinutesLate());
            orders.add(order);
        }
        JsonObject data = new JsonObject();
        data.addProperty("count", lateOrders.size());
        data.add("orders", orders);
        publish(ORDERS_LATE, data);
    }

    private static JsonObject toJson(Order order) {
        JsonObject json = new JsonObject();
        json.addProperty("id", order.getId());
        json.addProperty("customerName", order.getCustomerName());
        json.addProperty("state", order.getOrderState().name());
        json.addProperty("priority", order.getPriority().name());
        json.addProperty("autoPromote", order.isAutoPromote());
        json.addProperty("createdAt", toString(order.getCreatedAt()));
        json.addProperty("requestedDeliveryTime", toString(order.getRequestedDeliveryTime()));
        json.addProperty("estimatedDurationMinutes", order.getEstimatedDurationMinutes());
        json.addProperty("preparationStartAt", toString(order.getPreparationStartAt()));
        json.addProperty("expectedFinishAt", toString(order.getExpectedFinishAt()));
        json.addProperty("lastModifiedAt", toString(order.getLastModifiedAt()));
        json.addProperty("notes", order.getNotes());
        JsonArray lines = new JsonArray();
        for (OrderLine line : order.getLines()) {
            JsonObject jsonLine = new JsonObject();
            jsonLine.addProperty("articleId", line.getArticleId());
            jsonLine.addProperty("articleName", line.getArticleName());
            jsonLine.addProperty("quantity", line.getQuantity());
            jsonLine.addProperty("customization", line.getCustomization());
            jsonLine.addProperty("notes", line.getNotes());
            lines.add(jsonLine);
        }
        json.add("lines", lines);
        return json;
    }

    private static String toString(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private void publish(String event, JsonObject data) {
        JsonObject message = new JsonObject();
        message.addProperty("event", event);
        message.addProperty("timestamp", clock.instant().toString());
        message.add("data", data);
        sink.accept(gson.toJson(message));
    }
}
