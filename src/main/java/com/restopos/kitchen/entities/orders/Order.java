package com.restopos.kitchen.entities.orders;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import lombok.Builder;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maintains order information and the scheduling fields of the order.
 * <p>
 * Orders are owned by the order intake of the point-of-sale backend. The scheduling engine only touches
 * {@link #getOrderState()} for the Received -> InPreparation transition, together with {@link #getPreparationStartAt()}
 * and {@link #getExpectedFinishAt()}, which are set exactly once through {@link #applyPromotion(Instant, Instant)}.
 */
@ThreadSafe public class Order {

    private final String id;
    private final String customerName;
    private final Instant createdAt;
    private final Instant requestedDeliveryTime;
    private final Integer estimatedDurationMinutes;
    private final OrderPriority priority;
    private final boolean autoPromote;
    private final List<OrderLine> lines;
    private final String notes;
    private final AtomicReference<OrderState> orderStateAtomicReference;
    private volatile Instant preparationStartAt;
    private volatile Instant expectedFinishAt;
    private volatile Instant lastModifiedAt;

    /**
     * Creates an order. Only id and createdAt are mandatory.
     * <p>
     * A missing priority is derived from the requested delivery time, a missing autoPromote flag means true, and a missing
     * state means {@link OrderState#Received}. State and scheduling timestamps can be passed when an order is loaded back
     * from storage.
     */
    @Builder public Order(String id, String customerName, Instant createdAt, Instant requestedDeliveryTime,
        Integer estimatedDurationMinutes, OrderPriority priority, Boolean autoPromote, List<OrderLine> lines, String notes,
        OrderState orderState, Instant preparationStartAt, Instant expectedFinishAt, Instant lastModifiedAt) {
        Preconditions.checkNotNull(id, "id");
        Preconditions.checkNotNull(createdAt, "createdAt");
        Preconditions.checkArgument(estimatedDurationMinutes == null || estimatedDurationMinutes > 0,
            "estimatedDurationMinutes must be positive, was %s", estimatedDurationMinutes);
        this.id = id;
        this.customerName = customerName;
        this.createdAt = createdAt;
        this.requestedDeliveryTime = requestedDeliveryTime;
        this.estimatedDurationMinutes = estimatedDurationMinutes;
        this.priority = priority != null ? priority : OrderPriority.forDeliveryTime(requestedDeliveryTime);
        this.autoPromote = autoPromote == null || autoPromote;
        this.lines = lines == null ? ImmutableList.of() : ImmutableList.copyOf(lines);
        this.notes = notes;
        this.orderStateAtomicReference = new AtomicReference<>(orderState == null ? OrderState.Received : orderState);
        this.preparationStartAt = preparationStartAt;
        this.expectedFinishAt = expectedFinishAt;
        this.lastModifiedAt = lastModifiedAt == null ? createdAt : lastModifiedAt;
    }

    public Order getDeepCopy() {
        return Order.builder().id(id).customerName(customerName).createdAt(createdAt).requestedDeliveryTime(requestedDeliveryTime)
            .estimatedDurationMinutes(estimatedDurationMinutes).priority(priority).autoPromote(autoPromote).lines(lines).notes(notes)
            .orderState(getOrderState()).preparationStartAt(preparationStartAt).expectedFinishAt(expectedFinishAt)
            .lastModifiedAt(lastModifiedAt).build();
    }

    public String getId() {
        return id;
    }

    public String getCustomerName() {
        return customerName;
    }

    /**
     * Timestamp at which the order was accepted. Used as FIFO tie-break within a priority class, and to decide the
     * operating day the order belongs to.
     *
     * @return
     */
    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * @return requested delivery time, or null for "as soon as possible" orders.
     */
    public Instant getRequestedDeliveryTime() {
        return requestedDeliveryTime;
    }

    public boolean isAsap() {
        return requestedDeliveryTime == null;
    }

    /**
     * @return the per order duration override, or null if the system base estimate applies.
     */
    public Integer getEstimatedDurationMinutes() {
        return estimatedDurationMinutes;
    }

    public OrderPriority getPriority() {
        return priority;
    }

    /**
     * Orders with autoPromote false are never picked by automatic admission.
     *
     * @return
     */
    public boolean isAutoPromote() {
        return autoPromote;
    }

    public List<OrderLine> getLines() {
        return lines;
    }

    public int getItemCount() {
        int count = 0;
        for (OrderLine line : lines)
            count += line.getQuantity();
        return count;
    }

    public String getNotes() {
        return notes;
    }

    public OrderState getOrderState() {
        return orderStateAtomicReference.get();
    }

    /**
     * Sets the current orderState to newState if the oldState matches.
     *
     * @param oldState
     * @param newState
     * @return
     */
    public boolean compareAndSet(OrderState oldState, OrderState newState) {
        return orderStateAtomicReference.compareAndSet(oldState, newState);
    }

    public Instant getPreparationStartAt() {
        return preparationStartAt;
    }

    /**
     * Meaningful only once the order is {@link OrderState#InPreparation}. Computed once at promotion, never recomputed.
     *
     * @return
     */
    public Instant getExpectedFinishAt() {
        return expectedFinishAt;
    }

    public Instant getLastModifiedAt() {
        return lastModifiedAt;
    }

    public void setLastModifiedAt(Instant lastModifiedAt) {
        this.lastModifiedAt = lastModifiedAt;
    }

    /**
     * Moves the order from Received to InPreparation and records its preparation window.
     *
     * @param startAt
     * @param expectedFinishAt
     * @throws IllegalStateException if the order is not Received.
     */
    public void applyPromotion(Instant startAt, Instant expectedFinishAt) {
        Preconditions.checkNotNull(startAt, "startAt");
        Preconditions.checkNotNull(expectedFinishAt, "expectedFinishAt");
        if (!compareAndSet(OrderState.Received, OrderState.InPreparation)) {
            throw new IllegalStateException("orderId:" + id + " can not be promoted from state " + getOrderState());
        }
        this.preparationStartAt = startAt;
        this.expectedFinishAt = expectedFinishAt;
        this.lastModifiedAt = startAt;
    }

    @Override public int hashCode() {
        return Objects.hash(id);
    }

    @Override public boolean equals(Object other) {
        if (other == this)
            return true;
        if (!(other instanceof Order))
            return false;
        return Objects.equals(id, ((Order) other).id);
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(Order.class).omitNullValues().add("orderId", id).add("orderState", getOrderState())
            .add("priority", priority).add("createdAt", createdAt).add("requestedDeliveryTime", requestedDeliveryTime)
            .add("estimatedDurationMinutes", estimatedDurationMinutes).add("expectedFinishAt", expectedFinishAt).toString();
    }
}
