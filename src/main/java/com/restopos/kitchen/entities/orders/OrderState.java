package com.restopos.kitchen.entities.orders;

/**
 * An order goes through different states.
 * <p>
 * (1) Received, the order was accepted by intake and waits in the backlog.
 * (2) InPreparation, the kitchen is working on it. Only the admission engine moves an order from (1) to (2).
 * (3) Ready
 * (4) Delivered
 * (5) Canceled, possible from any state before (4).
 * <p>
 * Transitions other than (1) -> (2) belong to collaborators outside the scheduling engine.
 */
public enum OrderState {Received, InPreparation, Ready, Delivered, Canceled}
