package io.txevents.demo.shared.contracts;

import io.txevents.EventType;

/**
 * Event types the orders module publishes.
 */
public final class OrderEvents {
    public static final EventType ORDER_CREATED = EventType.of("orders.OrderCreated");
    public static final EventType ORDER_SUBMITTED = EventType.of("orders.OrderSubmitted");
    public static final EventType ORDER_CANCELLED = EventType.of("orders.OrderCancelled");

    private OrderEvents() {
    }
}
