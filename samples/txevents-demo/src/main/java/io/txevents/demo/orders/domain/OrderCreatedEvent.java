package io.txevents.demo.orders.domain;

import io.txevents.BaseEvent;
import io.txevents.demo.shared.contracts.OrderEvents;

public final class OrderCreatedEvent extends BaseEvent {
    private final String userId;

    OrderCreatedEvent(OrderId orderId, UserRef userRef) {
        super(OrderEvents.ORDER_CREATED, orderId.value());
        this.userId = userRef.value();
    }

    public String userId() {
        return userId;
    }
}
