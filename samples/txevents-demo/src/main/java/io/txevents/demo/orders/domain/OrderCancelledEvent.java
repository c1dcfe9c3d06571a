package io.txevents.demo.orders.domain;

import io.txevents.BaseEvent;
import io.txevents.demo.shared.contracts.OrderEvents;

public final class OrderCancelledEvent extends BaseEvent {
    private final String userId;

    OrderCancelledEvent(OrderId orderId, UserRef userRef) {
        super(OrderEvents.ORDER_CANCELLED, orderId.value());
        this.userId = userRef.value();
    }

    public String userId() {
        return userId;
    }
}
