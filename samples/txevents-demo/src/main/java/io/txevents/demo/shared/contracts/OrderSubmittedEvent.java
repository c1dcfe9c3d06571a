package io.txevents.demo.shared.contracts;

import io.txevents.BaseEvent;

/**
 * An order left draft status and awaits confirmation. Amounts are in minor units.
 */
public final class OrderSubmittedEvent extends BaseEvent {
    private final String orderId;
    private final String userId;
    private final long totalAmount;
    private final String currency;

    public OrderSubmittedEvent(String orderId, String userId, long totalAmount, String currency) {
        super(OrderEvents.ORDER_SUBMITTED, orderId);
        this.orderId = orderId;
        this.userId = userId;
        this.totalAmount = totalAmount;
        this.currency = currency;
    }

    public String orderId() {
        return orderId;
    }

    public String userId() {
        return userId;
    }

    public long totalAmount() {
        return totalAmount;
    }

    public String currency() {
        return currency;
    }
}
