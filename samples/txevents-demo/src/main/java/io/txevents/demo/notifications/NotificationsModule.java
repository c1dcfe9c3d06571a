package io.txevents.demo.notifications;

import io.txevents.EventSubscriber;
import io.txevents.demo.shared.contracts.OrderEvents;

/**
 * Reacts to events only; it has no commands of its own.
 */
public final class NotificationsModule {
    private final OrderSubmittedNotifier orderSubmittedNotifier = new OrderSubmittedNotifier();

    /**
     * @param afterCommit subscriptions of the after-commit bus
     */
    public NotificationsModule(EventSubscriber afterCommit) {
        afterCommit.subscribe(OrderEvents.ORDER_SUBMITTED, orderSubmittedNotifier);
    }

    public OrderSubmittedNotifier orderSubmittedNotifier() {
        return orderSubmittedNotifier;
    }
}
