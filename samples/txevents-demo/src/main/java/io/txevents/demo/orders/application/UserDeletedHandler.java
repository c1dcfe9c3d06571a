package io.txevents.demo.orders.application;

import io.txevents.Event;
import io.txevents.EventHandler;
import io.txevents.demo.orders.domain.Order;
import io.txevents.demo.orders.domain.OrderRepository;
import io.txevents.demo.orders.domain.UserRef;
import io.txevents.demo.shared.contracts.UserDeletedEvent;
import io.txevents.tx.TxContext;

import java.util.List;
import java.util.logging.Logger;

/**
 * Cancels the draft and pending orders of a deleted user.
 *
 * <p>Runs inside the transaction that deleted the user: the cancellations commit with the
 * deletion or not at all. A failing save propagates and rolls the whole deletion back.
 */
public final class UserDeletedHandler implements EventHandler {
    private static final Logger logger = Logger.getLogger(UserDeletedHandler.class.getName());

    static final int MAX_ORDERS = 1000;

    private final OrderRepository orders;

    public UserDeletedHandler(OrderRepository orders) {
        this.orders = orders;
    }

    @Override
    public void handle(TxContext ctx, Event event) {
        if (!(event instanceof UserDeletedEvent deleted)) {
            return;
        }
        UserRef userRef = UserRef.parse(deleted.userId());
        logger.info("Cancelling open orders of deleted user " + userRef);

        List<Order> userOrders = orders.findByUserRef(ctx, userRef, 0, MAX_ORDERS);
        for (Order order : userOrders) {
            if (!order.isOpen()) {
                continue;
            }
            order.cancel();
            orders.save(ctx, order);
            // the deletion is the fact subscribers care about; per-order cancellations are not re-published
            order.clearDomainEvents();
            logger.info("Cancelled order " + order.id() + " of deleted user " + userRef);
        }
    }
}
