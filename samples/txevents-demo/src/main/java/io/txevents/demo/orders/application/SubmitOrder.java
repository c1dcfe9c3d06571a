package io.txevents.demo.orders.application;

import io.txevents.Event;
import io.txevents.EventPublisher;
import io.txevents.demo.orders.domain.Order;
import io.txevents.demo.orders.domain.OrderId;
import io.txevents.demo.orders.domain.OrderRepository;
import io.txevents.demo.shared.NotFoundException;
import io.txevents.dispatch.TransactionalEventDispatcher;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.TransactionScopes;
import io.txevents.tx.TxContext;

import java.util.List;

/**
 * Submits a draft order.
 *
 * <p>{@code orders.OrderSubmitted} is dispatched twice: to transactional handlers before
 * commit, then to the after-commit publisher once the transaction committed. Notification
 * handlers live on the latter and never see a submission that rolled back.
 */
public final class SubmitOrder {

    public record Command(String orderId) {
    }

    private final OrderRepository orders;
    private final ReadWriteTransactionScope txScope;
    private final TransactionalEventDispatchers dispatchers;
    private final EventPublisher afterCommit;

    public SubmitOrder(OrderRepository orders, ReadWriteTransactionScope txScope,
            TransactionalEventDispatchers dispatchers, EventPublisher afterCommit) {
        this.orders = orders;
        this.txScope = txScope;
        this.dispatchers = dispatchers;
        this.afterCommit = afterCommit;
    }

    public void handle(TxContext ctx, Command cmd) {
        OrderId orderId = OrderId.parse(cmd.orderId());

        List<Event> committed = TransactionScopes.executeWithResult(txScope, ctx, txCtx -> {
            TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
            Order order = orders.findById(txCtx, orderId)
                    .orElseThrow(() -> new NotFoundException("order not found: " + orderId));
            order.submit();
            orders.save(txCtx, order);
            List<Event> events = order.popDomainEvents();
            dispatcher.publishAll(txCtx, events);
            dispatcher.flush(txCtx);
            return events;
        });

        for (Event event : committed) {
            afterCommit.publish(ctx, event);
        }
    }
}
