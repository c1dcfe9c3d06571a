package io.txevents.demo.orders.application;

import io.txevents.demo.orders.domain.Order;
import io.txevents.demo.orders.domain.OrderId;
import io.txevents.demo.orders.domain.OrderRepository;
import io.txevents.demo.orders.domain.UserRef;
import io.txevents.dispatch.TransactionalEventDispatcher;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.TransactionScopes;
import io.txevents.tx.TxContext;

public final class CreateOrder {

    public record Command(String userId) {
    }

    private final OrderRepository orders;
    private final ReadWriteTransactionScope txScope;
    private final TransactionalEventDispatchers dispatchers;

    public CreateOrder(OrderRepository orders, ReadWriteTransactionScope txScope,
            TransactionalEventDispatchers dispatchers) {
        this.orders = orders;
        this.txScope = txScope;
        this.dispatchers = dispatchers;
    }

    /**
     * @return the id of the new draft order
     */
    public OrderId handle(TxContext ctx, Command cmd) {
        UserRef userRef = UserRef.parse(cmd.userId());

        return TransactionScopes.executeWithResult(txScope, ctx, txCtx -> {
            TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
            Order order = Order.create(userRef);
            orders.save(txCtx, order);
            dispatcher.publishAll(txCtx, order.popDomainEvents());
            dispatcher.flush(txCtx);
            return order.id();
        });
    }
}
