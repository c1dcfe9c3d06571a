package io.txevents.demo.orders.application;

import io.txevents.demo.orders.domain.Order;
import io.txevents.demo.orders.domain.OrderId;
import io.txevents.demo.orders.domain.OrderRepository;
import io.txevents.demo.shared.NotFoundException;
import io.txevents.dispatch.TransactionalEventDispatcher;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.TxContext;

public final class CancelOrder {

    public record Command(String orderId) {
    }

    private final OrderRepository orders;
    private final ReadWriteTransactionScope txScope;
    private final TransactionalEventDispatchers dispatchers;

    public CancelOrder(OrderRepository orders, ReadWriteTransactionScope txScope,
            TransactionalEventDispatchers dispatchers) {
        this.orders = orders;
        this.txScope = txScope;
        this.dispatchers = dispatchers;
    }

    public void handle(TxContext ctx, Command cmd) {
        OrderId orderId = OrderId.parse(cmd.orderId());

        txScope.execute(ctx, txCtx -> {
            TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
            Order order = orders.findById(txCtx, orderId)
                    .orElseThrow(() -> new NotFoundException("order not found: " + orderId));
            order.cancel();
            orders.save(txCtx, order);
            dispatcher.publishAll(txCtx, order.popDomainEvents());
            dispatcher.flush(txCtx);
        });
    }
}
