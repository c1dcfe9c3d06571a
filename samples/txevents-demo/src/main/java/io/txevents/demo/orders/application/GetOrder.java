package io.txevents.demo.orders.application;

import io.txevents.demo.orders.domain.OrderId;
import io.txevents.demo.orders.domain.OrderRepository;
import io.txevents.demo.shared.NotFoundException;
import io.txevents.tx.ReadOnlyTransactionScope;
import io.txevents.tx.TransactionScopes;
import io.txevents.tx.TxContext;

/**
 * Loads one order. The order row and its items are read in one read-only transaction.
 */
public final class GetOrder {
    private final OrderRepository orders;
    private final ReadOnlyTransactionScope readScope;

    public GetOrder(OrderRepository orders, ReadOnlyTransactionScope readScope) {
        this.orders = orders;
        this.readScope = readScope;
    }

    /**
     * @throws NotFoundException if no such order exists
     */
    public OrderView handle(TxContext ctx, String orderId) {
        OrderId id = OrderId.parse(orderId);
        return TransactionScopes.executeWithResult(readScope, ctx, readCtx -> orders.findById(readCtx, id)
                .map(OrderView::of)
                .orElseThrow(() -> new NotFoundException("order not found: " + id)));
    }
}
