package io.txevents.demo.orders.application;

import io.txevents.demo.orders.domain.OrderRepository;
import io.txevents.demo.orders.domain.UserRef;
import io.txevents.tx.ReadOnlyTransactionScope;
import io.txevents.tx.TransactionScopes;
import io.txevents.tx.TxContext;

import java.util.List;

public final class ListUserOrders {
    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final OrderRepository orders;
    private final ReadOnlyTransactionScope readScope;

    public ListUserOrders(OrderRepository orders, ReadOnlyTransactionScope readScope) {
        this.orders = orders;
        this.readScope = readScope;
    }

    public OrderPage handle(TxContext ctx, String userId, int offset, int limit) {
        UserRef userRef = UserRef.parse(userId);
        int effectiveOffset = Math.max(offset, 0);
        int effectiveLimit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        return TransactionScopes.executeWithResult(readScope, ctx, readCtx -> {
            List<OrderView> page = orders.findByUserRef(readCtx, userRef, effectiveOffset, effectiveLimit)
                    .stream()
                    .map(OrderView::of)
                    .toList();
            return new OrderPage(page, orders.countByUserRef(readCtx, userRef), effectiveOffset, effectiveLimit);
        });
    }
}
