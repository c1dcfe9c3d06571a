package io.txevents.demo.orders.application;

import io.txevents.demo.orders.domain.Order;
import io.txevents.demo.orders.domain.OrderId;
import io.txevents.demo.orders.domain.OrderRepository;
import io.txevents.demo.shared.NotFoundException;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.TxContext;

public final class RemoveItem {

    public record Command(String orderId, String productId) {
    }

    private final OrderRepository orders;
    private final ReadWriteTransactionScope txScope;

    public RemoveItem(OrderRepository orders, ReadWriteTransactionScope txScope) {
        this.orders = orders;
        this.txScope = txScope;
    }

    public void handle(TxContext ctx, Command cmd) {
        OrderId orderId = OrderId.parse(cmd.orderId());

        txScope.execute(ctx, txCtx -> {
            Order order = orders.findById(txCtx, orderId)
                    .orElseThrow(() -> new NotFoundException("order not found: " + orderId));
            order.removeItem(cmd.productId());
            orders.save(txCtx, order);
        });
    }
}
