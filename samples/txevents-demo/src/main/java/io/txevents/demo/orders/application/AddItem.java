package io.txevents.demo.orders.application;

import io.txevents.demo.orders.domain.Money;
import io.txevents.demo.orders.domain.Order;
import io.txevents.demo.orders.domain.OrderId;
import io.txevents.demo.orders.domain.OrderRepository;
import io.txevents.demo.shared.NotFoundException;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.TxContext;

/**
 * Adds a line to a draft order. Raises no events.
 */
public final class AddItem {

    public record Command(String orderId, String productId, String productName, int quantity,
            long unitPrice, String currency) {
    }

    private final OrderRepository orders;
    private final ReadWriteTransactionScope txScope;

    public AddItem(OrderRepository orders, ReadWriteTransactionScope txScope) {
        this.orders = orders;
        this.txScope = txScope;
    }

    public void handle(TxContext ctx, Command cmd) {
        OrderId orderId = OrderId.parse(cmd.orderId());
        Money unitPrice = new Money(cmd.unitPrice(), cmd.currency());

        txScope.execute(ctx, txCtx -> {
            Order order = orders.findById(txCtx, orderId)
                    .orElseThrow(() -> new NotFoundException("order not found: " + orderId));
            order.addItem(cmd.productId(), cmd.productName(), cmd.quantity(), unitPrice);
            orders.save(txCtx, order);
        });
    }
}
