package io.txevents.demo.orders.application;

import io.txevents.demo.orders.domain.Order;
import io.txevents.demo.orders.domain.OrderItem;

import java.time.Instant;
import java.util.List;

/**
 * Read model of an order. Amounts are in minor units of {@code currency}.
 */
public record OrderView(String id, String userId, List<Item> items, String status,
        long totalAmount, String currency, Instant createdAt, Instant updatedAt) {

    public record Item(String productId, String productName, int quantity, long unitAmount, long subtotal) {
    }

    static OrderView of(Order order) {
        List<Item> items = order.items().stream()
                .map(OrderView::itemOf)
                .toList();
        return new OrderView(
                order.id().value(),
                order.userRef().value(),
                items,
                order.status().value(),
                order.total().amount(),
                order.total().currency(),
                order.createdAt(),
                order.updatedAt());
    }

    private static Item itemOf(OrderItem item) {
        return new Item(item.productId(), item.productName(), item.quantity(),
                item.unitPrice().amount(), item.subtotal().amount());
    }
}
