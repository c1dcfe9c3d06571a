package io.txevents.demo.orders.domain;

import java.util.Objects;

public record OrderItem(String productId, String productName, int quantity, Money unitPrice) {

    public OrderItem {
        Objects.requireNonNull(productId, "productId");
        Objects.requireNonNull(unitPrice, "unitPrice");
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive, got: " + quantity);
        }
    }

    public Money subtotal() {
        return unitPrice.multiply(quantity);
    }

    OrderItem withQuantity(int newQuantity) {
        return new OrderItem(productId, productName, newQuantity, unitPrice);
    }
}
