package io.txevents.demo.orders.domain;

import java.util.Objects;
import java.util.UUID;

public record OrderId(String value) {

    public OrderId {
        Objects.requireNonNull(value, "value");
    }

    public static OrderId newId() {
        return new OrderId(UUID.randomUUID().toString());
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not a UUID
     */
    public static OrderId parse(String value) {
        try {
            return new OrderId(UUID.fromString(value).toString());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("invalid order ID format: " + value, e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
