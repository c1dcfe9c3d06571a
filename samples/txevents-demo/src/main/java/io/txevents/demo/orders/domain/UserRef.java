package io.txevents.demo.orders.domain;

import java.util.UUID;

/**
 * The orders module's own reference to a user. Keeps the orders domain independent of the
 * users module's types.
 */
public record UserRef(String value) {

    /**
     * @throws IllegalArgumentException if {@code value} is not a UUID
     */
    public static UserRef parse(String value) {
        try {
            return new UserRef(UUID.fromString(value).toString());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("invalid user reference format: " + value, e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
