package io.txevents.demo.users.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a {@link User}: a UUID in its canonical string form.
 */
public record UserId(String value) {

    public UserId {
        Objects.requireNonNull(value, "value");
    }

    public static UserId newId() {
        return new UserId(UUID.randomUUID().toString());
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not a UUID
     */
    public static UserId parse(String value) {
        try {
            return new UserId(UUID.fromString(value).toString());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("invalid user ID format: " + value, e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
