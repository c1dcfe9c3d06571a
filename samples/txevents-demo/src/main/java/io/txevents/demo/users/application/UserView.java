package io.txevents.demo.users.application;

import io.txevents.demo.users.domain.User;

import java.time.Instant;

/**
 * Read model of a user.
 */
public record UserView(String id, String email, String firstName, String lastName, String status,
        Instant createdAt, Instant updatedAt) {

    static UserView of(User user) {
        return new UserView(
                user.id().value(),
                user.email().value(),
                user.name().firstName(),
                user.name().lastName(),
                user.status().value(),
                user.createdAt(),
                user.updatedAt());
    }
}
