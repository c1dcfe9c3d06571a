package io.txevents.demo.shared.contracts;

import io.txevents.EventType;

/**
 * Event types the users module publishes. Other modules subscribe through these constants
 * rather than the users domain package.
 */
public final class UserEvents {
    public static final EventType USER_CREATED = EventType.of("users.UserCreated");
    public static final EventType USER_UPDATED = EventType.of("users.UserUpdated");
    public static final EventType USER_DELETED = EventType.of("users.UserDeleted");

    private UserEvents() {
    }
}
