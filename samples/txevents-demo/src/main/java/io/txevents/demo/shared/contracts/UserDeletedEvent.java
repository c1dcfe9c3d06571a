package io.txevents.demo.shared.contracts;

import io.txevents.BaseEvent;

/**
 * A user was soft-deleted.
 */
public final class UserDeletedEvent extends BaseEvent {
    private final String userId;

    public UserDeletedEvent(String userId) {
        super(UserEvents.USER_DELETED, userId);
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }
}
