package io.txevents.demo.users.domain;

import io.txevents.BaseEvent;
import io.txevents.demo.shared.contracts.UserEvents;

/**
 * Profile or email changed; carries the state after the change.
 */
public final class UserUpdatedEvent extends BaseEvent {
    private final String email;
    private final String firstName;
    private final String lastName;

    UserUpdatedEvent(User user) {
        super(UserEvents.USER_UPDATED, user.id().value());
        this.email = user.email().value();
        this.firstName = user.name().firstName();
        this.lastName = user.name().lastName();
    }

    public String email() {
        return email;
    }

    public String firstName() {
        return firstName;
    }

    public String lastName() {
        return lastName;
    }
}
