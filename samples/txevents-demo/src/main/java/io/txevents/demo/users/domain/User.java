package io.txevents.demo.users.domain;

import io.txevents.AggregateRoot;
import io.txevents.demo.shared.contracts.UserDeletedEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * User aggregate. Deletion is a soft delete; a deleted user rejects every further change
 * with {@link IllegalStateException}.
 */
public final class User extends AggregateRoot {
    private final UserId id;
    private Email email;
    private Name name;
    private UserStatus status;
    private final Instant createdAt;
    private Instant updatedAt;

    private User(UserId id, Email email, Name name, UserStatus status, Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.email = Objects.requireNonNull(email, "email");
        this.name = Objects.requireNonNull(name, "name");
        this.status = Objects.requireNonNull(status, "status");
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Creates an active user and records {@code users.UserCreated}.
     */
    public static User create(Email email, Name name) {
        Instant now = Instant.now();
        User user = new User(UserId.newId(), email, name, UserStatus.ACTIVE, now, now);
        user.addDomainEvent(new UserCreatedEvent(user));
        return user;
    }

    /**
     * Rebuilds a user from storage. Records no events.
     */
    public static User reconstitute(UserId id, Email email, Name name, UserStatus status,
            Instant createdAt, Instant updatedAt) {
        return new User(id, email, name, status, createdAt, updatedAt);
    }

    public void updateProfile(Name name) {
        requireNotDeleted();
        this.name = Objects.requireNonNull(name, "name");
        touch();
        addDomainEvent(new UserUpdatedEvent(this));
    }

    public void changeEmail(Email email) {
        requireNotDeleted();
        this.email = Objects.requireNonNull(email, "email");
        touch();
        addDomainEvent(new UserUpdatedEvent(this));
    }

    public void deactivate() {
        requireNotDeleted();
        status = UserStatus.INACTIVE;
        touch();
    }

    public void activate() {
        requireNotDeleted();
        status = UserStatus.ACTIVE;
        touch();
    }

    /**
     * Marks the user deleted and records {@code users.UserDeleted}. Deleting twice is
     * rejected so the event is raised once per user.
     */
    public void delete() {
        requireNotDeleted();
        status = UserStatus.DELETED;
        touch();
        addDomainEvent(new UserDeletedEvent(id.value()));
    }

    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    public UserId id() {
        return id;
    }

    public Email email() {
        return email;
    }

    public Name name() {
        return name;
    }

    public UserStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    private void requireNotDeleted() {
        if (status == UserStatus.DELETED) {
            throw new IllegalStateException("user has been deleted: " + id);
        }
    }

    private void touch() {
        updatedAt = Instant.now();
    }
}
