package io.txevents.demo.users.application;

import io.txevents.demo.users.domain.Email;
import io.txevents.demo.users.domain.Name;
import io.txevents.demo.users.domain.User;
import io.txevents.demo.users.domain.UserId;
import io.txevents.demo.users.domain.UserRepository;
import io.txevents.dispatch.TransactionalEventDispatcher;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.TransactionScopes;
import io.txevents.tx.TxContext;

/**
 * Registers a new user. Email addresses are unique.
 */
public final class CreateUser {

    public record Command(String email, String firstName, String lastName) {
    }

    private final UserRepository users;
    private final ReadWriteTransactionScope txScope;
    private final TransactionalEventDispatchers dispatchers;

    public CreateUser(UserRepository users, ReadWriteTransactionScope txScope,
            TransactionalEventDispatchers dispatchers) {
        this.users = users;
        this.txScope = txScope;
        this.dispatchers = dispatchers;
    }

    /**
     * @return the new user's id
     * @throws IllegalArgumentException if the email or name is invalid
     * @throws IllegalStateException    if the email is already registered
     */
    public UserId handle(TxContext ctx, Command cmd) {
        // validated before any transaction is opened
        Email email = new Email(cmd.email());
        Name name = new Name(cmd.firstName(), cmd.lastName());

        return TransactionScopes.executeWithResult(txScope, ctx, txCtx -> {
            TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
            if (users.existsByEmail(txCtx, email)) {
                throw new IllegalStateException("email already exists: " + email);
            }
            User user = User.create(email, name);
            users.save(txCtx, user);
            dispatcher.publishAll(txCtx, user.popDomainEvents());
            dispatcher.flush(txCtx);
            return user.id();
        });
    }
}
