package io.txevents.demo.users.application;

import io.txevents.demo.shared.NotFoundException;
import io.txevents.demo.users.domain.Email;
import io.txevents.demo.users.domain.Name;
import io.txevents.demo.users.domain.User;
import io.txevents.demo.users.domain.UserId;
import io.txevents.demo.users.domain.UserRepository;
import io.txevents.dispatch.TransactionalEventDispatcher;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.TxContext;

/**
 * Changes a user's name and, when given, email.
 */
public final class UpdateUser {

    /**
     * @param email new email, or {@code null} to keep the current one
     */
    public record Command(String userId, String firstName, String lastName, String email) {

        public Command(String userId, String firstName, String lastName) {
            this(userId, firstName, lastName, null);
        }
    }

    private final UserRepository users;
    private final ReadWriteTransactionScope txScope;
    private final TransactionalEventDispatchers dispatchers;

    public UpdateUser(UserRepository users, ReadWriteTransactionScope txScope,
            TransactionalEventDispatchers dispatchers) {
        this.users = users;
        this.txScope = txScope;
        this.dispatchers = dispatchers;
    }

    public void handle(TxContext ctx, Command cmd) {
        UserId userId = UserId.parse(cmd.userId());
        Name name = new Name(cmd.firstName(), cmd.lastName());
        Email email = cmd.email() == null ? null : new Email(cmd.email());

        txScope.execute(ctx, txCtx -> {
            TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
            User user = users.findById(txCtx, userId)
                    .orElseThrow(() -> new NotFoundException("user not found: " + userId));
            user.updateProfile(name);
            if (email != null && !email.equals(user.email())) {
                if (users.existsByEmail(txCtx, email)) {
                    throw new IllegalStateException("email already exists: " + email);
                }
                user.changeEmail(email);
            }
            users.save(txCtx, user);
            dispatcher.publishAll(txCtx, user.popDomainEvents());
            dispatcher.flush(txCtx);
        });
    }
}
