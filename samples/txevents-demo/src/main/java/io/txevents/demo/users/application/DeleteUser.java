package io.txevents.demo.users.application;

import io.txevents.demo.shared.NotFoundException;
import io.txevents.demo.users.domain.User;
import io.txevents.demo.users.domain.UserId;
import io.txevents.demo.users.domain.UserRepository;
import io.txevents.dispatch.TransactionalEventDispatcher;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.TxContext;

/**
 * Soft-deletes a user. Handlers of {@code users.UserDeleted} run in the same transaction,
 * so their writes commit or roll back together with the deletion.
 */
public final class DeleteUser {

    public record Command(String userId) {
    }

    private final UserRepository users;
    private final ReadWriteTransactionScope txScope;
    private final TransactionalEventDispatchers dispatchers;

    public DeleteUser(UserRepository users, ReadWriteTransactionScope txScope,
            TransactionalEventDispatchers dispatchers) {
        this.users = users;
        this.txScope = txScope;
        this.dispatchers = dispatchers;
    }

    public void handle(TxContext ctx, Command cmd) {
        UserId userId = UserId.parse(cmd.userId());

        txScope.execute(ctx, txCtx -> {
            // one dispatcher per attempt; a retried attempt starts with an empty queue
            TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
            User user = users.findById(txCtx, userId)
                    .orElseThrow(() -> new NotFoundException("user not found: " + userId));
            user.delete();
            users.save(txCtx, user);
            dispatcher.publishAll(txCtx, user.popDomainEvents());
            dispatcher.flush(txCtx);
        });
    }
}
