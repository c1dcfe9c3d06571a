package io.txevents.demo.users.application;

import io.txevents.demo.users.domain.UserRepository;
import io.txevents.tx.ReadOnlyTransactionScope;
import io.txevents.tx.TransactionScopes;
import io.txevents.tx.TxContext;

import java.util.List;

/**
 * Pages through users. The count and the page are read in one read-only transaction so
 * they agree with each other.
 */
public final class ListUsers {
    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final UserRepository users;
    private final ReadOnlyTransactionScope readScope;

    public ListUsers(UserRepository users, ReadOnlyTransactionScope readScope) {
        this.users = users;
        this.readScope = readScope;
    }

    public UserPage handle(TxContext ctx, int offset, int limit) {
        int effectiveOffset = Math.max(offset, 0);
        int effectiveLimit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        return TransactionScopes.executeWithResult(readScope, ctx, readCtx -> {
            List<UserView> page = users.findAll(readCtx, effectiveOffset, effectiveLimit).stream()
                    .map(UserView::of)
                    .toList();
            return new UserPage(page, users.count(readCtx), effectiveOffset, effectiveLimit);
        });
    }
}
