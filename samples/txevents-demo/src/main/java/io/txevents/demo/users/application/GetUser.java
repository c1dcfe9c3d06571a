package io.txevents.demo.users.application;

import io.txevents.demo.shared.NotFoundException;
import io.txevents.demo.users.domain.UserId;
import io.txevents.demo.users.domain.UserRepository;
import io.txevents.tx.TxContext;

public final class GetUser {
    private final UserRepository users;

    public GetUser(UserRepository users) {
        this.users = users;
    }

    /**
     * @throws NotFoundException if no such user exists
     */
    public UserView handle(TxContext ctx, String userId) {
        UserId id = UserId.parse(userId);
        return users.findById(ctx, id)
                .map(UserView::of)
                .orElseThrow(() -> new NotFoundException("user not found: " + id));
    }
}
