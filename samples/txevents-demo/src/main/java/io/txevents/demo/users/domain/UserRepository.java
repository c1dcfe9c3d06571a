package io.txevents.demo.users.domain;

import io.txevents.tx.TxContext;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for users. Every method joins the transaction carried by {@code ctx},
 * if any.
 */
public interface UserRepository {

    /** Inserts or updates. */
    void save(TxContext ctx, User user);

    Optional<User> findById(TxContext ctx, UserId id);

    Optional<User> findByEmail(TxContext ctx, Email email);

    boolean existsByEmail(TxContext ctx, Email email);

    /** Users ordered by creation time. */
    List<User> findAll(TxContext ctx, int offset, int limit);

    int count(TxContext ctx);
}
