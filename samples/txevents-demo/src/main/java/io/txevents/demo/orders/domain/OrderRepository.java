package io.txevents.demo.orders.domain;

import io.txevents.tx.TxContext;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for orders. Every method joins the transaction carried by {@code ctx},
 * if any.
 */
public interface OrderRepository {

    /** Inserts or updates the order together with its items. */
    void save(TxContext ctx, Order order);

    Optional<Order> findById(TxContext ctx, OrderId id);

    /** Orders of one user, oldest first. */
    List<Order> findByUserRef(TxContext ctx, UserRef userRef, int offset, int limit);

    int countByUserRef(TxContext ctx, UserRef userRef);
}
