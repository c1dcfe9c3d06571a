package io.txevents.tx;

/**
 * Scope that opens read-write transactions.
 *
 * <p>Implementations may run the work again from scratch when the store reports a transient
 * conflict. Every attempt receives a new transaction handle in a new child context, and the
 * handle of an abandoned attempt is closed.
 */
public interface ReadWriteTransactionScope extends TransactionScope {
}
