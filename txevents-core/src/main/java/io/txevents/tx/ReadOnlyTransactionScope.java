package io.txevents.tx;

/**
 * Scope that opens read-only transactions for consistent multi-query reads. The transaction
 * is closed as soon as the work returns; it is never retried.
 */
public interface ReadOnlyTransactionScope extends TransactionScope {
}
