package io.txevents.tx;

/**
 * Thrown when a transaction is started while the context already carries one.
 *
 * <p>The supported stores have no nested transactions; starting an independent one would
 * silently split the unit of work in two.
 */
public final class NestedTransactionException extends TransactionException {
  public NestedTransactionException() {
    super("Nested transaction detected: a transaction is already active in this context");
  }
}
