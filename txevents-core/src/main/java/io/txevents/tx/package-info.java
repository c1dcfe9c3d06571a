/**
 * Transaction scopes and context propagation.
 *
 * <p>{@link io.txevents.tx.TxContext} carries at most one live transaction handle and rejects a
 * second one with {@link io.txevents.tx.NestedTransactionException}. Read-write and read-only
 * handles share the {@link io.txevents.tx.ReadCapability} facet so repositories read through
 * one accessor in either kind of transaction.
 *
 * @see io.txevents.tx.TransactionScope
 * @see io.txevents.tx.TxContext
 */
package io.txevents.tx;
