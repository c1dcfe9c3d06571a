package io.txevents.tx;

/**
 * Boundary of one unit of work.
 *
 * <p>{@link #execute} opens a transaction, embeds it into a child of the given context,
 * runs the work with that child, and commits when the work returns normally or rolls back
 * when it throws.
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>A {@link RuntimeException} thrown by the work is rethrown unchanged after rollback</li>
 *   <li>A checked exception thrown by the work is wrapped in {@link TransactionException}</li>
 *   <li>Failure to begin or commit surfaces as {@link TransactionException}</li>
 *   <li>A context that already carries a transaction is rejected with
 *       {@link NestedTransactionException}</li>
 * </ul>
 *
 * @see ReadWriteTransactionScope
 * @see ReadOnlyTransactionScope
 * @see TransactionScopes
 */
public interface TransactionScope {

  /**
   * Runs the work in a new transaction.
   *
   * @param ctx  the caller's context; must not carry a transaction
   * @param work the transactional work
   */
  void execute(TxContext ctx, TransactionalWork work);
}
