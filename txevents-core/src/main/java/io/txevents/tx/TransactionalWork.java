package io.txevents.tx;

/**
 * Work executed inside a transaction scope.
 *
 * <p>A read-write scope may run the work more than once. Create per-attempt state (such as
 * a {@link io.txevents.dispatch.TransactionalEventDispatcher}) inside the work and perform
 * no irreversible external side effects in it.
 */
@FunctionalInterface
public interface TransactionalWork {

  /**
   * @param ctx child context carrying the live transaction
   * @throws Exception to roll the transaction back
   */
  void run(TxContext ctx) throws Exception;
}
