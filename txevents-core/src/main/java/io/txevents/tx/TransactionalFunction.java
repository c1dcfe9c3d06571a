package io.txevents.tx;

/**
 * Like {@link TransactionalWork}, but produces a value.
 *
 * @param <T> the result type
 * @see TransactionScopes#executeWithResult
 */
@FunctionalInterface
public interface TransactionalFunction<T> {
  T apply(TxContext ctx) throws Exception;
}
