package io.txevents.tx;

import java.util.Objects;

/**
 * Helpers around {@link TransactionScope}.
 */
public final class TransactionScopes {

  /**
   * Runs a function in a transaction and returns its result.
   *
   * <p>When the scope retries, the value of the last, committed attempt is returned.
   *
   * @param scope the scope
   * @param ctx   the caller's context
   * @param fn    the transactional function
   * @param <T>   the result type
   * @return the function's result
   */
  public static <T> T executeWithResult(TransactionScope scope, TxContext ctx, TransactionalFunction<T> fn) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(fn, "fn");
    ResultHolder<T> holder = new ResultHolder<>();
    scope.execute(ctx, txCtx -> holder.value = fn.apply(txCtx));
    return holder.value;
  }

  private static final class ResultHolder<T> {
    private T value;
  }

  private TransactionScopes() {}
}
