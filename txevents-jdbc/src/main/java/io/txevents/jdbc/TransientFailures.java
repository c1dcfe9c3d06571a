package io.txevents.jdbc;

import java.sql.SQLException;
import java.sql.SQLTransactionRollbackException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Classifies failures that are worth retrying with a fresh transaction: serialization
 * failures and deadlocks, reported by drivers as SQLState class {@code 40} or as
 * {@link SQLTransactionRollbackException}.
 */
public final class TransientFailures {
  private static final String TRANSACTION_ROLLBACK_CLASS = "40";

  /**
   * Walks the cause chain of {@code failure} looking for a transient conflict.
   *
   * @param failure the failure, may be null
   * @return {@code true} if a retry in a new transaction may succeed
   */
  public static boolean isTransient(Throwable failure) {
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable t = failure; t != null && seen.add(t); t = t.getCause()) {
      if (t instanceof SQLTransactionRollbackException) {
        return true;
      }
      if (t instanceof SQLException sql) {
        String state = sql.getSQLState();
        if (state != null && state.startsWith(TRANSACTION_ROLLBACK_CLASS)) {
          return true;
        }
      }
    }
    return false;
  }

  private TransientFailures() {}
}
