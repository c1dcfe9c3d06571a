package io.txevents.tx;

import java.util.List;

/**
 * Handle of a live read-write transaction. Writes stay invisible to other transactions
 * until the owning scope commits.
 */
public interface ReadWriteTransaction extends ReadCapability {

  /**
   * Executes an INSERT, UPDATE or DELETE.
   *
   * @return rows affected
   */
  int update(String sql, Object... params);

  /**
   * Executes one statement for every parameter row.
   *
   * @return rows affected per parameter row
   */
  int[] batchUpdate(String sql, List<Object[]> batchParams);
}
