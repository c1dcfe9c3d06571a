package io.txevents.tx;

import java.util.List;
import java.util.Optional;

/**
 * Read facet shared by read-write and read-only transactions.
 *
 * <p>Repositories obtain one through {@link TxContext#readCapability()}, which prefers the
 * read-write transaction so that reads observe the unit of work's own uncommitted writes.
 *
 * @see ReadWriteTransaction
 * @see ReadOnlyTransaction
 */
public interface ReadCapability {

  /**
   * Runs a query and maps every row.
   *
   * @param sql    the SELECT statement
   * @param mapper row mapper
   * @param params positional parameters
   * @param <T>    the mapped type
   * @return mapped rows in result-set order, possibly empty
   */
  <T> List<T> query(String sql, RowMapper<T> mapper, Object... params);

  /**
   * Runs a query and maps the first row, if any. Suited to point reads by key.
   *
   * @param sql    the SELECT statement
   * @param mapper row mapper
   * @param params positional parameters
   * @param <T>    the mapped type
   * @return the first mapped row, or empty
   */
  default <T> Optional<T> queryFirst(String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
