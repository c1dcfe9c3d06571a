package io.txevents.jdbc.tx;

import io.txevents.jdbc.JdbcTemplate;
import io.txevents.tx.ReadWriteTransaction;
import io.txevents.tx.RowMapper;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;

/**
 * Read-write transaction handle over a connection whose auto-commit is off.
 *
 * <p>The handle does not own the connection: the scope that created it commits, rolls back
 * and closes the connection, then calls {@link #close()}. Any use after that fails with
 * {@link IllegalStateException}, so a reference kept from an abandoned attempt of a retried
 * transaction cannot write into the next one.
 */
public final class JdbcReadWriteTransaction implements ReadWriteTransaction, AutoCloseable {
  private final Connection connection;
  private volatile boolean closed;

  public JdbcReadWriteTransaction(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
    return JdbcTemplate.query(openConnection(), sql, mapper, params);
  }

  @Override
  public int update(String sql, Object... params) {
    return JdbcTemplate.update(openConnection(), sql, params);
  }

  @Override
  public int[] batchUpdate(String sql, List<Object[]> batchParams) {
    return JdbcTemplate.batchUpdate(openConnection(), sql, batchParams);
  }

  /** Invalidates the handle. The underlying connection is left alone. */
  @Override
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  private Connection openConnection() {
    if (closed) {
      throw new IllegalStateException("Transaction is closed");
    }
    return connection;
  }
}
