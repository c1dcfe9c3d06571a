package io.txevents.jdbc.tx;

import io.txevents.jdbc.JdbcTemplate;
import io.txevents.tx.ReadOnlyTransaction;
import io.txevents.tx.RowMapper;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;

/**
 * Read-only transaction handle. Like {@link JdbcReadWriteTransaction}, it fails with
 * {@link IllegalStateException} once its scope has closed it.
 */
public final class JdbcReadOnlyTransaction implements ReadOnlyTransaction, AutoCloseable {
  private final Connection connection;
  private volatile boolean closed;

  public JdbcReadOnlyTransaction(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
    if (closed) {
      throw new IllegalStateException("Transaction is closed");
    }
    return JdbcTemplate.query(connection, sql, mapper, params);
  }

  @Override
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }
}
