package io.txevents.jdbc;

import io.txevents.tx.ReadCapability;
import io.txevents.tx.ReadOnlyTransaction;
import io.txevents.tx.ReadWriteTransaction;
import io.txevents.tx.RowMapper;
import io.txevents.tx.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Statement execution for repositories that honours the transaction carried by the context.
 *
 * <ul>
 *   <li>Reads go through {@link TxContext#readCapability()}, so inside a read-write
 *       transaction they see its uncommitted writes.</li>
 *   <li>Writes go through the read-write transaction. Writing while the context carries
 *       only a read-only transaction is an error.</li>
 *   <li>Without any transaction, each call runs on its own auto-commit connection.</li>
 * </ul>
 *
 * <pre>{@code
 * public Optional<User> findById(TxContext ctx, UserId id) {
 *   return jdbc.queryFirst(ctx, "SELECT * FROM users WHERE id = ?", USER_MAPPER, id.value());
 * }
 * }</pre>
 */
public final class TransactionAwareJdbc {
  private final ConnectionProvider connectionProvider;

  public TransactionAwareJdbc(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  public <T> List<T> query(TxContext ctx, String sql, RowMapper<T> mapper, Object... params) {
    Optional<ReadCapability> reads = ctx.readCapability();
    if (reads.isPresent()) {
      return reads.get().query(sql, mapper, params);
    }
    return withOneOffConnection(conn -> JdbcTemplate.query(conn, sql, mapper, params));
  }

  public <T> Optional<T> queryFirst(TxContext ctx, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(ctx, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /**
   * @throws IllegalStateException if the context carries a read-only transaction
   */
  public int update(TxContext ctx, String sql, Object... params) {
    Optional<ReadWriteTransaction> tx = writableTransaction(ctx);
    if (tx.isPresent()) {
      return tx.get().update(sql, params);
    }
    return withOneOffConnection(conn -> JdbcTemplate.update(conn, sql, params));
  }

  /**
   * @throws IllegalStateException if the context carries a read-only transaction
   */
  public int[] batchUpdate(TxContext ctx, String sql, List<Object[]> batchParams) {
    Optional<ReadWriteTransaction> tx = writableTransaction(ctx);
    if (tx.isPresent()) {
      return tx.get().batchUpdate(sql, batchParams);
    }
    return withOneOffConnection(conn -> JdbcTemplate.batchUpdate(conn, sql, batchParams));
  }

  private static Optional<ReadWriteTransaction> writableTransaction(TxContext ctx) {
    Optional<ReadOnlyTransaction> readOnly = ctx.readOnlyTransaction();
    if (readOnly.isPresent()) {
      throw new IllegalStateException("Cannot write inside a read-only transaction");
    }
    return ctx.readWriteTransaction();
  }

  private <T> T withOneOffConnection(ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return callback.apply(conn);
    } catch (SQLException e) {
      throw new StoreException("Failed to obtain connection", e);
    }
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T apply(Connection conn);
  }
}
