package io.txevents.jdbc.tx;

import io.txevents.jdbc.ConnectionProvider;
import io.txevents.tx.NestedTransactionException;
import io.txevents.tx.ReadOnlyTransactionScope;
import io.txevents.tx.TransactionException;
import io.txevents.tx.TransactionalWork;
import io.txevents.tx.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only transaction scope for plain JDBC, giving the work one consistent snapshot
 * across several queries.
 *
 * <p>The connection is marked read-only and runs at {@code REPEATABLE_READ} unless configured
 * otherwise. The transaction is always rolled back, since nothing was written, and the
 * connection is closed as soon as the work returns. Read-only transactions are never retried.
 */
public final class JdbcReadOnlyTransactionScope implements ReadOnlyTransactionScope {
  private static final Logger logger = Logger.getLogger(JdbcReadOnlyTransactionScope.class.getName());

  private final ConnectionProvider connectionProvider;
  private final int isolationLevel;

  public JdbcReadOnlyTransactionScope(ConnectionProvider connectionProvider) {
    this(connectionProvider, Connection.TRANSACTION_REPEATABLE_READ);
  }

  public JdbcReadOnlyTransactionScope(ConnectionProvider connectionProvider, int isolationLevel) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.isolationLevel = isolationLevel;
  }

  @Override
  public void execute(TxContext ctx, TransactionalWork work) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(work, "work");
    if (ctx.isTransactionActive()) {
      throw new NestedTransactionException();
    }
    try {
      runReadOnly(ctx, work);
    } catch (Exception e) {
      throw JdbcTransactionScope.translate(e);
    }
  }

  private void runReadOnly(TxContext ctx, TransactionalWork work) throws Exception {
    Connection conn;
    try {
      conn = connectionProvider.getConnection();
    } catch (SQLException e) {
      throw new TransactionException("Failed to obtain connection", e);
    }
    JdbcReadOnlyTransaction tx = null;
    boolean originalAutoCommit = true;
    boolean originalReadOnly = false;
    int originalIsolation = Connection.TRANSACTION_NONE;
    try {
      originalAutoCommit = conn.getAutoCommit();
      originalReadOnly = conn.isReadOnly();
      originalIsolation = conn.getTransactionIsolation();
      conn.setAutoCommit(false);
      conn.setReadOnly(true);
      conn.setTransactionIsolation(isolationLevel);
      tx = new JdbcReadOnlyTransaction(conn);
      work.run(ctx.withReadOnlyTransaction(tx));
    } finally {
      if (tx != null) {
        tx.close();
      }
      release(conn, originalAutoCommit, originalReadOnly, originalIsolation);
    }
  }

  private static void release(Connection conn, boolean autoCommit, boolean readOnly, int isolation) {
    try {
      if (!conn.getAutoCommit()) {
        conn.rollback();
      }
      conn.setAutoCommit(autoCommit);
      conn.setReadOnly(readOnly);
      if (isolation != Connection.TRANSACTION_NONE) {
        conn.setTransactionIsolation(isolation);
      }
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to end read-only transaction", e);
    } finally {
      try {
        conn.close();
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Failed to close connection", e);
      }
    }
  }
}
