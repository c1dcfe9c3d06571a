package io.txevents.jdbc.tx;

import io.txevents.jdbc.ConnectionProvider;
import io.txevents.jdbc.TransientFailures;
import io.txevents.spi.MetricsExporter;
import io.txevents.tx.ExponentialBackoffRetryPolicy;
import io.txevents.tx.NestedTransactionException;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.RetryPolicy;
import io.txevents.tx.TransactionException;
import io.txevents.tx.TransactionalWork;
import io.txevents.tx.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-write transaction scope for plain JDBC.
 *
 * <p>Each attempt obtains a connection, turns auto-commit off, embeds a
 * {@link JdbcReadWriteTransaction} into a child of the caller's context and runs the work.
 * The attempt commits when the work returns and rolls back when it throws. Afterwards the
 * handle is closed, the connection's auto-commit and isolation level are restored and the
 * connection is closed, whatever the outcome.
 *
 * <p>When an attempt fails with a transient conflict (see {@link TransientFailures}) and
 * attempts remain, the work runs again from scratch after a backoff delay.
 *
 * <pre>{@code
 * JdbcTransactionScope txScope = JdbcTransactionScope.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .isolationLevel(Connection.TRANSACTION_SERIALIZABLE)
 *     .build();
 * }</pre>
 */
public final class JdbcTransactionScope implements ReadWriteTransactionScope {
  private static final Logger logger = Logger.getLogger(JdbcTransactionScope.class.getName());

  private final ConnectionProvider connectionProvider;
  private final Integer isolationLevel;
  private final int maxAttempts;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;

  private JdbcTransactionScope(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
    }
    this.isolationLevel = builder.isolationLevel;
    this.maxAttempts = builder.maxAttempts;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(50, 1000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void execute(TxContext ctx, TransactionalWork work) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(work, "work");
    if (ctx.isTransactionActive()) {
      throw new NestedTransactionException();
    }
    for (int attempt = 1; ; attempt++) {
      try {
        runAttempt(ctx, work);
        return;
      } catch (Exception e) {
        if (attempt >= maxAttempts || !TransientFailures.isTransient(e)) {
          throw translate(e);
        }
        metrics.incrementRetries();
        long delayMs = retryPolicy.backoffMillis(attempt);
        logger.log(Level.WARNING, "Transient conflict on attempt " + attempt + "/" + maxAttempts
            + ", retrying in " + delayMs + "ms: " + e.getMessage());
        pause(delayMs);
      }
    }
  }

  private void runAttempt(TxContext ctx, TransactionalWork work) throws Exception {
    Connection conn;
    try {
      conn = connectionProvider.getConnection();
    } catch (SQLException e) {
      throw new TransactionException("Failed to obtain connection", e);
    }
    JdbcReadWriteTransaction tx = null;
    boolean originalAutoCommit = true;
    Integer originalIsolation = null;
    try {
      originalAutoCommit = conn.getAutoCommit();
      if (isolationLevel != null) {
        originalIsolation = conn.getTransactionIsolation();
        conn.setTransactionIsolation(isolationLevel);
      }
      conn.setAutoCommit(false);
      tx = new JdbcReadWriteTransaction(conn);
      TxContext txCtx = ctx.withReadWriteTransaction(tx);

      try {
        work.run(txCtx);
      } catch (Throwable failure) {
        rollback(conn, failure);
        throw failure;
      }

      try {
        conn.commit();
      } catch (SQLException e) {
        rollback(conn, e);
        throw new TransactionException("Failed to commit transaction", e);
      }
      metrics.incrementCommits();
    } finally {
      if (tx != null) {
        tx.close();
      }
      release(conn, originalAutoCommit, originalIsolation);
    }
  }

  private void rollback(Connection conn, Throwable cause) {
    metrics.incrementRollbacks();
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }

  private static void release(Connection conn, boolean autoCommit, Integer isolation) {
    try {
      conn.setAutoCommit(autoCommit);
      if (isolation != null) {
        conn.setTransactionIsolation(isolation);
      }
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to restore connection state", e);
    } finally {
      try {
        conn.close();
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Failed to close connection", e);
      }
    }
  }

  static RuntimeException translate(Exception e) {
    if (e instanceof RuntimeException re) {
      return re;
    }
    return new TransactionException("Transactional work failed: " + e.getMessage(), e);
  }

  private static void pause(long delayMs) {
    if (delayMs <= 0) {
      return;
    }
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransactionException("Interrupted while waiting to retry transaction", e);
    }
  }

  /** Builder for {@link JdbcTransactionScope}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Integer isolationLevel;
    private int maxAttempts = 5;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the source of connections.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the isolation level, one of the {@code Connection.TRANSACTION_*} constants.
     *
     * <p>Optional. Defaults to the connection's own level.
     *
     * @param isolationLevel JDBC isolation level
     * @return this builder
     */
    public Builder isolationLevel(int isolationLevel) {
      this.isolationLevel = isolationLevel;
      return this;
    }

    /**
     * Sets the total number of attempts, including the first.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1; {@code 1} disables retries.
     *
     * @param maxAttempts maximum attempts
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the backoff between attempts.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=50} and {@code maxDelayMs=1000}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public JdbcTransactionScope build() {
      return new JdbcTransactionScope(this);
    }
  }
}
