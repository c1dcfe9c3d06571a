package io.txevents.spring;

import io.txevents.jdbc.TransientFailures;
import io.txevents.jdbc.tx.JdbcReadWriteTransaction;
import io.txevents.spi.MetricsExporter;
import io.txevents.tx.ExponentialBackoffRetryPolicy;
import io.txevents.tx.NestedTransactionException;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.RetryPolicy;
import io.txevents.tx.TransactionException;
import io.txevents.tx.TransactionalWork;
import io.txevents.tx.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ReadWriteTransactionScope} that lets Spring's {@link PlatformTransactionManager}
 * demarcate the transaction.
 *
 * <p>Each attempt runs the work inside a {@link TransactionTemplate}. The Spring-bound
 * connection, obtained through {@link DataSourceUtils}, is wrapped in a
 * {@link JdbcReadWriteTransaction} and embedded into the context handed to the work, so
 * repositories written against {@link TxContext} and code using Spring's {@code JdbcTemplate}
 * share one physical transaction.
 *
 * <p>Nesting is rejected both when the context already carries a transaction and when a
 * Spring transaction is already active on the current thread. Transient conflicts are
 * retried as in {@link io.txevents.jdbc.tx.JdbcTransactionScope}.
 */
public final class SpringTransactionScope implements ReadWriteTransactionScope {
  private static final Logger logger = Logger.getLogger(SpringTransactionScope.class.getName());

  private final DataSource dataSource;
  private final TransactionTemplate template;
  private final int maxAttempts;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;

  private SpringTransactionScope(Builder builder) {
    Objects.requireNonNull(builder.transactionManager, "transactionManager");
    this.dataSource = Objects.requireNonNull(builder.dataSource, "dataSource");
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
    }
    this.template = new TransactionTemplate(builder.transactionManager);
    this.template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.template.setIsolationLevel(builder.isolationLevel);
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
    if (ctx.isTransactionActive() || TransactionSynchronizationManager.isActualTransactionActive()) {
      throw new NestedTransactionException();
    }
    for (int attempt = 1; ; attempt++) {
      try {
        runAttempt(ctx, work);
        return;
      } catch (Exception e) {
        if (attempt >= maxAttempts || !TransientFailures.isTransient(e)) {
          throw SpringScopes.translate(e);
        }
        metrics.incrementRetries();
        long delayMs = retryPolicy.backoffMillis(attempt);
        logger.log(Level.WARNING, "Transient conflict on attempt " + attempt + "/" + maxAttempts
            + ", retrying in " + delayMs + "ms: " + e.getMessage());
        SpringScopes.pause(delayMs);
      }
    }
  }

  private void runAttempt(TxContext ctx, TransactionalWork work) throws Exception {
    try {
      template.executeWithoutResult(status -> {
        Connection conn = DataSourceUtils.getConnection(dataSource);
        JdbcReadWriteTransaction tx = new JdbcReadWriteTransaction(conn);
        try {
          work.run(ctx.withReadWriteTransaction(tx));
        } catch (RuntimeException e) {
          throw e;
        } catch (Exception e) {
          throw new SpringScopes.CheckedWorkFailure(e);
        } finally {
          tx.close();
          DataSourceUtils.releaseConnection(conn, dataSource);
        }
      });
      metrics.incrementCommits();
    } catch (SpringScopes.CheckedWorkFailure f) {
      metrics.incrementRollbacks();
      throw f.checked();
    } catch (org.springframework.transaction.TransactionException e) {
      metrics.incrementRollbacks();
      throw new TransactionException("Spring transaction failed: " + e.getMessage(), e);
    } catch (RuntimeException | Error e) {
      metrics.incrementRollbacks();
      throw e;
    }
  }

  /** Builder for {@link SpringTransactionScope}. */
  public static final class Builder {
    private PlatformTransactionManager transactionManager;
    private DataSource dataSource;
    private int isolationLevel = TransactionDefinition.ISOLATION_DEFAULT;
    private int maxAttempts = 5;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <b>Required.</b> Usually a {@code DataSourceTransactionManager} over {@link #dataSource}.
     */
    public Builder transactionManager(PlatformTransactionManager transactionManager) {
      this.transactionManager = transactionManager;
      return this;
    }

    /** <b>Required.</b> The data source the transaction manager binds connections for. */
    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /** One of the {@code TransactionDefinition.ISOLATION_*} constants. */
    public Builder isolationLevel(int isolationLevel) {
      this.isolationLevel = isolationLevel;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public SpringTransactionScope build() {
      return new SpringTransactionScope(this);
    }
  }
}
