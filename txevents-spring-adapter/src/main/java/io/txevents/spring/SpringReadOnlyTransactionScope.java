package io.txevents.spring;

import io.txevents.jdbc.tx.JdbcReadOnlyTransaction;
import io.txevents.tx.NestedTransactionException;
import io.txevents.tx.ReadOnlyTransactionScope;
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

/**
 * {@link ReadOnlyTransactionScope} on top of a Spring read-only transaction at
 * {@code REPEATABLE_READ}. The transaction is always rolled back.
 */
public final class SpringReadOnlyTransactionScope implements ReadOnlyTransactionScope {
  private final DataSource dataSource;
  private final TransactionTemplate template;

  public SpringReadOnlyTransactionScope(PlatformTransactionManager transactionManager, DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.template = new TransactionTemplate(Objects.requireNonNull(transactionManager, "transactionManager"));
    this.template.setReadOnly(true);
    this.template.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
  }

  @Override
  public void execute(TxContext ctx, TransactionalWork work) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(work, "work");
    if (ctx.isTransactionActive() || TransactionSynchronizationManager.isActualTransactionActive()) {
      throw new NestedTransactionException();
    }
    try {
      template.executeWithoutResult(status -> {
        status.setRollbackOnly();
        Connection conn = DataSourceUtils.getConnection(dataSource);
        JdbcReadOnlyTransaction tx = new JdbcReadOnlyTransaction(conn);
        try {
          work.run(ctx.withReadOnlyTransaction(tx));
        } catch (RuntimeException e) {
          throw e;
        } catch (Exception e) {
          throw new SpringScopes.CheckedWorkFailure(e);
        } finally {
          tx.close();
          DataSourceUtils.releaseConnection(conn, dataSource);
        }
      });
    } catch (SpringScopes.CheckedWorkFailure f) {
      throw SpringScopes.translate(f.checked());
    } catch (org.springframework.transaction.TransactionException e) {
      throw new TransactionException("Spring transaction failed: " + e.getMessage(), e);
    }
  }
}
