package io.txevents.spring;

import io.txevents.BaseEvent;
import io.txevents.EventType;
import io.txevents.dispatch.EventHandlerException;
import io.txevents.dispatch.TransactionalEventDispatcher;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.jdbc.DataSourceConnectionProvider;
import io.txevents.jdbc.StoreException;
import io.txevents.jdbc.TransactionAwareJdbc;
import io.txevents.registry.DefaultHandlerRegistry;
import io.txevents.tx.NestedTransactionException;
import io.txevents.tx.ReadCapability;
import io.txevents.tx.RetryPolicy;
import io.txevents.tx.TransactionException;
import io.txevents.tx.TransactionScopes;
import io.txevents.tx.TxContext;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SpringTransactionScopeTest {
  private static final String INSERT = "INSERT INTO accounts (id, owner) VALUES (?, ?)";

  private JdbcDataSource dataSource;
  private DataSourceTransactionManager txManager;
  private SpringTransactionScope scope;
  private TransactionAwareJdbc jdbc;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:txevents_spring_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("CREATE TABLE accounts (id VARCHAR(36) PRIMARY KEY, owner VARCHAR(100) NOT NULL)");
    }
    txManager = new DataSourceTransactionManager(dataSource);
    scope = SpringTransactionScope.builder()
        .transactionManager(txManager)
        .dataSource(dataSource)
        .retryPolicy(RetryPolicy.IMMEDIATE)
        .build();
    jdbc = new TransactionAwareJdbc(new DataSourceConnectionProvider(dataSource));
  }

  private int count() {
    return jdbc.query(TxContext.background(), "SELECT COUNT(*) FROM accounts", rs -> rs.getInt(1)).get(0);
  }

  @Test
  void commitsWhenWorkReturns() {
    scope.execute(TxContext.background(), ctx -> jdbc.update(ctx, INSERT, "a1", "ann"));

    assertEquals(1, count());
  }

  @Test
  void contextConnectionIsTheSpringBoundOne() {
    AtomicReference<Boolean> springActive = new AtomicReference<>();

    scope.execute(TxContext.background(), ctx -> {
      jdbc.update(ctx, INSERT, "a1", "ann");
      springActive.set(TransactionSynchronizationManager.isActualTransactionActive());
      Integer seenBySpring = new JdbcTemplate(dataSource).queryForObject("SELECT COUNT(*) FROM accounts", Integer.class);
      assertEquals(Integer.valueOf(1), seenBySpring);
    });

    assertTrue(springActive.get());
  }

  @Test
  void runtimeExceptionRollsBackAndPropagatesUnchanged() {
    IllegalStateException boom = new IllegalStateException("boom");

    IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
        scope.execute(TxContext.background(), ctx -> {
          jdbc.update(ctx, INSERT, "a1", "ann");
          throw boom;
        }));

    assertSame(boom, thrown);
    assertEquals(0, count());
  }

  @Test
  void checkedExceptionRollsBackAndIsWrapped() {
    TransactionException thrown = assertThrows(TransactionException.class, () ->
        scope.execute(TxContext.background(), ctx -> {
          jdbc.update(ctx, INSERT, "a1", "ann");
          throw new IOException("disk");
        }));

    assertInstanceOf(IOException.class, thrown.getCause());
    assertEquals(0, count());
  }

  @Test
  void rejectsSurroundingSpringTransaction() {
    TransactionTemplate outer = new TransactionTemplate(txManager);

    assertThrows(NestedTransactionException.class, () -> outer.executeWithoutResult(status ->
        scope.execute(TxContext.background(), ctx -> fail("must not run"))));
  }

  @Test
  void retriesTransientConflict() {
    AtomicInteger attempts = new AtomicInteger();

    scope.execute(TxContext.background(), ctx -> {
      jdbc.update(ctx, INSERT, "a" + attempts.get(), "ann");
      if (attempts.incrementAndGet() == 1) {
        throw new StoreException("conflict", new SQLException("could not serialize", "40001"));
      }
    });

    assertEquals(2, attempts.get());
    assertEquals(1, count());
  }

  @Test
  void handlerFailureRollsBackTriggeringChange() {
    EventType opened = EventType.of("accounts.AccountOpened");
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .subscribe(opened, (ctx, event) -> jdbc.update(ctx, INSERT, "audit-" + event.aggregateId(), "audit"))
        .subscribe(opened, (ctx, event) -> {
          throw new IllegalStateException("rejected");
        });
    TransactionalEventDispatchers dispatchers = TransactionalEventDispatchers.builder()
        .handlerRegistry(registry)
        .build();

    assertThrows(EventHandlerException.class, () -> scope.execute(TxContext.background(), ctx -> {
      TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
      jdbc.update(ctx, INSERT, "a1", "ann");
      dispatcher.publish(ctx, new BaseEvent(opened, "a1") { });
      dispatcher.flush(ctx);
    }));

    assertEquals(0, count());
  }

  @Test
  void readOnlyScopeReadsAndClosesHandle() {
    jdbc.update(TxContext.background(), INSERT, "a1", "ann");
    SpringReadOnlyTransactionScope readOnly = new SpringReadOnlyTransactionScope(txManager, dataSource);
    AtomicReference<ReadCapability> handle = new AtomicReference<>();

    List<String> owners = TransactionScopes.executeWithResult(readOnly, TxContext.background(), ctx -> {
      handle.set(ctx.readCapability().orElseThrow());
      return jdbc.query(ctx, "SELECT owner FROM accounts", rs -> rs.getString(1));
    });

    assertEquals(List.of("ann"), owners);
    assertThrows(IllegalStateException.class, () -> handle.get().query("SELECT 1", rs -> rs.getInt(1)));
  }

  @Test
  void readOnlyScopeRejectsWrites() {
    SpringReadOnlyTransactionScope readOnly = new SpringReadOnlyTransactionScope(txManager, dataSource);

    assertThrows(IllegalStateException.class, () -> readOnly.execute(TxContext.background(), ctx ->
        jdbc.update(ctx, INSERT, "a1", "ann")));
    assertEquals(0, count());
  }
}
