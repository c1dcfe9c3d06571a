package io.txevents.jdbc.tx;

import io.txevents.BaseEvent;
import io.txevents.EventType;
import io.txevents.dispatch.EventHandlerException;
import io.txevents.dispatch.TransactionalEventDispatcher;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.jdbc.H2Database;
import io.txevents.jdbc.StoreException;
import io.txevents.jdbc.TransactionAwareJdbc;
import io.txevents.registry.DefaultHandlerRegistry;
import io.txevents.tx.NestedTransactionException;
import io.txevents.tx.ReadWriteTransaction;
import io.txevents.tx.RetryPolicy;
import io.txevents.tx.TransactionException;
import io.txevents.tx.TransactionScopes;
import io.txevents.tx.TxContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTransactionScopeTest {
  private static final String INSERT = "INSERT INTO accounts (id, owner, balance) VALUES (?, ?, ?)";

  private H2Database db;
  private TransactionAwareJdbc jdbc;
  private JdbcTransactionScope scope;

  @BeforeEach
  void setUp() throws Exception {
    db = new H2Database();
    jdbc = new TransactionAwareJdbc(db.connectionProvider());
    scope = JdbcTransactionScope.builder()
        .connectionProvider(db.connectionProvider())
        .retryPolicy(RetryPolicy.IMMEDIATE)
        .build();
  }

  @Test
  void commitsWhenWorkReturns() {
    scope.execute(TxContext.background(), ctx -> jdbc.update(ctx, INSERT, "a1", "ann", 10L));

    assertEquals(10L, db.balanceOf("a1"));
  }

  @Test
  void workReceivesChildContextWithReadWriteTransaction() {
    TxContext parent = TxContext.background();
    AtomicReference<TxContext> received = new AtomicReference<>();

    scope.execute(parent, received::set);

    assertNotSame(parent, received.get());
    assertTrue(received.get().readWriteTransaction().isPresent());
    assertFalse(parent.isTransactionActive());
  }

  @Test
  void runtimeExceptionRollsBackAndPropagatesUnchanged() {
    IllegalStateException boom = new IllegalStateException("boom");

    IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
        scope.execute(TxContext.background(), ctx -> {
          jdbc.update(ctx, INSERT, "a1", "ann", 10L);
          throw boom;
        }));

    assertSame(boom, thrown);
    assertEquals(0, db.count());
  }

  @Test
  void checkedExceptionIsWrapped() {
    TransactionException thrown = assertThrows(TransactionException.class, () ->
        scope.execute(TxContext.background(), ctx -> {
          jdbc.update(ctx, INSERT, "a1", "ann", 10L);
          throw new IOException("disk");
        }));

    assertInstanceOf(IOException.class, thrown.getCause());
    assertEquals(0, db.count());
  }

  @Test
  void nestedExecuteIsRejected() {
    AtomicReference<Throwable> nestedFailure = new AtomicReference<>();

    scope.execute(TxContext.background(), ctx -> {
      try {
        scope.execute(ctx, inner -> fail("nested work must not run"));
      } catch (NestedTransactionException e) {
        nestedFailure.set(e);
      }
    });

    assertInstanceOf(NestedTransactionException.class, nestedFailure.get());
  }

  @Test
  void retriesTransientConflictWithFreshHandle() {
    AtomicInteger attempts = new AtomicInteger();
    List<ReadWriteTransaction> handles = new ArrayList<>();

    scope.execute(TxContext.background(), ctx -> {
      handles.add(ctx.readWriteTransaction().orElseThrow());
      jdbc.update(ctx, INSERT, "a" + attempts.get(), "ann", 10L);
      if (attempts.incrementAndGet() == 1) {
        throw new StoreException("conflict", new SQLException("could not serialize", "40001"));
      }
    });

    assertEquals(2, attempts.get());
    assertNotSame(handles.get(0), handles.get(1));
    assertThrows(IllegalStateException.class, () -> handles.get(0).update(INSERT, "stale", "x", 1L));
    assertNull(db.balanceOf("a0"));
    assertEquals(10L, db.balanceOf("a1"));
  }

  @Test
  void givesUpAfterMaxAttempts() {
    JdbcTransactionScope threeAttempts = JdbcTransactionScope.builder()
        .connectionProvider(db.connectionProvider())
        .maxAttempts(3)
        .retryPolicy(RetryPolicy.IMMEDIATE)
        .build();
    AtomicInteger attempts = new AtomicInteger();

    StoreException thrown = assertThrows(StoreException.class, () ->
        threeAttempts.execute(TxContext.background(), ctx -> {
          attempts.incrementAndGet();
          throw new StoreException("conflict", new SQLException("deadlock", "40P01"));
        }));

    assertEquals(3, attempts.get());
    assertInstanceOf(SQLException.class, thrown.getCause());
  }

  @Test
  void nonTransientFailureIsNotRetried() {
    AtomicInteger attempts = new AtomicInteger();
    db.insert("a1", "ann", 1L);

    assertThrows(StoreException.class, () -> scope.execute(TxContext.background(), ctx -> {
      attempts.incrementAndGet();
      jdbc.update(ctx, INSERT, "a1", "duplicate", 1L);
    }));

    assertEquals(1, attempts.get());
  }

  @Test
  void executeWithResultReturnsValue() {
    db.insert("a1", "ann", 7L);

    Long balance = TransactionScopes.executeWithResult(scope, TxContext.background(), ctx ->
        jdbc.queryFirst(ctx, "SELECT balance FROM accounts WHERE id = ?", rs -> rs.getLong(1), "a1")
            .orElseThrow());

    assertEquals(7L, balance);
  }

  @Test
  void restoresAutoCommitOnSharedConnection() throws SQLException {
    try (Connection shared = db.dataSource().getConnection()) {
      JdbcTransactionScope sharedScope = JdbcTransactionScope.builder()
          .connectionProvider(() -> new UnclosableConnection(shared).proxy())
          .isolationLevel(Connection.TRANSACTION_SERIALIZABLE)
          .build();
      int isolationBefore = shared.getTransactionIsolation();

      sharedScope.execute(TxContext.background(), ctx -> jdbc.update(ctx, INSERT, "a1", "ann", 1L));

      assertTrue(shared.getAutoCommit());
      assertEquals(isolationBefore, shared.getTransactionIsolation());
    }
  }

  @Test
  void handlerFailureRollsBackTriggeringChange() {
    EventType opened = EventType.of("accounts.AccountOpened");
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .subscribe(opened, (ctx, event) -> jdbc.update(ctx, INSERT, "bonus-" + event.aggregateId(), "bank", 5L))
        .subscribe(opened, (ctx, event) -> {
          throw new IllegalStateException("ledger unavailable");
        });
    TransactionalEventDispatchers dispatchers = TransactionalEventDispatchers.builder()
        .handlerRegistry(registry)
        .build();

    EventHandlerException thrown = assertThrows(EventHandlerException.class, () ->
        scope.execute(TxContext.background(), ctx -> {
          TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
          jdbc.update(ctx, INSERT, "a1", "ann", 10L);
          dispatcher.publish(ctx, new BaseEvent(opened, "a1") { });
          dispatcher.flush(ctx);
        }));

    assertEquals(opened, thrown.eventType());
    assertEquals(0, db.count());
  }

  @Test
  void builderRequiresConnectionProvider() {
    assertThrows(NullPointerException.class, () -> JdbcTransactionScope.builder().build());
    assertThrows(IllegalArgumentException.class, () -> JdbcTransactionScope.builder()
        .connectionProvider(db.connectionProvider()).maxAttempts(0).build());
  }
}
