package io.txevents.jdbc.tx;

import io.txevents.jdbc.H2Database;
import io.txevents.jdbc.TransactionAwareJdbc;
import io.txevents.tx.NestedTransactionException;
import io.txevents.tx.ReadCapability;
import io.txevents.tx.TransactionScopes;
import io.txevents.tx.TxContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JdbcReadOnlyTransactionScopeTest {
  private H2Database db;
  private TransactionAwareJdbc jdbc;
  private JdbcReadOnlyTransactionScope scope;

  @BeforeEach
  void setUp() throws Exception {
    db = new H2Database();
    jdbc = new TransactionAwareJdbc(db.connectionProvider());
    scope = new JdbcReadOnlyTransactionScope(db.connectionProvider());
    db.insert("a1", "ann", 10L);
    db.insert("a2", "bob", 20L);
  }

  @Test
  void readsThroughReadOnlyTransaction() {
    List<String> owners = TransactionScopes.executeWithResult(scope, TxContext.background(), ctx -> {
      assertTrue(ctx.readOnlyTransaction().isPresent());
      assertTrue(ctx.readWriteTransaction().isEmpty());
      return jdbc.query(ctx, "SELECT owner FROM accounts ORDER BY id", rs -> rs.getString(1));
    });

    assertEquals(List.of("ann", "bob"), owners);
  }

  @Test
  void handleIsClosedAfterWorkReturns() {
    AtomicReference<ReadCapability> handle = new AtomicReference<>();

    scope.execute(TxContext.background(), ctx -> handle.set(ctx.readCapability().orElseThrow()));

    assertThrows(IllegalStateException.class, () ->
        handle.get().query("SELECT owner FROM accounts", rs -> rs.getString(1)));
  }

  @Test
  void rejectsContextThatAlreadyCarriesTransaction() {
    JdbcTransactionScope readWrite = JdbcTransactionScope.builder()
        .connectionProvider(db.connectionProvider())
        .build();
    AtomicReference<Throwable> failure = new AtomicReference<>();

    readWrite.execute(TxContext.background(), ctx -> {
      try {
        scope.execute(ctx, inner -> { });
      } catch (NestedTransactionException e) {
        failure.set(e);
      }
    });

    assertNotNull(failure.get());
  }

  @Test
  void failurePropagates() {
    IllegalArgumentException boom = new IllegalArgumentException("bad query");

    IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () ->
        scope.execute(TxContext.background(), ctx -> {
          throw boom;
        }));

    assertSame(boom, thrown);
  }
}
