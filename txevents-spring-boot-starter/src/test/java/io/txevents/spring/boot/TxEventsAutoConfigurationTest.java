package io.txevents.spring.boot;

import io.txevents.BaseEvent;
import io.txevents.Event;
import io.txevents.EventHandler;
import io.txevents.EventType;
import io.txevents.dispatch.DispatchInterceptor;
import io.txevents.dispatch.SynchronousEventBus;
import io.txevents.dispatch.TransactionalEventDispatcher;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.jdbc.ConnectionProvider;
import io.txevents.jdbc.TransactionAwareJdbc;
import io.txevents.jdbc.tx.JdbcReadOnlyTransactionScope;
import io.txevents.jdbc.tx.JdbcTransactionScope;
import io.txevents.registry.DefaultHandlerRegistry;
import io.txevents.spring.SpringReadOnlyTransactionScope;
import io.txevents.spring.SpringTransactionScope;
import io.txevents.tx.ReadOnlyTransactionScope;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.TxContext;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class TxEventsAutoConfigurationTest {

  static final EventType ITEM_CREATED = EventType.of("items.ItemCreated");

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          TxEventsAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver");

  @Test
  void createsCoordinatorBeans() {
    runner.run(ctx -> {
      assertNotNull(ctx.getBean(ConnectionProvider.class));
      assertNotNull(ctx.getBean(DefaultHandlerRegistry.class));
      assertNotNull(ctx.getBean(DomainEventHandlerRegistrar.class));
      assertNotNull(ctx.getBean(TransactionalEventDispatchers.class));
      assertNotNull(ctx.getBean(SynchronousEventBus.class));
      assertNotNull(ctx.getBean(TransactionAwareJdbc.class));
      assertInstanceOf(JdbcTransactionScope.class, ctx.getBean(ReadWriteTransactionScope.class));
      assertInstanceOf(JdbcReadOnlyTransactionScope.class, ctx.getBean(ReadOnlyTransactionScope.class));
      assertEquals(10, ctx.getBean(TransactionalEventDispatchers.class).maxDepth());
    });
  }

  @Test
  void springManagerUsesPlatformTransactionManager() {
    runner.withPropertyValues("txevents.transaction.manager=SPRING").run(ctx -> {
      assertInstanceOf(SpringTransactionScope.class, ctx.getBean(ReadWriteTransactionScope.class));
      assertInstanceOf(SpringReadOnlyTransactionScope.class, ctx.getBean(ReadOnlyTransactionScope.class));
    });
  }

  @Test
  void maxDepthFromProperties() {
    runner.withPropertyValues("txevents.dispatcher.max-depth=3").run(ctx ->
        assertEquals(3, ctx.getBean(TransactionalEventDispatchers.class).maxDepth()));
  }

  @Test
  void nothingWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(TxEventsAutoConfiguration.class))
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertTrue(ctx.getBeansOfType(TransactionalEventDispatchers.class).isEmpty());
        });
  }

  @Test
  void userConnectionProviderWins() {
    runner.withUserConfiguration(CustomConnectionProviderConfig.class).run(ctx ->
        assertSame(CustomConnectionProviderConfig.PROVIDER, ctx.getBean(ConnectionProvider.class)));
  }

  @Test
  void interceptorBeansReachDispatchers() {
    runner.withUserConfiguration(HandlerConfig.class, InterceptorConfig.class).run(ctx -> {
      TransactionalEventDispatcher dispatcher =
          ctx.getBean(TransactionalEventDispatchers.class).newDispatcher();
      dispatcher.publish(TxContext.background(), new ItemCreated("a"));
      dispatcher.flush(TxContext.background());

      assertEquals(List.of("items.ItemCreated"), ctx.getBean(InterceptorConfig.class).seen);
    });
  }

  @Test
  void annotatedHandlerRunsInsideCommittedTransaction() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      TransactionAwareJdbc jdbc = ctx.getBean(TransactionAwareJdbc.class);
      jdbc.update(TxContext.background(), "CREATE TABLE items(id VARCHAR(32) PRIMARY KEY)");

      ReadWriteTransactionScope scope = ctx.getBean(ReadWriteTransactionScope.class);
      TransactionalEventDispatchers dispatchers = ctx.getBean(TransactionalEventDispatchers.class);
      scope.execute(TxContext.background(), txCtx -> {
        TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
        dispatcher.publish(txCtx, new ItemCreated("a"));
        dispatcher.flush(txCtx);
      });

      List<String> ids = jdbc.query(TxContext.background(), "SELECT id FROM items",
          rs -> rs.getString(1));
      assertEquals(List.of("a"), ids);
      assertTrue(ctx.getBean(RecordingHandler.class).sawTransaction);
    });
  }

  @Test
  void handlerFailureRollsBackWrites() {
    runner.withUserConfiguration(FailingHandlerConfig.class).run(ctx -> {
      TransactionAwareJdbc jdbc = ctx.getBean(TransactionAwareJdbc.class);
      jdbc.update(TxContext.background(), "CREATE TABLE items(id VARCHAR(32) PRIMARY KEY)");

      ReadWriteTransactionScope scope = ctx.getBean(ReadWriteTransactionScope.class);
      TransactionalEventDispatchers dispatchers = ctx.getBean(TransactionalEventDispatchers.class);
      assertThrows(RuntimeException.class, () -> scope.execute(TxContext.background(), txCtx -> {
        jdbc.update(txCtx, "INSERT INTO items(id) VALUES (?)", "a");
        TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
        dispatcher.publish(txCtx, new ItemCreated("a"));
        dispatcher.flush(txCtx);
      }));

      assertTrue(jdbc.query(TxContext.background(), "SELECT id FROM items",
          rs -> rs.getString(1)).isEmpty());
    });
  }

  // ── Test support ─────────────────────────────────────────────

  static final class ItemCreated extends BaseEvent {
    ItemCreated(String itemId) {
      super(ITEM_CREATED, itemId);
    }
  }

  @DomainEventHandler("items.ItemCreated")
  static class RecordingHandler implements EventHandler {
    private final TransactionAwareJdbc jdbc;
    volatile boolean sawTransaction;

    RecordingHandler(TransactionAwareJdbc jdbc) {
      this.jdbc = jdbc;
    }

    @Override
    public void handle(TxContext ctx, Event event) {
      if (!ctx.isTransactionActive()) {
        return;
      }
      sawTransaction = true;
      jdbc.update(ctx, "INSERT INTO items(id) VALUES (?)", event.aggregateId());
    }
  }

  @DomainEventHandler("items.ItemCreated")
  static class FailingHandler implements EventHandler {
    @Override
    public void handle(TxContext ctx, Event event) {
      throw new IllegalStateException("inventory unavailable");
    }
  }

  @Configuration
  static class HandlerConfig {
    @Bean
    RecordingHandler recordingHandler(TransactionAwareJdbc jdbc) {
      return new RecordingHandler(jdbc);
    }
  }

  @Configuration
  static class FailingHandlerConfig {
    @Bean
    FailingHandler failingHandler() {
      return new FailingHandler();
    }
  }

  @Configuration
  static class InterceptorConfig {
    final List<String> seen = new CopyOnWriteArrayList<>();

    @Bean
    DispatchInterceptor recordingInterceptor() {
      return DispatchInterceptor.before((ctx, event) -> seen.add(event.eventType().name()));
    }
  }

  @Configuration
  static class CustomConnectionProviderConfig {
    static final ConnectionProvider PROVIDER = () -> {
      throw new SQLException("not used");
    };

    @Bean
    ConnectionProvider customConnectionProvider() {
      return PROVIDER;
    }
  }
}
