package io.txevents.demo;

import io.txevents.demo.notifications.NotificationsModule;
import io.txevents.demo.orders.OrdersModule;
import io.txevents.demo.orders.domain.OrderRepository;
import io.txevents.demo.orders.infrastructure.JdbcOrderRepository;
import io.txevents.demo.users.UsersModule;
import io.txevents.demo.users.domain.UserRepository;
import io.txevents.demo.users.infrastructure.JdbcUserRepository;
import io.txevents.dispatch.SynchronousEventBus;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.jdbc.ConnectionProvider;
import io.txevents.jdbc.DataSourceConnectionProvider;
import io.txevents.jdbc.TransactionAwareJdbc;
import io.txevents.jdbc.tx.JdbcReadOnlyTransactionScope;
import io.txevents.jdbc.tx.JdbcTransactionScope;
import io.txevents.registry.DefaultHandlerRegistry;
import io.txevents.tx.ReadOnlyTransactionScope;
import io.txevents.tx.ReadWriteTransactionScope;

import javax.sql.DataSource;
import java.util.function.UnaryOperator;

/**
 * Wires the users, orders and notifications modules over one database.
 *
 * <p>The modules share one handler registry, one dispatcher factory and one pair of JDBC
 * scopes. They never call each other; orders learns about deleted users only through
 * {@code users.UserDeleted}.
 */
public final class ModularMonolith {
    private final DefaultHandlerRegistry handlerRegistry = new DefaultHandlerRegistry();
    private final SynchronousEventBus afterCommitBus = new SynchronousEventBus();
    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final UsersModule users;
    private final OrdersModule orders;
    private final NotificationsModule notifications;

    public ModularMonolith(DataSource dataSource) {
        this(dataSource, UnaryOperator.identity());
    }

    /**
     * @param orderRepositoryDecorator wraps the order repository before the modules see it
     */
    public ModularMonolith(DataSource dataSource, UnaryOperator<OrderRepository> orderRepositoryDecorator) {
        ConnectionProvider connectionProvider = new DataSourceConnectionProvider(dataSource);
        TransactionAwareJdbc jdbc = new TransactionAwareJdbc(connectionProvider);

        ReadWriteTransactionScope txScope = JdbcTransactionScope.builder()
                .connectionProvider(connectionProvider)
                .build();
        ReadOnlyTransactionScope readScope = new JdbcReadOnlyTransactionScope(connectionProvider);
        TransactionalEventDispatchers dispatchers = TransactionalEventDispatchers.builder()
                .handlerRegistry(handlerRegistry)
                .build();

        this.userRepository = new JdbcUserRepository(jdbc);
        this.orderRepository = orderRepositoryDecorator.apply(new JdbcOrderRepository(jdbc));

        this.users = new UsersModule(userRepository, txScope, readScope, dispatchers);
        this.orders = new OrdersModule(orderRepository, txScope, readScope, dispatchers,
                handlerRegistry, afterCommitBus);
        this.notifications = new NotificationsModule(afterCommitBus);
    }

    public UsersModule users() {
        return users;
    }

    public OrdersModule orders() {
        return orders;
    }

    public NotificationsModule notifications() {
        return notifications;
    }

    public DefaultHandlerRegistry handlerRegistry() {
        return handlerRegistry;
    }

    public UserRepository userRepository() {
        return userRepository;
    }

    public OrderRepository orderRepository() {
        return orderRepository;
    }
}
