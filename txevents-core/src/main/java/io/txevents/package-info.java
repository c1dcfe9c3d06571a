/**
 * Root API of txevents, a transactional domain-event coordinator for modular monoliths.
 *
 * <h2>Core Design</h2>
 * <p>An {@link io.txevents.AggregateRoot aggregate} records {@link io.txevents.Event events}
 * while its business methods run. Inside a
 * {@linkplain io.txevents.tx.TransactionScope transaction scope} the command layer saves the
 * aggregate, hands the drained events to a
 * {@linkplain io.txevents.dispatch.TransactionalEventDispatcher transactional dispatcher} and
 * flushes it. Handlers run synchronously inside the same transaction, so a reaction in another
 * module (cancelling the orders of a deleted user, say) commits or rolls back together with the
 * change that triggered it.
 *
 * <p>Handlers are routed by {@link io.txevents.EventType} through a
 * {@linkplain io.txevents.registry.HandlerRegistry registry} populated once at startup.
 * Delivery is in-process only. Effects that cannot be rolled back go through the
 * {@linkplain io.txevents.dispatch.SynchronousEventBus synchronous bus} after commit.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>txevents-core</b>: event model, context propagation, registry, dispatcher</li>
 *   <li><b>txevents-jdbc</b>: JDBC transaction scopes with retry on transient conflicts</li>
 *   <li><b>txevents-spring-adapter</b>: scopes driven by Spring's transaction manager</li>
 *   <li><b>txevents-spring-boot-starter</b>: auto-configuration and annotated handlers</li>
 *   <li><b>txevents-micrometer</b>: metrics export</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var registry = new DefaultHandlerRegistry()
 *     .subscribe(UserEvents.USER_DELETED, userDeletedHandler);
 * var dispatchers = TransactionalEventDispatchers.builder()
 *     .handlerRegistry(registry)
 *     .build();
 * var txScope = JdbcTransactionScope.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .build();
 *
 * txScope.execute(TxContext.background(), ctx -> {
 *   TransactionalEventDispatcher dispatcher = dispatchers.newDispatcher();
 *   User user = users.findById(ctx, userId);
 *   user.delete();
 *   users.save(ctx, user);
 *   dispatcher.publishAll(ctx, user.popDomainEvents());
 *   dispatcher.flush(ctx);
 * });
 * }</pre>
 *
 * @see io.txevents.AggregateRoot
 * @see io.txevents.EventType
 * @see io.txevents.EventHandler
 * @see io.txevents.tx.TxContext
 */
package io.txevents;
