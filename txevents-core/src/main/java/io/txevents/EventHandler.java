package io.txevents;

import io.txevents.tx.TxContext;

import java.util.Objects;

/**
 * Reacts to a published domain event.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers subscribed through a {@link io.txevents.registry.HandlerRegistry} run
 * <b>synchronously</b> while the publishing transaction is still open. The context they
 * receive carries that transaction, so repository calls made by the handler take part in
 * it and commit or roll back together with the triggering change.
 *
 * <p>Because the enclosing transaction may be retried, a handler must only perform
 * reversible, transaction-participating work. Sending mail or calling a remote API belongs
 * on the {@link io.txevents.dispatch.SynchronousEventBus} after commit.
 *
 * <h2>Error Handling</h2>
 * <p>Throwing aborts the flush and rolls back the whole unit of work.
 *
 * <h2>Typed Handlers</h2>
 * <pre>{@code
 * registry.subscribe(UserEvents.USER_DELETED,
 *     EventHandler.forType(UserDeletedEvent.class, (ctx, event) ->
 *         cancelOrdersOf(ctx, event.userId())));
 * }</pre>
 *
 * @see EventSubscriber
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Handles one event.
   *
   * @param ctx   the context of the unit of work that published the event
   * @param event the event
   * @throws Exception if handling fails; the unit of work is rolled back
   */
  void handle(TxContext ctx, Event event) throws Exception;

  /**
   * Adapts a handler written against one concrete event class. Events of any other class
   * are ignored.
   *
   * @param eventClass the concrete event class this handler understands
   * @param handler    the typed handler
   * @param <E>        the event class
   * @return an untyped handler suitable for subscription
   */
  static <E extends Event> EventHandler forType(Class<E> eventClass, TypedEventHandler<E> handler) {
    Objects.requireNonNull(eventClass, "eventClass");
    Objects.requireNonNull(handler, "handler");
    return (ctx, event) -> {
      if (eventClass.isInstance(event)) {
        handler.handle(ctx, eventClass.cast(event));
      }
    };
  }

  /**
   * Handler for one concrete event class.
   *
   * @param <E> the event class
   */
  @FunctionalInterface
  interface TypedEventHandler<E extends Event> {
    void handle(TxContext ctx, E event) throws Exception;
  }
}
