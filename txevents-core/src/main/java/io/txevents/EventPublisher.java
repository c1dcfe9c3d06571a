package io.txevents;

import io.txevents.tx.TxContext;

/**
 * Accepts domain events for delivery to subscribed handlers.
 *
 * @see io.txevents.dispatch.TransactionalEventDispatcher
 * @see io.txevents.dispatch.SynchronousEventBus
 */
public interface EventPublisher {

  /**
   * Publishes one event.
   *
   * @param ctx   the caller's context
   * @param event the event
   */
  void publish(TxContext ctx, Event event);
}
