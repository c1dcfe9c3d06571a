package io.txevents.dispatch;

import io.txevents.Event;
import io.txevents.EventHandler;
import io.txevents.EventPublisher;
import io.txevents.EventSubscriber;
import io.txevents.EventType;
import io.txevents.registry.DefaultHandlerRegistry;
import io.txevents.spi.MetricsExporter;
import io.txevents.tx.TxContext;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Best-effort, immediate delivery of events outside any transaction.
 *
 * <p>Meant for effects that cannot be rolled back, such as sending a notification, once the
 * transaction that produced the event has committed. {@link #publish} invokes every handler
 * at once; a failing handler is logged and the remaining handlers still run. The publisher
 * is never told about handler failures.
 *
 * <p>The bus keeps its own subscriptions, apart from the registry of the transactional
 * dispatcher: a handler subscribed here never runs inside a transaction.
 *
 * <pre>{@code
 * SynchronousEventBus afterCommit = new SynchronousEventBus()
 *     .subscribe(OrderEvents.ORDER_SUBMITTED, notifier);
 *
 * OrderSubmittedEvent submitted = TransactionScopes.executeWithResult(txScope, ctx, txCtx -> ...);
 * afterCommit.publish(ctx, submitted);
 * }</pre>
 *
 * <p>Publishing with a context that carries a transaction is rejected, because the
 * transaction could still roll back or be retried after the effect happened.
 */
public final class SynchronousEventBus implements EventPublisher, EventSubscriber {
  private static final Logger logger = Logger.getLogger(SynchronousEventBus.class.getName());

  private final DefaultHandlerRegistry handlers = new DefaultHandlerRegistry();
  private final MetricsExporter metrics;

  public SynchronousEventBus() {
    this(MetricsExporter.NOOP);
  }

  public SynchronousEventBus(MetricsExporter metrics) {
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  @Override
  public SynchronousEventBus subscribe(EventType eventType, EventHandler handler) {
    handlers.subscribe(eventType, handler);
    return this;
  }

  /**
   * Delivers the event to every subscribed handler.
   *
   * @throws IllegalStateException if {@code ctx} carries a transaction
   */
  @Override
  public void publish(TxContext ctx, Event event) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(event, "event");
    if (ctx.isTransactionActive()) {
      throw new IllegalStateException(
          "SynchronousEventBus must not be used inside a transaction; publish after commit");
    }
    metrics.incrementEventsPublished();
    List<EventHandler> subscribed = handlers.handlersFor(event.eventType());
    for (EventHandler handler : subscribed) {
      try {
        handler.handle(ctx, event);
      } catch (Exception e) {
        metrics.incrementHandlerFailures();
        logger.log(Level.SEVERE, "Handler failed for event " + event.eventType()
            + " (" + event.eventId() + ")", e);
      }
    }
    metrics.incrementEventsDispatched();
  }

  /**
   * Publishes each event in order.
   */
  public void publishAll(TxContext ctx, List<? extends Event> events) {
    for (Event event : events) {
      publish(ctx, event);
    }
  }

  public int handlerCount(EventType eventType) {
    return handlers.handlerCount(eventType);
  }
}
