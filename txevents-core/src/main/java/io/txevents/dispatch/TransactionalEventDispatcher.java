package io.txevents.dispatch;

import io.txevents.Event;
import io.txevents.EventHandler;
import io.txevents.EventPublisher;
import io.txevents.registry.HandlerRegistry;
import io.txevents.spi.MetricsExporter;
import io.txevents.tx.TxContext;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffers the events of one unit of work and delivers them to their handlers inside that
 * unit's transaction.
 *
 * <p>{@link #publish} only appends to a FIFO queue. {@link #flush} drains the queue and invokes
 * the handlers of each event synchronously, in subscription order, passing them the caller's
 * context. Events that handlers publish during the flush join the end of the same queue and
 * are processed by the same call, so a cascade of reactions completes before the work returns.
 *
 * <p>One flush processes at most {@code maxDepth} events. When more are pending the flush
 * fails with {@link EventProcessingDepthExceededException}, which ends handler cycles. A
 * handler exception aborts the flush with {@link EventHandlerException}. Either failure leaves
 * the events not yet processed in the queue; the caller is expected to let it propagate so
 * the transaction rolls back.
 *
 * <p>An instance holds state of exactly one transaction attempt. Obtain a fresh one inside
 * the transactional work from {@link TransactionalEventDispatchers#newDispatcher()}; a
 * dispatcher reused across attempts of a retried transaction would replay stale events.
 *
 * <h2>Thread Safety</h2>
 * <p>The queue is guarded by a lock that is released while handlers run, so handlers may
 * publish to the dispatcher that is invoking them.
 *
 * @see TransactionalEventDispatchers
 * @see DispatchInterceptor
 */
public final class TransactionalEventDispatcher implements EventPublisher {
  private static final Logger logger = Logger.getLogger(TransactionalEventDispatcher.class.getName());

  public static final int DEFAULT_MAX_DEPTH = 10;

  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<Event> pending = new ArrayDeque<>();
  private boolean flushing;

  private final HandlerRegistry handlerRegistry;
  private final int maxDepth;
  private final List<DispatchInterceptor> interceptors;
  private final MetricsExporter metrics;

  private TransactionalEventDispatcher(Builder builder) {
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    if (builder.maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be >= 1, got: " + builder.maxDepth);
    }
    this.maxDepth = builder.maxDepth;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Appends an event to the queue. Nothing is dispatched until {@link #flush}.
   */
  @Override
  public void publish(TxContext ctx, Event event) {
    Objects.requireNonNull(event, "event");
    lock.lock();
    try {
      pending.addLast(event);
    } finally {
      lock.unlock();
    }
    metrics.incrementEventsPublished();
  }

  /**
   * Appends events in iteration order. Pairs with {@link io.txevents.AggregateRoot#popDomainEvents()}.
   */
  public void publishAll(TxContext ctx, Collection<? extends Event> events) {
    Objects.requireNonNull(events, "events");
    for (Event event : events) {
      publish(ctx, event);
    }
  }

  /**
   * Processes pending events until the queue is empty, including events published by
   * handlers meanwhile.
   *
   * <p>A call made from inside a handler of this dispatcher returns immediately; the
   * outer flush picks up whatever the handler published.
   *
   * @param ctx the context of the unit of work, handed to every handler
   * @throws EventProcessingDepthExceededException if more than {@code maxDepth} events are
   *     pending within this flush
   * @throws EventHandlerException if a handler or interceptor throws
   */
  public void flush(TxContext ctx) {
    lock.lock();
    try {
      if (flushing) {
        return;
      }
      flushing = true;
    } finally {
      lock.unlock();
    }

    try {
      int depth = 0;
      while (true) {
        Event event;
        lock.lock();
        try {
          if (pending.isEmpty()) {
            return;
          }
          if (depth >= maxDepth) {
            metrics.incrementDepthExceeded();
            throw new EventProcessingDepthExceededException(maxDepth);
          }
          event = pending.pollFirst();
        } finally {
          lock.unlock();
        }
        dispatch(ctx, event);
        depth++;
      }
    } finally {
      lock.lock();
      try {
        flushing = false;
      } finally {
        lock.unlock();
      }
    }
  }

  /**
   * Returns the number of events waiting for the next flush.
   */
  public int pendingCount() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  private void dispatch(TxContext ctx, Event event) {
    List<EventHandler> handlers = handlerRegistry.handlersFor(event.eventType());
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Dispatching " + event + " to " + handlers.size() + " handler(s)");
    }
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeHandle(ctx, event);
        completedBefore = i + 1;
      }
      for (EventHandler handler : handlers) {
        handler.handle(ctx, event);
      }
      runAfterHandle(event, null, completedBefore);
    } catch (Exception e) {
      runAfterHandle(event, e, completedBefore);
      metrics.incrementHandlerFailures();
      throw new EventHandlerException(event, e);
    }
    metrics.incrementEventsDispatched();
  }

  private void runAfterHandle(Event event, Exception error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterHandle(event, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterHandle failed", ex);
      }
    }
  }

  /** Builder for {@link TransactionalEventDispatcher}. */
  public static final class Builder {
    private HandlerRegistry handlerRegistry;
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private final List<DispatchInterceptor> interceptors = new ArrayList<>();
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the registry that maps event types to handlers.
     *
     * <p><b>Required.</b>
     *
     * @param handlerRegistry the handler registry
     * @return this builder
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Sets the maximum number of events one flush may process.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @param maxDepth the depth limit
     * @return this builder
     */
    public Builder maxDepth(int maxDepth) {
      this.maxDepth = maxDepth;
      return this;
    }

    /**
     * Adds an interceptor. Interceptors run in the order they are added.
     *
     * @param interceptor the interceptor
     * @return this builder
     */
    public Builder interceptor(DispatchInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Adds several interceptors.
     *
     * @param interceptors the interceptors
     * @return this builder
     */
    public Builder interceptors(List<DispatchInterceptor> interceptors) {
      for (DispatchInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public TransactionalEventDispatcher build() {
      return new TransactionalEventDispatcher(this);
    }
  }
}
