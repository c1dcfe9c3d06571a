package io.txevents.registry;

import io.txevents.EventHandler;
import io.txevents.EventSubscriber;
import io.txevents.EventType;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe registry of event handlers keyed by event type.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
 *     .subscribe(UserEvents.USER_DELETED, userDeletedHandler)
 *     .subscribe(UserEvents.USER_DELETED, auditHandler);
 * }</pre>
 *
 * <p>Modules subscribe while the application starts. Each module receives the same instance,
 * so there is exactly one registry per running application. Subscriptions are permanent.
 *
 * <h2>Thread Safety</h2>
 * <p>Subscriptions may be made concurrently. Lookups return snapshots that are unaffected
 * by subscriptions made afterwards.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry, EventSubscriber {
  private static final Logger logger = Logger.getLogger(DefaultHandlerRegistry.class.getName());

  private final Map<EventType, CopyOnWriteArrayList<EventHandler>> handlers = new ConcurrentHashMap<>();

  @Override
  public DefaultHandlerRegistry subscribe(EventType eventType, EventHandler handler) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(handler, "handler");
    handlers.computeIfAbsent(eventType, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Subscribed handler " + handler.getClass().getName() + " to " + eventType);
    }
    return this;
  }

  @Override
  public List<EventHandler> handlersFor(EventType eventType) {
    CopyOnWriteArrayList<EventHandler> subscribed = handlers.get(eventType);
    if (subscribed == null) {
      return List.of();
    }
    return List.copyOf(subscribed);
  }

  /**
   * Returns the number of handlers subscribed to the given event type.
   */
  public int handlerCount(EventType eventType) {
    CopyOnWriteArrayList<EventHandler> subscribed = handlers.get(eventType);
    return subscribed == null ? 0 : subscribed.size();
  }
}
