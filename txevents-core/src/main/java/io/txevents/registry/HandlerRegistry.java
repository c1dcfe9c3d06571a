package io.txevents.registry;

import io.txevents.EventHandler;
import io.txevents.EventType;

import java.util.List;

/**
 * Lookup side of the event system: maps an {@link EventType} to its handlers.
 *
 * <p>Dispatchers call {@link #handlersFor} once per event and iterate the returned list
 * without holding any lock, so implementations must hand out a copy that later
 * subscriptions cannot change.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Returns the handlers subscribed to the given event type.
   *
   * @param eventType the event type to look up
   * @return immutable list in subscription order, empty when nothing is subscribed
   */
  List<EventHandler> handlersFor(EventType eventType);
}
