package io.txevents;

/**
 * Registration side of the event system. Modules subscribe their handlers once, while the
 * process starts.
 *
 * @see io.txevents.registry.DefaultHandlerRegistry
 */
public interface EventSubscriber {

  /**
   * Subscribes a handler to an event type. Handlers of one type are invoked in the order
   * they were subscribed.
   *
   * @param eventType the event type
   * @param handler   the handler
   * @return this subscriber for chaining
   */
  EventSubscriber subscribe(EventType eventType, EventHandler handler);
}
