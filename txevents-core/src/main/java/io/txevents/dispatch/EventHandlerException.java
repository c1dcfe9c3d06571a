package io.txevents.dispatch;

import io.txevents.Event;
import io.txevents.EventType;

/**
 * Wraps the exception thrown by a handler, or by an interceptor before the handlers ran,
 * together with the event being processed. The original exception is the cause.
 */
public final class EventHandlerException extends EventDispatchException {
  private final EventType eventType;
  private final String eventId;

  public EventHandlerException(Event event, Throwable cause) {
    super("Handler failed for event " + event.eventType() + " (" + event.eventId() + "): "
        + cause.getMessage(), cause);
    this.eventType = event.eventType();
    this.eventId = event.eventId();
  }

  public EventType eventType() {
    return eventType;
  }

  public String eventId() {
    return eventId;
  }
}
