package io.txevents;

import java.time.Instant;

/**
 * An immutable fact about something that already happened inside one aggregate.
 *
 * <p>Concrete events normally extend {@link BaseEvent} and add typed payload fields.
 *
 * @see BaseEvent
 * @see AggregateRoot
 */
public interface Event {

  /**
   * Returns the globally unique identifier of this event instance.
   */
  String eventId();

  /**
   * Returns the validated type of this event, used for handler routing.
   */
  EventType eventType();

  /**
   * Returns the wall-clock instant at which the event was raised.
   */
  Instant occurredAt();

  /**
   * Returns the identity of the aggregate that raised the event.
   */
  String aggregateId();
}
