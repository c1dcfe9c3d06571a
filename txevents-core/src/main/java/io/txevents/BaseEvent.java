package io.txevents;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * Common fields of a domain event. Subclasses add {@code final} payload fields:
 *
 * <pre>{@code
 * public final class UserDeletedEvent extends BaseEvent {
 *   private final String userId;
 *
 *   public UserDeletedEvent(String userId) {
 *     super(UserEvents.USER_DELETED, userId);
 *     this.userId = userId;
 *   }
 *
 *   public String userId() {
 *     return userId;
 *   }
 * }
 * }</pre>
 *
 * <p>Each event is assigned a monotonic ULID and the current instant at construction.
 */
public abstract class BaseEvent implements Event {
  private final String eventId;
  private final EventType eventType;
  private final Instant occurredAt;
  private final String aggregateId;

  /**
   * @param eventType   the event type; validated when it was created
   * @param aggregateId identity of the aggregate raising the event
   */
  protected BaseEvent(EventType eventType, String aggregateId) {
    this.eventType = Objects.requireNonNull(eventType, "eventType");
    this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
    this.eventId = UlidCreator.getMonotonicUlid().toString();
    this.occurredAt = Instant.now();
  }

  @Override
  public final String eventId() {
    return eventId;
  }

  @Override
  public final EventType eventType() {
    return eventType;
  }

  @Override
  public final Instant occurredAt() {
    return occurredAt;
  }

  @Override
  public final String aggregateId() {
    return aggregateId;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{eventId=" + eventId
        + ", eventType=" + eventType
        + ", aggregateId=" + aggregateId + '}';
  }
}
