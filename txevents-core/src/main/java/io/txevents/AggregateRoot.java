package io.txevents;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for aggregates that record domain events while their business methods run.
 *
 * <p>Only the aggregate itself may record events, through {@link #addDomainEvent(Event)}.
 * The command layer drains them once the aggregate has been saved:
 * <pre>{@code
 * user.delete();
 * users.save(ctx, user);
 * dispatcher.publishAll(ctx, user.popDomainEvents());
 * dispatcher.flush(ctx);
 * }</pre>
 *
 * <p>Draining empties the buffer, so each recorded event is handed out at most once.
 * Instances are not thread-safe; an aggregate belongs to one unit of work.
 */
public abstract class AggregateRoot {
  private final List<Event> domainEvents = new ArrayList<>();

  protected AggregateRoot() {
  }

  /**
   * Records an event raised by a business method of this aggregate.
   *
   * @param event the event
   */
  protected final void addDomainEvent(Event event) {
    domainEvents.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns the recorded events in the order they were raised and empties the buffer.
   * A second call without new events in between returns an empty list.
   *
   * @return unmodifiable list of drained events
   */
  public final List<Event> popDomainEvents() {
    if (domainEvents.isEmpty()) {
      return List.of();
    }
    List<Event> drained = List.copyOf(domainEvents);
    domainEvents.clear();
    return drained;
  }

  /**
   * Returns a snapshot of the recorded events without draining them.
   * Pair with {@link #clearDomainEvents()}; prefer {@link #popDomainEvents()}.
   */
  public final List<Event> domainEvents() {
    return Collections.unmodifiableList(new ArrayList<>(domainEvents));
  }

  public final void clearDomainEvents() {
    domainEvents.clear();
  }

  public final boolean hasDomainEvents() {
    return !domainEvents.isEmpty();
  }
}
