package io.txevents;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validated name of a domain event, in the form {@code module.PastTenseVerb}.
 *
 * <p>The part before the dot names the module that owns the event; the part after it
 * is a capitalised past-tense verb phrase describing what happened:
 * <pre>{@code
 * public static final EventType USER_DELETED = EventType.of("users.UserDeleted");
 * }</pre>
 *
 * <p>Declaring event types as {@code static final} constants makes a malformed name fail
 * when the declaring class initialises, long before an event is ever raised.
 */
public final class EventType {
  private static final Pattern FORMAT = Pattern.compile("^[a-z]+\\.[A-Z][a-zA-Z]+$");

  private final String name;

  private EventType(String name) {
    this.name = name;
  }

  /**
   * Creates an event type from its name.
   *
   * @param name the event type name, e.g. {@code "orders.OrderCancelled"}
   * @return the event type
   * @throws NullPointerException if name is null
   * @throws IllegalArgumentException if name does not match {@code module.PastTenseVerb}
   */
  public static EventType of(String name) {
    Objects.requireNonNull(name, "name");
    if (!isValid(name)) {
      throw new IllegalArgumentException(
          "Invalid event type '" + name + "': expected format module.PastTenseVerb");
    }
    return new EventType(name);
  }

  /**
   * Checks whether a name is a well-formed event type. Pure, never throws.
   *
   * @param name candidate name, may be null
   * @return {@code true} if {@link #of(String)} would accept the name
   */
  public static boolean isValid(String name) {
    return name != null && FORMAT.matcher(name).matches();
  }

  public String name() {
    return name;
  }

  /** Returns the owning module, the part before the dot. */
  public String module() {
    return name.substring(0, name.indexOf('.'));
  }

  /** Returns the past-tense verb phrase, the part after the dot. */
  public String verb() {
    return name.substring(name.indexOf('.') + 1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EventType)) return false;
    EventType that = (EventType) o;
    return name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
