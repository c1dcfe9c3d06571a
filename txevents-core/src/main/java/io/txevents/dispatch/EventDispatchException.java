package io.txevents.dispatch;

/**
 * Base class of failures raised while flushing a transactional dispatcher. Thrown out of the
 * transactional work, it rolls the unit of work back.
 */
public class EventDispatchException extends RuntimeException {
  public EventDispatchException(String message) {
    super(message);
  }

  public EventDispatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
