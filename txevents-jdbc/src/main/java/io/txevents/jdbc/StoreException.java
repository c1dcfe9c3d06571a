package io.txevents.jdbc;

/**
 * Unchecked exception wrapping a JDBC error raised by a statement. The {@link java.sql.SQLException}
 * stays reachable as the cause, which is how transient conflicts are recognised.
 */
public final class StoreException extends RuntimeException {
  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
