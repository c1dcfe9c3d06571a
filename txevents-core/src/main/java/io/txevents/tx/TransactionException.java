package io.txevents.tx;

/**
 * Unchecked exception raised by transaction scopes: failure to begin or commit, or a checked
 * exception thrown by the transactional work.
 */
public class TransactionException extends RuntimeException {
  public TransactionException(String message) {
    super(message);
  }

  public TransactionException(String message, Throwable cause) {
    super(message, cause);
  }
}
