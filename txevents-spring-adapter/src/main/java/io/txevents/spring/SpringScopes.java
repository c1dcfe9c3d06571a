package io.txevents.spring;

import io.txevents.tx.TransactionException;

/**
 * Exception plumbing shared by the Spring scopes.
 */
final class SpringScopes {

  /**
   * Carries a checked exception out of a {@code TransactionTemplate} callback, which only
   * rolls back on unchecked ones.
   */
  static final class CheckedWorkFailure extends RuntimeException {
    private final Exception checked;

    CheckedWorkFailure(Exception checked) {
      super(checked);
      this.checked = checked;
    }

    Exception checked() {
      return checked;
    }
  }

  static RuntimeException translate(Exception e) {
    if (e instanceof RuntimeException re) {
      return re;
    }
    return new TransactionException("Transactional work failed: " + e.getMessage(), e);
  }

  static void pause(long delayMs) {
    if (delayMs <= 0) {
      return;
    }
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransactionException("Interrupted while waiting to retry transaction", e);
    }
  }

  private SpringScopes() {}
}
