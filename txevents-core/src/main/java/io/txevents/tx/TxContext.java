package io.txevents.tx;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable request-scoped context that carries at most one live transaction handle.
 *
 * <p>Transaction scopes derive a child context holding the handle they opened and pass it to
 * the transactional work; repositories and event handlers extract it from there instead of
 * taking an extra parameter on every method. Embedding never mutates the receiver.
 *
 * <pre>{@code
 * ReadCapability reads = ctx.readCapability()
 *     .orElseGet(() -> oneOffReads);
 * }</pre>
 *
 * @see TransactionScope
 */
public final class TxContext {
  private static final TxContext BACKGROUND = new TxContext(null, null);

  private final ReadWriteTransaction readWrite;
  private final ReadOnlyTransaction readOnly;

  private TxContext(ReadWriteTransaction readWrite, ReadOnlyTransaction readOnly) {
    this.readWrite = readWrite;
    this.readOnly = readOnly;
  }

  /**
   * Returns the empty root context.
   */
  public static TxContext background() {
    return BACKGROUND;
  }

  /**
   * Returns a child context carrying a read-write transaction.
   *
   * @param tx the transaction handle
   * @return the child context
   * @throws NestedTransactionException if this context already carries a transaction
   */
  public TxContext withReadWriteTransaction(ReadWriteTransaction tx) {
    Objects.requireNonNull(tx, "tx");
    if (isTransactionActive()) {
      throw new NestedTransactionException();
    }
    return new TxContext(tx, null);
  }

  /**
   * Returns a child context carrying a read-only transaction.
   *
   * @param tx the transaction handle
   * @return the child context
   * @throws NestedTransactionException if this context already carries a transaction
   */
  public TxContext withReadOnlyTransaction(ReadOnlyTransaction tx) {
    Objects.requireNonNull(tx, "tx");
    if (isTransactionActive()) {
      throw new NestedTransactionException();
    }
    return new TxContext(null, tx);
  }

  public Optional<ReadWriteTransaction> readWriteTransaction() {
    return Optional.ofNullable(readWrite);
  }

  public Optional<ReadOnlyTransaction> readOnlyTransaction() {
    return Optional.ofNullable(readOnly);
  }

  /**
   * Returns the transaction to read through: the read-write transaction if present, so that
   * reads see the unit of work's own writes, otherwise the read-only one.
   *
   * @return the read capability, or empty when no transaction is present
   */
  public Optional<ReadCapability> readCapability() {
    if (readWrite != null) {
      return Optional.of(readWrite);
    }
    return Optional.ofNullable(readOnly);
  }

  public boolean isTransactionActive() {
    return readWrite != null || readOnly != null;
  }

  @Override
  public String toString() {
    if (readWrite != null) return "TxContext{readWrite}";
    if (readOnly != null) return "TxContext{readOnly}";
    return "TxContext{background}";
  }
}
