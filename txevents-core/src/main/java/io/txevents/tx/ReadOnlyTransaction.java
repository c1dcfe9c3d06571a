package io.txevents.tx;

/**
 * Handle of a live read-only transaction, giving a consistent view across several queries.
 */
public interface ReadOnlyTransaction extends ReadCapability {
}
