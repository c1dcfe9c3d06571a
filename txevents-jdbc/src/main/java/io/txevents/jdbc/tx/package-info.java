/**
 * JDBC transaction scopes.
 *
 * <p>{@link io.txevents.jdbc.tx.JdbcTransactionScope} runs read-write work and retries it on
 * serialization failures and deadlocks. {@link io.txevents.jdbc.tx.JdbcReadOnlyTransactionScope}
 * gives consistent multi-query reads. Both embed their handle into the context handed to the
 * work and invalidate it when the transaction ends.
 */
package io.txevents.jdbc.tx;
