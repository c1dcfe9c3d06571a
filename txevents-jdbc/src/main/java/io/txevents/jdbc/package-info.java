/**
 * JDBC storage support.
 *
 * <p>{@link io.txevents.jdbc.TransactionAwareJdbc} is the repository-facing helper: it runs
 * statements on the transaction carried by the context, or on a one-off connection when there
 * is none. Transaction scopes live in {@link io.txevents.jdbc.tx}.
 *
 * @see io.txevents.jdbc.tx.JdbcTransactionScope
 * @see io.txevents.jdbc.TransientFailures
 */
package io.txevents.jdbc;
