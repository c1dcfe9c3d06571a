package io.txevents.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Where txevents gets its JDBC connections.
 *
 * <p>{@link io.txevents.jdbc.tx.JdbcTransactionScope} asks for one connection per attempt and
 * {@link TransactionAwareJdbc} asks for one per auto-commit statement issued outside a
 * transaction. Every connection handed out is closed by whoever requested it.
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;
}
