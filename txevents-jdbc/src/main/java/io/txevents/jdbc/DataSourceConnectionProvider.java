package io.txevents.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Hands out connections of a {@link DataSource}. Use a pooled one in production: a
 * read-write scope opens a fresh connection for every attempt.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  @Override
  public String toString() {
    return "DataSourceConnectionProvider{" + dataSource.getClass().getSimpleName() + "}";
  }
}
