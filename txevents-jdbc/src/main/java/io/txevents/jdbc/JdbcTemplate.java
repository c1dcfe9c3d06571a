package io.txevents.jdbc;

import io.txevents.tx.RowMapper;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Statement helpers shared by the JDBC transaction handles. {@link SQLException}s are rethrown
 * as {@link StoreException}.
 */
public final class JdbcTemplate {

  /** Execute INSERT, UPDATE or DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new StoreException("Failed to execute update: " + sql, e);
    }
  }

  /** Execute one statement per parameter row as a JDBC batch. */
  public static int[] batchUpdate(Connection conn, String sql, List<Object[]> batchParams) {
    if (batchParams.isEmpty()) {
      return new int[0];
    }
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (Object[] params : batchParams) {
        bindParams(ps, params);
        ps.addBatch();
      }
      return ps.executeBatch();
    } catch (SQLException e) {
      throw new StoreException("Failed to execute batch update: " + sql, e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to execute query: " + sql, e);
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else if (param instanceof Enum<?> e) {
        ps.setString(i + 1, e.name());
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
