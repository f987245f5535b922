package io.webhook.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal statement helper shared by the delivery record stores.
 *
 * <p>Every {@link SQLException} is rethrown as a {@link DeliveryStoreException}
 * carrying the failed operation.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Runs an INSERT or UPDATE and returns the affected row count. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new DeliveryStoreException("Failed to execute update: " + e.getMessage(), e);
    }
  }

  /** Runs a SELECT and maps every row. */
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
      throw new DeliveryStoreException("Failed to execute query: " + e.getMessage(), e);
    }
  }

  /** Runs a single-column aggregate such as {@code COUNT(*)}. */
  public static long queryForLong(Connection conn, String sql, Object... params) {
    List<Long> values = query(conn, sql, rs -> rs.getLong(1), params);
    return values.isEmpty() ? 0L : values.get(0);
  }

  /** Converts a nullable column value to an {@link Instant}. */
  public static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }

  /** Converts a nullable {@link Instant} for binding. */
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
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
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
