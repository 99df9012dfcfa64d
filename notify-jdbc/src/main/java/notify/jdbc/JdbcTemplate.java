package notify.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in the store implementations.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT, UPDATE or DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new NotifyStoreException("Failed to execute update", e);
    }
  }

  /** Execute the same statement once per parameter row as a JDBC batch. */
  public static int[] batchUpdate(Connection conn, String sql, List<Object[]> rows) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (Object[] params : rows) {
        bindParams(ps, params);
        ps.addBatch();
      }
      return ps.executeBatch();
    } catch (SQLException e) {
      throw new NotifyStoreException("Failed to execute batch update", e);
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
      throw new NotifyStoreException("Failed to execute query", e);
    }
  }

  /** Execute SELECT expected to return at most one row; {@code null} if none. */
  public static <T> T queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? null : rows.get(0);
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
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
