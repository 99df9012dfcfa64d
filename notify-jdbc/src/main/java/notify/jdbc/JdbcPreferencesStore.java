package notify.jdbc;

import notify.delivery.NotificationPreferences;
import notify.delivery.PreferencesUpdate;
import notify.spi.PreferencesStore;
import notify.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.Clock;
import java.util.Objects;

/**
 * {@link PreferencesStore} keeping one JSON settings document per user.
 *
 * <p>Expected columns: {@code user_id} (primary key), {@code settings}, {@code updated_at}.
 * {@link #update} reads, merges and writes the row in one transaction; a user without a
 * row starts from {@link NotificationPreferences#defaults()}.
 *
 * @see PreferencesCodec
 */
public final class JdbcPreferencesStore implements PreferencesStore {
  private final ConnectionProvider connectionProvider;
  private final String tableName;
  private final PreferencesCodec codec;
  private final Clock clock;

  public JdbcPreferencesStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_SETTINGS_TABLE, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public JdbcPreferencesStore(ConnectionProvider connectionProvider, String tableName,
      JsonCodec jsonCodec, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
    this.codec = new PreferencesCodec(jsonCodec);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public String tableName() {
    return tableName;
  }

  /**
   * @return the stored preferences, or {@code null} if the user has none
   * @throws IllegalArgumentException if the stored document is not valid JSON
   */
  @Override
  public NotificationPreferences get(String userId) {
    Objects.requireNonNull(userId, "userId");
    try (Connection conn = connectionProvider.getConnection()) {
      return codec.decode(readSettings(conn, userId));
    } catch (SQLException e) {
      throw new NotifyStoreException("Failed to obtain connection", e);
    }
  }

  @Override
  public NotificationPreferences update(String userId, PreferencesUpdate update) {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(update, "update");
    try (JdbcTransaction tx = JdbcTransaction.begin(connectionProvider)) {
      Connection conn = tx.connection();
      NotificationPreferences current = codec.decode(readSettings(conn, userId));
      NotificationPreferences merged =
          (current != null ? current : NotificationPreferences.defaults()).apply(update);
      String settings = codec.encode(merged);
      Instant now = clock.instant();
      int updated = JdbcTemplate.update(conn,
          "UPDATE " + tableName + " SET settings=?, updated_at=? WHERE user_id=?",
          settings, now, userId);
      if (updated == 0) {
        JdbcTemplate.update(conn,
            "INSERT INTO " + tableName + " (user_id, settings, updated_at) VALUES (?,?,?)",
            userId, settings, now);
      }
      tx.commit();
      return merged;
    }
  }

  private String readSettings(Connection conn, String userId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT settings FROM " + tableName + " WHERE user_id=?",
        rs -> rs.getString("settings"), userId);
  }
}
