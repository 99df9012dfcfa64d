package notify.jdbc;

import notify.Priority;
import notify.model.NewNotification;
import notify.model.NotificationRecord;
import notify.spi.NotificationStore;
import notify.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link NotificationStore} over a single notifications table.
 *
 * <p>Expected columns: {@code id, user_id, type, title, content, priority, metadata,
 * is_read, read_at, created_at, expires_at}. See {@code notify/jdbc/schema.sql} for a
 * reference definition. The {@code metadata} column holds a flat JSON object written with
 * the configured {@link JsonCodec}.
 *
 * <p>Inserts into this table are what the realtime channel streams to the recipient.
 */
public final class JdbcNotificationStore implements NotificationStore {
  private static final String COLUMNS =
      "id, user_id, type, title, content, priority, metadata, is_read, read_at, created_at, expires_at";

  private final ConnectionProvider connectionProvider;
  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<NotificationRecord> rowMapper;

  public JdbcNotificationStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_NOTIFICATIONS_TABLE, JsonCodec.getDefault());
  }

  public JdbcNotificationStore(ConnectionProvider connectionProvider, String tableName, JsonCodec jsonCodec) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> new NotificationRecord(
        rs.getString("id"),
        rs.getString("user_id"),
        rs.getString("type"),
        rs.getString("title"),
        rs.getString("content"),
        Priority.parse(rs.getString("priority")),
        this.jsonCodec.parseObject(rs.getString("metadata")),
        rs.getBoolean("is_read"),
        toInstant(rs.getTimestamp("read_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("expires_at")));
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public NotificationRecord create(NewNotification notification) {
    Objects.requireNonNull(notification, "notification");
    withConnection(conn -> JdbcTemplate.update(conn, insertSql(), insertParams(notification)));
    return toRecord(notification);
  }

  /**
   * Inserts all rows in one transaction; either every row is stored or none is.
   */
  @Override
  public List<NotificationRecord> createAll(List<NewNotification> notifications) {
    Objects.requireNonNull(notifications, "notifications");
    if (notifications.isEmpty()) {
      return List.of();
    }
    List<Object[]> rows = new ArrayList<>(notifications.size());
    List<NotificationRecord> records = new ArrayList<>(notifications.size());
    for (NewNotification notification : notifications) {
      rows.add(insertParams(notification));
      records.add(toRecord(notification));
    }
    try (JdbcTransaction tx = JdbcTransaction.begin(connectionProvider)) {
      JdbcTemplate.batchUpdate(tx.connection(), insertSql(), rows);
      tx.commit();
    }
    return Collections.unmodifiableList(records);
  }

  @Override
  public NotificationRecord findById(String id) {
    Objects.requireNonNull(id, "id");
    return withConnection(conn -> JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?", rowMapper, id));
  }

  @Override
  public List<NotificationRecord> findUnread(String userId, int limit) {
    Objects.requireNonNull(userId, "userId");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    return withConnection(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName +
            " WHERE user_id=? AND is_read=FALSE ORDER BY created_at DESC LIMIT ?",
        rowMapper, userId, limit));
  }

  @Override
  public int markRead(List<String> ids, Instant readAt) {
    Objects.requireNonNull(ids, "ids");
    Objects.requireNonNull(readAt, "readAt");
    if (ids.isEmpty()) {
      return 0;
    }
    String placeholders = String.join(",", Collections.nCopies(ids.size(), "?"));
    Object[] params = new Object[ids.size() + 1];
    params[0] = readAt;
    for (int i = 0; i < ids.size(); i++) {
      params[i + 1] = ids.get(i);
    }
    return withConnection(conn -> JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET is_read=TRUE, read_at=?" +
            " WHERE id IN (" + placeholders + ") AND is_read=FALSE",
        params));
  }

  @Override
  public int markAllRead(String userId, Instant readAt) {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(readAt, "readAt");
    return withConnection(conn -> JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET is_read=TRUE, read_at=? WHERE user_id=? AND is_read=FALSE",
        readAt, userId));
  }

  @Override
  public int countUnread(String userId) {
    Objects.requireNonNull(userId, "userId");
    Integer count = withConnection(conn -> JdbcTemplate.queryOne(conn,
        "SELECT COUNT(*) FROM " + tableName + " WHERE user_id=? AND is_read=FALSE",
        rs -> rs.getInt(1), userId));
    return count == null ? 0 : count;
  }

  @Override
  public int purgeExpired(String userId, Instant now) {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(now, "now");
    return withConnection(conn -> JdbcTemplate.update(conn,
        "DELETE FROM " + tableName + " WHERE user_id=? AND expires_at IS NOT NULL AND expires_at < ?",
        userId, now));
  }

  private String insertSql() {
    return "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,FALSE,NULL,?,?)";
  }

  private Object[] insertParams(NewNotification n) {
    return new Object[]{
        n.id(), n.userId(), n.category(), n.title(), n.content(),
        n.priority().wireValue(),
        jsonCodec.toJson(n.metadata()),
        n.createdAt(),
        n.expiresAt()
    };
  }

  private static NotificationRecord toRecord(NewNotification n) {
    return new NotificationRecord(n.id(), n.userId(), n.category(), n.title(), n.content(),
        n.priority(), n.metadata(), false, null, n.createdAt(), n.expiresAt());
  }

  private <T> T withConnection(Function<Connection, T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      throw new NotifyStoreException("Failed to obtain connection", e);
    }
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
