package notify.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Names of the two tables the JDBC stores read and write.
 *
 * <p>Names are spliced into SQL text, so only plain identifiers are accepted: a letter or
 * underscore followed by letters, digits or underscores. Schema-qualified names are not
 * supported.
 *
 * @param notifications table holding one row per notification
 * @param settings      table holding one preferences document per user
 */
public record TableNames(String notifications, String settings) {
  public static final String DEFAULT_NOTIFICATIONS_TABLE = "notifications";
  public static final String DEFAULT_SETTINGS_TABLE = "notification_settings";

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public TableNames {
    validate(notifications);
    validate(settings);
    if (notifications.equalsIgnoreCase(settings)) {
      throw new IllegalArgumentException(
          "Notifications and settings must live in different tables: " + notifications);
    }
  }

  public static TableNames defaults() {
    return new TableNames(DEFAULT_NOTIFICATIONS_TABLE, DEFAULT_SETTINGS_TABLE);
  }

  /**
   * @return {@code tableName}, once it is known to be a plain identifier
   * @throws IllegalArgumentException if it is not
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!IDENTIFIER.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Table name is not a plain SQL identifier: '" + tableName + "'");
    }
    return tableName;
  }
}
