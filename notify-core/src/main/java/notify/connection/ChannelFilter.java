package notify.connection;

import java.util.Objects;

/**
 * Server-side filter for a change-stream channel.
 *
 * @param table     the table whose changes are streamed, e.g. {@code "notifications"}
 * @param kind      which row changes to receive
 * @param predicate row predicate in the transport's syntax, e.g. {@code "user_id=eq.42"};
 *                  {@code null} means every row
 */
public record ChannelFilter(String table, ChangeKind kind, String predicate) {

  public ChannelFilter {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(kind, "kind");
    if (table.isEmpty()) {
      throw new IllegalArgumentException("table cannot be empty");
    }
  }

  /**
   * Filter for every change on {@code table}.
   *
   * @param table the table name
   * @return a new filter
   */
  public static ChannelFilter allChanges(String table) {
    return new ChannelFilter(table, ChangeKind.ALL, null);
  }

  /**
   * Filter for changes on {@code table} whose {@code column} equals {@code value}.
   *
   * @param table  the table name
   * @param kind   which row changes to receive
   * @param column the column to match
   * @param value  the value the column must equal
   * @return a new filter
   */
  public static ChannelFilter columnEquals(String table, ChangeKind kind, String column, String value) {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(value, "value");
    return new ChannelFilter(table, kind, column + "=eq." + value);
  }
}
