package notify.connection;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row change pushed by the transport on a subscribed channel.
 *
 * @param channel    the channel name it arrived on
 * @param table      the table that changed
 * @param kind       insert, update or delete; never {@link ChangeKind#ALL}
 * @param newRow     column values after the change; empty for deletes
 * @param oldRow     column values before the change; empty for inserts or when unknown.
 *                   Values of nullable columns may be {@code null}
 * @param receivedAt when the transport received the change
 */
public record ChangeEvent(
    String channel,
    String table,
    ChangeKind kind,
    Map<String, String> newRow,
    Map<String, String> oldRow,
    Instant receivedAt
) {

  public ChangeEvent {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(kind, "kind");
    if (kind == ChangeKind.ALL) {
      throw new IllegalArgumentException("ChangeEvent kind must be INSERT, UPDATE or DELETE");
    }
    newRow = copyRow(newRow);
    oldRow = copyRow(oldRow);
    receivedAt = receivedAt == null ? Instant.now() : receivedAt;
  }

  // Map.copyOf rejects null values.
  private static Map<String, String> copyRow(Map<String, String> row) {
    return row == null || row.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(row));
  }
}
