package notify.model;

import notify.Priority;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a stored notification row.
 *
 * @see notify.spi.NotificationStore
 */
public record NotificationRecord(
    String id,
    String userId,
    String category,
    String title,
    String content,
    Priority priority,
    Map<String, String> metadata,
    boolean read,
    Instant readAt,
    Instant createdAt,
    Instant expiresAt
) {

  /**
   * Returns {@code true} if the row has an expiry that lies before {@code now}.
   *
   * @param now the reference time
   * @return whether the row is expired
   */
  public boolean isExpired(Instant now) {
    return expiresAt != null && expiresAt.isBefore(now);
  }
}
