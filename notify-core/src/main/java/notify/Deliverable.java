package notify;

import java.util.List;
import java.util.Objects;

/**
 * A renderable unit handed from the batch queue to the delivery dispatcher.
 *
 * <p>A {@link Kind#SINGLE} deliverable wraps exactly one event and is tagged
 * {@code notification-<eventId>}; a {@link Kind#BATCH} deliverable summarizes two or more
 * events sharing a recipient and category and is tagged {@code batch-<category>}. Popups
 * with the same tag replace each other on the desktop.
 *
 * @param kind          single or batch
 * @param recipientId   the user the deliverable is addressed to
 * @param category      the shared notification type
 * @param tag           replacement tag for the desktop popup
 * @param title         popup title
 * @param body          popup body
 * @param priority      the highest priority among the wrapped events
 * @param notifications the originating events, in arrival order
 */
public record Deliverable(
    Kind kind,
    String recipientId,
    String category,
    String tag,
    String title,
    String body,
    Priority priority,
    List<RawEvent> notifications
) {

  public Deliverable {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(recipientId, "recipientId");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(priority, "priority");
    notifications = List.copyOf(notifications);
    if (notifications.isEmpty()) {
      throw new IllegalArgumentException("notifications cannot be empty");
    }
    if (kind == Kind.SINGLE && notifications.size() != 1) {
      throw new IllegalArgumentException("SINGLE deliverable must wrap exactly one event, got: "
          + notifications.size());
    }
  }

  /**
   * Number of events this deliverable represents.
   *
   * @return the event count, at least 1
   */
  public int count() {
    return notifications.size();
  }

  public enum Kind {
    SINGLE,
    BATCH
  }
}
