package notify.batch;

import notify.Deliverable;
import notify.Priority;
import notify.RawEvent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns queued events into {@link Deliverable}s.
 *
 * <p>A single event keeps its own title and body. A batch gets a summary such as
 * "3 new notifications" / "You have 3 new notifications of type messages", using the
 * category's display label.
 */
public final class BatchFormatter {
  private static final Map<String, String> DEFAULT_LABELS = Map.of(
      "message", "messages",
      "system", "system",
      "ad_inquiry", "ad inquiries",
      "ad_approved", "ad approvals",
      "ad_rejected", "ad rejections",
      "promotion", "ad promotions",
      "payment", "payments",
      "alert", "alerts");

  private final Map<String, String> labels;

  public BatchFormatter() {
    this(Map.of());
  }

  /**
   * @param labelOverrides category labels that replace or extend the built-in ones
   */
  public BatchFormatter(Map<String, String> labelOverrides) {
    Map<String, String> merged = new LinkedHashMap<>(DEFAULT_LABELS);
    merged.putAll(Objects.requireNonNull(labelOverrides, "labelOverrides"));
    this.labels = Map.copyOf(merged);
  }

  /**
   * Returns the display label for a category, or the category itself if none is known.
   *
   * @param category the category
   * @return the label
   */
  public String label(String category) {
    return labels.getOrDefault(category, category);
  }

  public Deliverable single(RawEvent event) {
    return new Deliverable(
        Deliverable.Kind.SINGLE,
        event.recipientId(),
        event.category(),
        "notification-" + event.eventId(),
        event.title(),
        event.body(),
        event.priority(),
        List.of(event));
  }

  /**
   * Formats the events of one key. A single event yields a {@link Deliverable.Kind#SINGLE}
   * deliverable.
   *
   * @param key    the batch key
   * @param events the events in arrival order, at least one
   * @return the deliverable
   */
  public Deliverable format(BatchKey key, List<RawEvent> events) {
    if (events.isEmpty()) {
      throw new IllegalArgumentException("events cannot be empty");
    }
    if (events.size() == 1) {
      return single(events.get(0));
    }
    Priority priority = Priority.LOW;
    for (RawEvent event : events) {
      priority = Priority.max(priority, event.priority());
    }
    int count = events.size();
    return new Deliverable(
        Deliverable.Kind.BATCH,
        key.recipientId(),
        key.category(),
        "batch-" + key.category(),
        count + " new notifications",
        "You have " + count + " new notifications of type " + label(key.category()),
        priority,
        events);
  }
}
