package notify.batch;

import notify.RawEvent;

import java.util.Objects;

/**
 * Grouping key of the batch queue: one batch per recipient and category.
 */
public record BatchKey(String recipientId, String category) {

  public BatchKey {
    Objects.requireNonNull(recipientId, "recipientId");
    Objects.requireNonNull(category, "category");
  }

  public static BatchKey of(RawEvent event) {
    return new BatchKey(event.recipientId(), event.category());
  }
}
