package notify.delivery;

import notify.Deliverable;

import java.time.Duration;
import java.util.Objects;

/**
 * A desktop popup request handed to {@link notify.spi.NotificationSink#show}.
 *
 * @param tag                replacement tag; a newer popup with the same tag replaces the old one
 * @param title              popup title
 * @param body               popup body
 * @param requireInteraction whether the popup stays until the user dismisses it
 * @param autoClose          how long the popup stays open when interaction is not required;
 *                           {@code null} when it is
 * @param deliverable        the deliverable the popup was rendered from
 */
public record SystemNotification(
    String tag,
    String title,
    String body,
    boolean requireInteraction,
    Duration autoClose,
    Deliverable deliverable
) {

  public SystemNotification {
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(deliverable, "deliverable");
  }
}
