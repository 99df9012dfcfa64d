package notify.spi;

import notify.Deliverable;
import notify.delivery.SystemNotification;

import java.util.Map;

/**
 * Where deliveries end up: the in-app event bus, the operating system's notification
 * center and the audio player.
 *
 * <p>Each method is called independently by the
 * {@linkplain notify.delivery.DeliveryPolicyDispatcher dispatcher}; a failure in one
 * does not prevent the others. Implementations should throw
 * {@link DeliverySinkException} on failure.
 */
public interface NotificationSink {

  /**
   * Publishes the deliverable to in-app consumers. Called for every deliverable,
   * including suppressed ones.
   *
   * @param deliverable the deliverable
   */
  void publish(Deliverable deliverable);

  /**
   * Shows a desktop popup. A popup with the same {@link SystemNotification#tag()}
   * replaces any popup currently shown under that tag.
   *
   * @param notification the popup to show
   */
  void show(SystemNotification notification);

  /**
   * Plays a notification sound.
   *
   * @param sound the sound resource, e.g. {@code "/sounds/message.mp3"}
   */
  void playSound(String sound);

  /**
   * Closes the popup shown under {@code tag}, if it is still open.
   *
   * @param tag the popup tag
   */
  default void dismiss(String tag) {
  }

  /**
   * Reports a change to an already delivered notification, e.g. it was marked read
   * on another device.
   *
   * @param newRow column values after the change
   * @param oldRow column values before the change, possibly empty
   */
  default void recordUpdated(Map<String, String> newRow, Map<String, String> oldRow) {
  }
}
