package notify.delivery;

/**
 * Delivery channels a user can switch on or off.
 *
 * <p>{@link #EMAIL} is honored by the backend fan-out, not by the in-process dispatcher.
 */
public enum DeliveryChannel {
  EMAIL,
  SYSTEM,
  SOUND
}
