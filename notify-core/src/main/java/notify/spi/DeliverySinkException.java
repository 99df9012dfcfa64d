package notify.spi;

import notify.NotifyException;

/**
 * Raised by a {@link NotificationSink} when a popup, sound or in-app publish fails.
 * The dispatcher logs it and carries on with the remaining side effects.
 */
public class DeliverySinkException extends NotifyException {

  public DeliverySinkException(String message) {
    super(message);
  }

  public DeliverySinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
