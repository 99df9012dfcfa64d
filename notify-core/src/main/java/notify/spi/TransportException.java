package notify.spi;

import notify.NotifyException;

/**
 * Raised by a {@link ChangeStreamTransport} when a channel cannot be requested at all.
 * The connection manager treats it like a channel error and schedules a reconnect.
 */
public class TransportException extends NotifyException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
