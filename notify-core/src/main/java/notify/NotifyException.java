package notify;

/**
 * Base class for failures raised by the notification runtime.
 *
 * <p>All subclasses are unchecked. Most of them never reach the caller: the connection
 * manager, batch queue and dispatcher log and count them instead.
 */
public class NotifyException extends RuntimeException {

  public NotifyException(String message) {
    super(message);
  }

  public NotifyException(String message, Throwable cause) {
    super(message, cause);
  }
}
