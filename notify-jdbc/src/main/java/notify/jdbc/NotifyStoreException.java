package notify.jdbc;

import notify.NotifyException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC stores.
 */
public final class NotifyStoreException extends NotifyException {
  public NotifyStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
