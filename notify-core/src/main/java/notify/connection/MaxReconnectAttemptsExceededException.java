package notify.connection;

import notify.NotifyException;

/**
 * Terminal connection error: every reconnect attempt failed and the manager gave up.
 * The last transport failure, if any, is attached as the cause.
 */
public class MaxReconnectAttemptsExceededException extends NotifyException {
  private final int attempts;

  public MaxReconnectAttemptsExceededException(int attempts, Throwable lastFailure) {
    super("Max reconnection attempts reached (" + attempts + ")", lastFailure);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }
}
