package notify.connection;

/**
 * Strategy for computing the delay before a reconnect attempt.
 *
 * @see ExponentialBackoffReconnectPolicy
 */
@FunctionalInterface
public interface ReconnectPolicy {

  /**
   * Computes the delay before the next reconnect.
   *
   * @param attempt number of reconnects already scheduled since the last successful
   *                subscription, starting at 0
   * @return delay in milliseconds, never negative
   */
  long computeDelayMs(int attempt);
}
