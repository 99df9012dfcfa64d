package notify.connection;

/**
 * Aggregate state of the realtime connection, across all of its channels.
 *
 * <pre>
 *   CONNECTING --all channels acked--> SUBSCRIBED
 *   any --channel error/timeout--> ERROR --> RECONNECTING (if attempts remain)
 *   any --channel closed--> CLOSED --> RECONNECTING (if attempts remain)
 *   RECONNECTING --timer--> CONNECTING
 * </pre>
 *
 * <p>{@link #ERROR} is terminal once the reconnect budget is exhausted; see
 * {@link ConnectionManager#connectionError()}.
 */
public enum ConnectionState {
  CONNECTING,
  SUBSCRIBED,
  RECONNECTING,
  ERROR,
  CLOSED
}
