package notify.connection;

import java.time.Instant;

/**
 * Point-in-time snapshot of a {@link ConnectionManager}.
 *
 * @param state             aggregate connection state
 * @param reconnectAttempts reconnects scheduled since the last successful subscription
 * @param channelCount      number of registered channels
 * @param eventsReceived    change events delivered across all channels
 * @param lastActivity      time of the last transport callback, or {@code null} if none yet
 */
public record ConnectionStats(
    ConnectionState state,
    int reconnectAttempts,
    int channelCount,
    long eventsReceived,
    Instant lastActivity
) {

  /**
   * Returns {@code true} if every channel is currently subscribed.
   *
   * @return whether the connection is healthy
   */
  public boolean isConnected() {
    return state == ConnectionState.SUBSCRIBED;
  }
}
