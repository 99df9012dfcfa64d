package notify.spi;

import notify.connection.ChannelFilter;

/**
 * Pluggable realtime change-stream client (Postgres logical replication relay, WebSocket
 * gateway, broker subscription and so on).
 *
 * <p>The {@linkplain notify.connection.ConnectionManager connection manager} owns every
 * channel it opens and is the only caller of this interface. Implementations report the
 * outcome of {@link #openChannel} asynchronously through the supplied callbacks and may
 * invoke them from any thread, including the calling one.
 *
 * <h2>Threading</h2>
 * The manager calls {@link #openChannel} and {@link #closeChannel} while holding its own
 * lock, and every callback acquires that same lock. Callbacks made on the calling thread,
 * from inside either method, are safe. Neither method may block waiting for a callback
 * that another thread is delivering, and a transport must not hold a lock of its own
 * while invoking callbacks if either method needs that lock.
 */
public interface ChangeStreamTransport {

  /**
   * Opens a named channel filtered by {@code filter}.
   *
   * @param name      channel name, unique among open channels
   * @param filter    the server-side filter
   * @param callbacks receives status changes and row changes for this channel
   * @return a handle used to close the channel later
   * @throws TransportException if the channel cannot even be requested
   */
  TransportChannel openChannel(String name, ChannelFilter filter, TransportCallbacks callbacks);

  /**
   * Releases a channel previously returned by {@link #openChannel}. Must tolerate
   * channels that already failed or were already closed. A final status reported from
   * inside this call is ignored by the manager.
   *
   * @param channel the channel to release
   */
  void closeChannel(TransportChannel channel);
}
