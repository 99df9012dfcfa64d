package notify.connection;

import notify.spi.TransportChannel;

import java.time.Instant;
import java.util.Objects;

/**
 * A channel registered with a {@link ConnectionManager}.
 *
 * <p>The handle outlives individual transport channels: on every reconnect the manager
 * opens a fresh transport channel for it with the same name, filter and listener.
 * Mutators are package-private and only called while the manager's lock is held.
 */
public final class ChannelHandle {
  private final String name;
  private final ChannelFilter filter;
  private final ChangeListener listener;

  private volatile SubscriptionState state = SubscriptionState.PENDING;
  private volatile long eventCount;
  private volatile long errorCount;
  private volatile Instant lastActivity;

  private TransportChannel transportChannel;
  private long generation = -1;

  ChannelHandle(String name, ChannelFilter filter, ChangeListener listener) {
    this.name = Objects.requireNonNull(name, "name");
    this.filter = Objects.requireNonNull(filter, "filter");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public String name() {
    return name;
  }

  public ChannelFilter filter() {
    return filter;
  }

  public SubscriptionState state() {
    return state;
  }

  /** Change events delivered to the listener since registration. */
  public long eventCount() {
    return eventCount;
  }

  /** Transport failures observed on this channel since registration. */
  public long errorCount() {
    return errorCount;
  }

  public Instant lastActivity() {
    return lastActivity;
  }

  ChangeListener listener() {
    return listener;
  }

  long generation() {
    return generation;
  }

  void opening(long generation) {
    this.generation = generation;
    this.state = SubscriptionState.SUBSCRIBING;
  }

  void attach(TransportChannel channel) {
    this.transportChannel = channel;
  }

  /** Detaches and returns the current transport channel, or {@code null} if none. */
  TransportChannel detach() {
    TransportChannel channel = transportChannel;
    transportChannel = null;
    return channel;
  }

  void subscribed(Instant now) {
    state = SubscriptionState.SUBSCRIBED;
    lastActivity = now;
  }

  void failed(Instant now) {
    state = SubscriptionState.FAILED;
    errorCount++;
    lastActivity = now;
  }

  void eventReceived(Instant now) {
    eventCount++;
    lastActivity = now;
  }

  void pending() {
    state = SubscriptionState.PENDING;
  }

  void closed() {
    state = SubscriptionState.CLOSED;
  }

  @Override
  public String toString() {
    return "ChannelHandle{name=" + name + ", state=" + state + ", table=" + filter.table() + '}';
  }

  /** Lifecycle of one registered channel. */
  public enum SubscriptionState {
    /** Registered, waiting for the connection to (re)open it. */
    PENDING,
    /** Open requested, not yet acknowledged. */
    SUBSCRIBING,
    /** Acknowledged by the server; events flow. */
    SUBSCRIBED,
    /** The last transport channel failed; a reconnect will reopen it. */
    FAILED,
    /** Unsubscribed or cleaned up; never reopened. */
    CLOSED
  }
}
