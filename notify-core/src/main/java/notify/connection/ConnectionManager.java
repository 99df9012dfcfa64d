package notify.connection;

import notify.spi.ChangeStreamTransport;
import notify.spi.MetricsExporter;
import notify.spi.TransportCallbacks;
import notify.spi.TransportChannel;
import notify.spi.TransportException;
import notify.spi.TransportStatus;
import notify.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the realtime channels of one session and keeps them subscribed.
 *
 * <p>Channels are registered with {@link #subscribe} and identified by name. When any
 * channel reports an error, a timeout or a close, the manager releases every transport
 * channel, waits {@link ReconnectPolicy#computeDelayMs(int) an exponentially growing
 * delay} and re-opens all registered channels with their original filters and listeners.
 * A successful round (every channel acknowledged) resets the attempt counter. After
 * {@code maxReconnectAttempts} consecutive failed rounds the manager stops retrying, sets
 * {@link #connectionError()} and stays in {@link ConnectionState#ERROR} until
 * {@link #retry()} is called.
 *
 * <p>Transport callbacks are tagged with the connection generation they were opened in;
 * callbacks from an older generation, from an unsubscribed channel or arriving after
 * {@link #cleanup()} are ignored.
 *
 * <p>This class is thread-safe. State mutations happen under the instance lock; change
 * listeners and {@link ConnectionListener}s are invoked without holding it. Transport
 * calls are made under the lock, so transports must follow the threading rules on
 * {@link ChangeStreamTransport}.
 *
 * @see ConnectionManager.Builder
 * @see ChannelHandle
 */
public final class ConnectionManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionManager.class.getName());

  private final ChangeStreamTransport transport;
  private final ReconnectPolicy reconnectPolicy;
  private final int maxReconnectAttempts;
  private final long staleTimeoutMs;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

  private final Map<String, ChannelHandle> handles = new LinkedHashMap<>();
  private ConnectionState state = ConnectionState.CLOSED;
  private int reconnectAttempts;
  private long generation;
  private ScheduledFuture<?> reconnectTask;
  private ScheduledFuture<?> staleCheckTask;
  private Throwable lastFailure;
  private MaxReconnectAttemptsExceededException connectionError;
  private long eventsReceived;
  private Instant lastActivity;
  private volatile boolean cleanedUp;

  private ConnectionManager(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.reconnectPolicy = builder.reconnectPolicy != null
        ? builder.reconnectPolicy : new ExponentialBackoffReconnectPolicy(1000, 30_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    if (builder.maxReconnectAttempts < 0) {
      throw new IllegalArgumentException("maxReconnectAttempts must be >= 0");
    }
    if (builder.staleTimeoutMs < 0) {
      throw new IllegalArgumentException("staleTimeoutMs must be >= 0");
    }
    this.maxReconnectAttempts = builder.maxReconnectAttempts;
    this.staleTimeoutMs = builder.staleTimeoutMs;
    this.listeners.addAll(builder.listeners);

    if (builder.scheduler != null) {
      this.scheduler = builder.scheduler;
      this.ownsScheduler = false;
    } else {
      this.scheduler = Executors.newSingleThreadScheduledExecutor(
          new DaemonThreadFactory("notify-connection-"));
      this.ownsScheduler = true;
    }

    if (staleTimeoutMs > 0) {
      long period = Math.max(1L, staleTimeoutMs / 2);
      this.staleCheckTask = scheduler.scheduleWithFixedDelay(
          this::checkStale, period, period, TimeUnit.MILLISECONDS);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a channel and opens it on the transport.
   *
   * <p>If a reconnect is pending, or the manager has given up, the channel is registered
   * and opened by the next reconnect round (or {@link #retry()}) instead.
   *
   * @param name     unique channel name, e.g. {@code "notifications-42"}
   * @param filter   server-side filter for the channel
   * @param listener receives the channel's row changes
   * @return the registered handle
   * @throws DuplicateChannelException if a channel with the same name is registered
   * @throws IllegalStateException     if {@link #cleanup()} has been called
   */
  public ChannelHandle subscribe(String name, ChannelFilter filter, ChangeListener listener) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(filter, "filter");
    Objects.requireNonNull(listener, "listener");
    synchronized (this) {
      ensureUsable();
      if (handles.containsKey(name)) {
        throw new DuplicateChannelException(name);
      }
      ChannelHandle handle = new ChannelHandle(name, filter, listener);
      handles.put(name, handle);
      if (connectionError != null || reconnectTask != null) {
        logger.fine(() -> "Channel " + name + " registered; it opens with the next connection round");
        return handle;
      }
      transition(ConnectionState.CONNECTING);
      open(handle, generation);
      return handle;
    }
  }

  /**
   * Removes a channel and releases its transport channel. Unknown names and calls after
   * {@link #cleanup()} are no-ops.
   *
   * @param name the channel name
   * @return {@code true} if a channel was removed
   */
  public synchronized boolean unsubscribe(String name) {
    if (cleanedUp) {
      return false;
    }
    ChannelHandle handle = handles.remove(name);
    if (handle == null) {
      return false;
    }
    handle.closed();
    closeTransportChannel(handle);
    if (handles.isEmpty()) {
      cancel(reconnectTask);
      reconnectTask = null;
      reconnectAttempts = 0;
      if (connectionError == null) {
        transition(ConnectionState.CLOSED);
      }
    } else {
      maybeConnected();
    }
    return true;
  }

  /**
   * Clears a terminal {@linkplain #connectionError() connection error}, resets the attempt
   * counter and re-opens every registered channel immediately.
   *
   * @throws IllegalStateException if {@link #cleanup()} has been called
   */
  public synchronized void retry() {
    ensureUsable();
    cancel(reconnectTask);
    reconnectTask = null;
    reconnectAttempts = 0;
    connectionError = null;
    lastFailure = null;
    metrics.recordReconnectAttempts(0);
    openAll();
  }

  /**
   * Releases every channel, cancels all timers and stops the manager. Idempotent. No state
   * change or listener callback happens after the first call.
   */
  public void cleanup() {
    synchronized (this) {
      if (cleanedUp) {
        return;
      }
      cleanedUp = true;
      generation++;
      cancel(reconnectTask);
      cancel(staleCheckTask);
      reconnectTask = null;
      staleCheckTask = null;
      for (ChannelHandle handle : handles.values()) {
        handle.closed();
        closeTransportChannel(handle);
      }
      handles.clear();
      state = ConnectionState.CLOSED;
    }
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
    logger.fine("Connection manager cleaned up");
  }

  /**
   * Same as {@link #cleanup()}.
   */
  @Override
  public void close() {
    cleanup();
  }

  public synchronized ConnectionState state() {
    return state;
  }

  /**
   * Returns the terminal error raised when reconnect attempts ran out, or {@code null}
   * while the manager is still connected or retrying.
   *
   * @return the terminal error, or {@code null}
   */
  public synchronized MaxReconnectAttemptsExceededException connectionError() {
    return connectionError;
  }

  public synchronized int reconnectAttempts() {
    return reconnectAttempts;
  }

  /**
   * @return registered channels in registration order
   */
  public synchronized List<ChannelHandle> channels() {
    return List.copyOf(handles.values());
  }

  /**
   * @param name the channel name
   * @return the registered channel, or {@code null}
   */
  public synchronized ChannelHandle channel(String name) {
    return handles.get(name);
  }

  public synchronized ConnectionStats stats() {
    return new ConnectionStats(state, reconnectAttempts, handles.size(), eventsReceived, lastActivity);
  }

  public boolean isCleanedUp() {
    return cleanedUp;
  }

  public void addListener(ConnectionListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(ConnectionListener listener) {
    listeners.remove(listener);
  }

  // ── Connection rounds (callers hold the lock) ─────────────────────

  private void openAll() {
    long round = ++generation;
    for (ChannelHandle handle : handles.values()) {
      closeTransportChannel(handle);
      handle.pending();
    }
    if (handles.isEmpty()) {
      reconnectAttempts = 0;
      transition(ConnectionState.CLOSED);
      return;
    }
    transition(ConnectionState.CONNECTING);
    for (ChannelHandle handle : new ArrayList<>(handles.values())) {
      open(handle, round);
      if (generation != round) {
        return; // a synchronous failure already scheduled the next round
      }
    }
  }

  private void open(ChannelHandle handle, long round) {
    handle.opening(round);
    TransportChannel channel;
    try {
      channel = transport.openChannel(handle.name(), handle.filter(), new HandleCallbacks(handle, round));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to open channel " + handle.name(), e);
      if (isCurrent(handle, round)) {
        handle.failed(clock.instant());
        channelFailed(ConnectionState.ERROR, e);
      }
      return;
    }
    if (isCurrent(handle, round)) {
      handle.attach(channel);
    } else {
      closeQuietly(channel);
    }
  }

  private void channelFailed(ConnectionState failureState, Throwable cause) {
    lastFailure = cause;
    generation++;
    for (ChannelHandle handle : handles.values()) {
      closeTransportChannel(handle);
      if (handle.state() != ChannelHandle.SubscriptionState.FAILED) {
        handle.pending();
      }
    }
    transition(failureState);
    scheduleReconnect();
  }

  private void scheduleReconnect() {
    if (reconnectAttempts >= maxReconnectAttempts) {
      giveUp();
      return;
    }
    long delayMs = reconnectPolicy.computeDelayMs(reconnectAttempts);
    reconnectAttempts++;
    metrics.incrementReconnectsScheduled();
    metrics.recordReconnectAttempts(reconnectAttempts);
    logger.info("Reconnecting in " + delayMs + " ms (attempt " + reconnectAttempts
        + "/" + maxReconnectAttempts + ")");
    transition(ConnectionState.RECONNECTING);
    try {
      reconnectTask = scheduler.schedule(this::runReconnect, delayMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.SEVERE, "Scheduler rejected reconnect; giving up", e);
      lastFailure = e;
      reconnectTask = null;
      giveUp();
    }
  }

  private void giveUp() {
    MaxReconnectAttemptsExceededException error =
        new MaxReconnectAttemptsExceededException(maxReconnectAttempts, lastFailure);
    connectionError = error;
    logger.log(Level.SEVERE, error.getMessage(), lastFailure);
    metrics.incrementConnectionsLost();
    transition(ConnectionState.ERROR);
    fire(listener -> listener.onConnectionLost(error));
  }

  private void runReconnect() {
    synchronized (this) {
      if (cleanedUp || connectionError != null) {
        return;
      }
      reconnectTask = null;
      openAll();
    }
  }

  private void maybeConnected() {
    if (state != ConnectionState.CONNECTING || handles.isEmpty()) {
      return;
    }
    for (ChannelHandle handle : handles.values()) {
      if (handle.state() != ChannelHandle.SubscriptionState.SUBSCRIBED) {
        return;
      }
    }
    if (reconnectAttempts > 0) {
      logger.info("Reconnected after " + reconnectAttempts + " attempt(s)");
    }
    reconnectAttempts = 0;
    lastFailure = null;
    metrics.recordReconnectAttempts(0);
    transition(ConnectionState.SUBSCRIBED);
  }

  private boolean isCurrent(ChannelHandle handle, long round) {
    return !cleanedUp && generation == round && handles.get(handle.name()) == handle;
  }

  // ── Transport callbacks ──────────────────────────────────────────

  private synchronized void handleStatus(ChannelHandle handle, long round,
      TransportStatus status, Throwable cause) {
    if (!isCurrent(handle, round)) {
      logger.fine(() -> "Ignoring " + status + " from stale channel " + handle.name());
      return;
    }
    Instant now = clock.instant();
    lastActivity = now;
    switch (status) {
      case SUBSCRIBED -> {
        handle.subscribed(now);
        logger.fine(() -> "Channel " + handle.name() + " subscribed");
        maybeConnected();
      }
      case CHANNEL_ERROR, TIMED_OUT -> {
        handle.failed(now);
        logger.warning("Channel " + handle.name() + " reported " + status);
        channelFailed(ConnectionState.ERROR, failureCause(handle, status, cause));
      }
      case CLOSED -> {
        handle.failed(now);
        logger.warning("Channel " + handle.name() + " closed");
        channelFailed(ConnectionState.CLOSED, failureCause(handle, status, cause));
      }
    }
  }

  private static Throwable failureCause(ChannelHandle handle, TransportStatus status, Throwable cause) {
    return cause != null ? cause : new TransportException("Channel " + handle.name() + " reported " + status);
  }

  private void handleEvent(ChannelHandle handle, long round, ChangeEvent event) {
    synchronized (this) {
      if (!isCurrent(handle, round)) {
        return;
      }
      Instant now = clock.instant();
      handle.eventReceived(now);
      lastActivity = now;
      eventsReceived++;
    }
    metrics.incrementEventsReceived();
    try {
      handle.listener().onChange(event);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Change listener for channel " + handle.name() + " failed", e);
    }
  }

  private void checkStale() {
    try {
      synchronized (this) {
        if (cleanedUp || state != ConnectionState.SUBSCRIBED || lastActivity == null) {
          return;
        }
        long silentMs = Duration.between(lastActivity, clock.instant()).toMillis();
        if (silentMs <= staleTimeoutMs) {
          return;
        }
        logger.warning("No activity for " + silentMs + " ms; treating connection as dropped");
        channelFailed(ConnectionState.CLOSED,
            new TransportException("Connection stale for " + silentMs + " ms"));
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Stale connection check failed", t);
    }
  }

  // ── Helpers ──────────────────────────────────────────────────────

  private void transition(ConnectionState next) {
    ConnectionState previous = state;
    if (previous == next) {
      return;
    }
    state = next;
    logger.fine(() -> "Connection state " + previous + " -> " + next);
    fire(listener -> listener.onStateChange(previous, next));
  }

  private void fire(Consumer<ConnectionListener> notification) {
    if (listeners.isEmpty()) {
      return;
    }
    try {
      scheduler.execute(() -> {
        for (ConnectionListener listener : listeners) {
          try {
            notification.accept(listener);
          } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Connection listener failed", e);
          }
        }
      });
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Scheduler is shut down; connection listeners not notified", e);
    }
  }

  private void closeTransportChannel(ChannelHandle handle) {
    TransportChannel channel = handle.detach();
    if (channel != null) {
      closeQuietly(channel);
    }
  }

  private void closeQuietly(TransportChannel channel) {
    try {
      transport.closeChannel(channel);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close channel " + channel.name(), e);
    }
  }

  private static void cancel(ScheduledFuture<?> task) {
    if (task != null) {
      task.cancel(false);
    }
  }

  private void ensureUsable() {
    if (cleanedUp) {
      throw new IllegalStateException("ConnectionManager has been cleaned up");
    }
  }

  private final class HandleCallbacks implements TransportCallbacks {
    private final ChannelHandle handle;
    private final long round;

    HandleCallbacks(ChannelHandle handle, long round) {
      this.handle = handle;
      this.round = round;
    }

    @Override
    public void onStatus(TransportStatus status) {
      handleStatus(handle, round, status, null);
    }

    @Override
    public void onStatus(TransportStatus status, Throwable cause) {
      handleStatus(handle, round, status, cause);
    }

    @Override
    public void onEvent(ChangeEvent event) {
      handleEvent(handle, round, event);
    }
  }

  /**
   * Builder for {@link ConnectionManager}.
   */
  public static final class Builder {
    private ChangeStreamTransport transport;
    private ReconnectPolicy reconnectPolicy;
    private int maxReconnectAttempts = 5;
    private long staleTimeoutMs;
    private MetricsExporter metrics;
    private Clock clock;
    private ScheduledExecutorService scheduler;
    private final List<ConnectionListener> listeners = new ArrayList<>();

    private Builder() {
    }

    /**
     * Sets the realtime transport that channels are opened on.
     *
     * <p><b>Required.</b>
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(ChangeStreamTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the delay strategy between reconnect rounds.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffReconnectPolicy} with a 1s base
     * and a 30s cap.
     *
     * @param reconnectPolicy the reconnect policy
     * @return this builder
     */
    public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
      this.reconnectPolicy = reconnectPolicy;
      return this;
    }

    /**
     * Sets how many consecutive reconnect rounds may fail before the manager gives up.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 0.
     *
     * @param maxReconnectAttempts the reconnect budget
     * @return this builder
     */
    public Builder maxReconnectAttempts(int maxReconnectAttempts) {
      this.maxReconnectAttempts = maxReconnectAttempts;
      return this;
    }

    /**
     * Sets how long a subscribed connection may receive no transport callback before it
     * is treated as dropped.
     *
     * <p>Optional. Defaults to {@code 0} (disabled).
     *
     * @param staleTimeoutMs silence threshold in milliseconds
     * @return this builder
     */
    public Builder staleTimeoutMs(long staleTimeoutMs) {
      this.staleTimeoutMs = staleTimeoutMs;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the scheduler that runs reconnect timers, stale checks and listener callbacks.
     *
     * <p>Optional. Defaults to a private single-thread daemon scheduler that is shut down
     * by {@link ConnectionManager#cleanup()}. A supplied scheduler is not shut down.
     *
     * @param scheduler the scheduler
     * @return this builder
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Adds a lifecycle listener.
     *
     * @param listener the listener
     * @return this builder
     */
    public Builder listener(ConnectionListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    /**
     * @return a new {@link ConnectionManager}
     * @throws NullPointerException     if {@code transport} is null
     * @throws IllegalArgumentException if {@code maxReconnectAttempts} or
     *                                  {@code staleTimeoutMs} is negative
     */
    public ConnectionManager build() {
      return new ConnectionManager(this);
    }
  }
}
