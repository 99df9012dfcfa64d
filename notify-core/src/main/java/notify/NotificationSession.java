package notify;

import notify.batch.BatchFormatter;
import notify.batch.BatchQueue;
import notify.connection.ChangeEvent;
import notify.connection.ChangeKind;
import notify.connection.ChangeListener;
import notify.connection.ChannelFilter;
import notify.connection.ChannelHandle;
import notify.connection.ConnectionListener;
import notify.connection.ConnectionManager;
import notify.connection.ConnectionState;
import notify.connection.ConnectionStats;
import notify.connection.ExponentialBackoffReconnectPolicy;
import notify.connection.MaxReconnectAttemptsExceededException;
import notify.delivery.DeliveryOutcome;
import notify.delivery.DeliveryPolicyDispatcher;
import notify.delivery.NotificationPreferences;
import notify.delivery.PreferencesUpdate;
import notify.delivery.SoundCatalog;
import notify.model.NewNotification;
import notify.model.NotificationRecord;
import notify.spi.ChangeStreamTransport;
import notify.spi.MetricsExporter;
import notify.spi.NotificationSink;
import notify.spi.NotificationStore;
import notify.spi.PreferencesStore;
import notify.util.DaemonThreadFactory;
import notify.util.JsonCodec;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link ConnectionManager}, a {@link BatchQueue} and a
 * {@link DeliveryPolicyDispatcher} into one {@link AutoCloseable} unit per signed-in user.
 *
 * <p>{@link #subscribeToNotifications(String)} opens the {@code notifications-<userId>}
 * channel: inserted rows flow through the batch queue into the dispatcher, updated rows
 * are reported to {@link NotificationSink#recordUpdated}. The session also fronts the
 * {@link NotificationStore} and {@link PreferencesStore} for the operations the UI needs.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (NotificationSession session = NotificationSession.builder()
 *     .transport(transport)
 *     .notificationStore(store)
 *     .preferencesStore(preferences)
 *     .sink(sink)
 *     .build()) {
 *   session.subscribeToNotifications(userId);
 *   // ...
 * }
 * }</pre>
 *
 * <p>The connection timers and the batch timer share one single-thread scheduler, so
 * timer callbacks never run concurrently with each other.
 *
 * @see NotificationSession.Builder
 */
public final class NotificationSession implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(NotificationSession.class.getName());

  /** Table the notification channel listens on. */
  public static final String NOTIFICATIONS_TABLE = "notifications";

  private static final long FLUSH_TIMEOUT_MS = 5000;

  private final ConnectionManager connectionManager;
  private final BatchQueue batchQueue;
  private final DeliveryPolicyDispatcher dispatcher;
  private final NotificationStore notificationStore;
  private final PreferencesStore preferencesStore;
  private final NotificationSink sink;
  private final MetricsExporter metrics;
  private final boolean closeMetrics;
  private final boolean flushOnClose;
  private final JsonCodec jsonCodec;
  private final Clock clock;
  private final ScheduledExecutorService ownedScheduler;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private NotificationSession(Builder builder) {
    ChangeStreamTransport transport = Objects.requireNonNull(builder.transport, "transport");
    this.preferencesStore = Objects.requireNonNull(builder.preferencesStore, "preferencesStore");
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    this.notificationStore = builder.notificationStore;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.closeMetrics = builder.closeMetrics;
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
    NotifyConfig config = builder.config != null ? builder.config : new NotifyConfig();
    this.flushOnClose = config.isFlushOnClose();

    ScheduledExecutorService scheduler = builder.scheduler;
    if (scheduler == null) {
      scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("notify-session-"));
      this.ownedScheduler = scheduler;
    } else {
      this.ownedScheduler = null;
    }

    DeliveryPolicyDispatcher.Builder dispatcherBuilder = DeliveryPolicyDispatcher.builder()
        .preferencesStore(preferencesStore)
        .sink(sink)
        .soundCatalog(builder.soundCatalog)
        .clock(clock)
        .autoCloseMs(config.getPopupAutoCloseMs())
        .workerCount(config.getDeliveryWorkers())
        .metrics(metrics)
        .scheduler(scheduler);
    if (builder.deliveryExecutor != null) {
      dispatcherBuilder.executor(builder.deliveryExecutor);
    }
    this.dispatcher = dispatcherBuilder.build();

    this.batchQueue = BatchQueue.builder()
        .handler(deliverable -> dispatcher.dispatch(deliverable)
            .whenComplete((outcome, error) -> {
              if (error != null) {
                logger.log(Level.FINE, "Delivery of " + deliverable.tag() + " not completed", error);
              }
            }))
        .formatter(builder.formatter)
        .batchDelayMs(config.getBatchDelayMs())
        .flushOnClose(config.isFlushOnClose())
        .metrics(metrics)
        .scheduler(scheduler)
        .build();

    ConnectionManager.Builder connectionBuilder = ConnectionManager.builder()
        .transport(transport)
        .reconnectPolicy(new ExponentialBackoffReconnectPolicy(
            config.getReconnectBaseDelayMs(), config.getReconnectMaxDelayMs()))
        .maxReconnectAttempts(config.getMaxReconnectAttempts())
        .staleTimeoutMs(config.getStaleTimeoutMs())
        .metrics(metrics)
        .clock(clock)
        .scheduler(scheduler);
    builder.connectionListeners.forEach(connectionBuilder::listener);
    this.connectionManager = connectionBuilder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Realtime ─────────────────────────────────────────────────────

  /**
   * Subscribes to the user's notification rows on channel {@code notifications-<userId>}.
   *
   * @param userId the signed-in user
   * @return the channel handle
   * @throws notify.connection.DuplicateChannelException if already subscribed for this user
   */
  public ChannelHandle subscribeToNotifications(String userId) {
    Objects.requireNonNull(userId, "userId");
    return connectionManager.subscribe(
        notificationChannel(userId),
        ChannelFilter.columnEquals(NOTIFICATIONS_TABLE, ChangeKind.ALL, "user_id", userId),
        this::onNotificationChange);
  }

  /**
   * Registers an additional channel on this session's connection.
   *
   * @see ConnectionManager#subscribe
   */
  public ChannelHandle subscribe(String name, ChannelFilter filter, ChangeListener listener) {
    return connectionManager.subscribe(name, filter, listener);
  }

  /**
   * @see ConnectionManager#unsubscribe
   */
  public boolean unsubscribe(String name) {
    return connectionManager.unsubscribe(name);
  }

  /**
   * Feeds an event into the batch queue directly, bypassing the change stream.
   *
   * @param event the event
   * @return {@code false} if the session is closed
   */
  public boolean enqueue(RawEvent event) {
    return batchQueue.enqueue(event);
  }

  /**
   * Dispatches a deliverable immediately, bypassing the batch queue.
   *
   * @param deliverable the deliverable
   * @return the delivery outcome
   */
  public CompletableFuture<DeliveryOutcome> deliverNow(Deliverable deliverable) {
    return dispatcher.dispatch(deliverable);
  }

  public ConnectionState connectionState() {
    return connectionManager.state();
  }

  /**
   * @return the terminal connection error, or {@code null} while connected or retrying
   */
  public MaxReconnectAttemptsExceededException connectionError() {
    return connectionManager.connectionError();
  }

  public ConnectionStats stats() {
    return connectionManager.stats();
  }

  public void addConnectionListener(ConnectionListener listener) {
    connectionManager.addListener(listener);
  }

  /**
   * Re-opens every channel after the connection gave up.
   *
   * @see ConnectionManager#retry()
   */
  public void reconnect() {
    connectionManager.retry();
  }

  public ConnectionManager connectionManager() {
    return connectionManager;
  }

  public BatchQueue batchQueue() {
    return batchQueue;
  }

  public DeliveryPolicyDispatcher dispatcher() {
    return dispatcher;
  }

  // ── Stored notifications ─────────────────────────────────────────

  /**
   * Stores a notification. Its recipient receives it through the change stream.
   *
   * @param notification the notification
   * @return the stored row
   * @throws IllegalStateException if no {@link NotificationStore} is configured
   */
  public NotificationRecord send(NewNotification notification) {
    return requireStore().create(Objects.requireNonNull(notification, "notification"));
  }

  /**
   * Stores one copy of {@code template} per user, in a single transaction.
   *
   * @param userIds  recipients
   * @param template the notification to copy; its own recipient is ignored
   * @return the stored rows, in {@code userIds} order
   */
  public List<NotificationRecord> sendToAll(List<String> userIds, NewNotification template) {
    Objects.requireNonNull(userIds, "userIds");
    Objects.requireNonNull(template, "template");
    List<NewNotification> copies = new ArrayList<>(userIds.size());
    for (String userId : userIds) {
      copies.add(template.forUser(userId));
    }
    return requireStore().createAll(copies);
  }

  public List<NotificationRecord> unread(String userId, int limit) {
    return requireStore().findUnread(userId, limit);
  }

  public int unreadCount(String userId) {
    return requireStore().countUnread(userId);
  }

  public int markRead(List<String> notificationIds) {
    return requireStore().markRead(notificationIds, clock.instant());
  }

  public int markAllRead(String userId) {
    return requireStore().markAllRead(userId, clock.instant());
  }

  /**
   * Deletes the user's notifications whose expiry has passed.
   *
   * @param userId the user
   * @return number of rows deleted
   */
  public int purgeExpired(String userId) {
    return requireStore().purgeExpired(userId, clock.instant());
  }

  // ── Preferences ──────────────────────────────────────────────────

  /**
   * Returns the user's stored preferences, or the defaults when none are stored.
   *
   * @param userId the user
   * @return the effective preferences
   */
  public NotificationPreferences preferences(String userId) {
    NotificationPreferences stored = preferencesStore.get(userId);
    return stored != null ? stored : NotificationPreferences.defaults();
  }

  public NotificationPreferences updatePreferences(String userId, PreferencesUpdate update) {
    return preferencesStore.update(userId, update);
  }

  // ── Lifecycle ────────────────────────────────────────────────────

  /**
   * Same as {@link #close()}.
   */
  public void cleanup() {
    close();
  }

  /**
   * Shuts down components in order: connection manager, batch queue, dispatcher, then the
   * metrics exporter if it is {@link AutoCloseable} and not
   * {@linkplain Builder#sharedMetrics shared}. With flush-on-close configured, batches
   * flushed by the queue get up to five seconds to reach the sink before the dispatcher
   * stops. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    try {
      connectionManager.cleanup();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      batchQueue.close();
    } catch (RuntimeException e) {
      first = collect(first, e);
    }
    if (flushOnClose && !dispatcher.awaitIdle(FLUSH_TIMEOUT_MS)) {
      logger.warning("Flushed notifications still in delivery after " + FLUSH_TIMEOUT_MS + " ms; dropping them");
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      first = collect(first, e);
    }
    if (ownedScheduler != null) {
      ownedScheduler.shutdownNow();
    }
    if (closeMetrics && metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        first = collect(first, re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  private static RuntimeException collect(RuntimeException first, RuntimeException next) {
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }

  // ── Internals ────────────────────────────────────────────────────

  static String notificationChannel(String userId) {
    return "notifications-" + userId;
  }

  private void onNotificationChange(ChangeEvent event) {
    switch (event.kind()) {
      case INSERT -> {
        RawEvent raw = toRawEvent(event.newRow());
        if (raw != null) {
          batchQueue.enqueue(raw);
        }
      }
      case UPDATE -> sink.recordUpdated(event.newRow(), event.oldRow());
      default -> logger.fine(() -> "Ignoring " + event.kind() + " on " + event.channel());
    }
  }

  private RawEvent toRawEvent(Map<String, String> row) {
    String userId = row.get("user_id");
    String category = row.get("type");
    if (category == null) {
      category = row.get("category");
    }
    if (userId == null || category == null) {
      logger.warning("Dropping notification row without user_id or type: id=" + row.get("id"));
      return null;
    }
    RawEvent.Builder builder = RawEvent.builder(userId, category)
        .eventId(row.get("id"))
        .title(row.get("title"))
        .body(row.get("content"))
        .priority(Priority.parse(row.get("priority")))
        .occurredAt(parseInstant(row.get("created_at")));
    String metadata = row.get("metadata");
    if (metadata != null) {
      try {
        builder.payload(jsonCodec.parseObject(metadata));
      } catch (IllegalArgumentException e) {
        logger.log(Level.WARNING, "Ignoring malformed metadata on notification " + row.get("id"), e);
      }
    }
    return builder.build();
  }

  private Instant parseInstant(String value) {
    if (value == null || value.isBlank()) {
      return clock.instant();
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      logger.fine(() -> "Unparseable created_at '" + value + "'; using receive time");
      return clock.instant();
    }
  }

  private NotificationStore requireStore() {
    if (notificationStore == null) {
      throw new IllegalStateException("No NotificationStore configured for this session");
    }
    return notificationStore;
  }

  /**
   * Builder for {@link NotificationSession}.
   */
  public static final class Builder {
    private ChangeStreamTransport transport;
    private NotificationStore notificationStore;
    private PreferencesStore preferencesStore;
    private NotificationSink sink;
    private MetricsExporter metrics;
    private boolean closeMetrics = true;
    private NotifyConfig config;
    private SoundCatalog soundCatalog;
    private BatchFormatter formatter;
    private JsonCodec jsonCodec;
    private Clock clock;
    private ScheduledExecutorService scheduler;
    private Executor deliveryExecutor;
    private final List<ConnectionListener> connectionListeners = new ArrayList<>();

    private Builder() {
    }

    /**
     * <b>Required.</b> The realtime transport.
     */
    public Builder transport(ChangeStreamTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the store behind {@link #send}, {@link #markRead} and friends.
     *
     * <p>Optional. Without it the store-backed operations throw
     * {@link IllegalStateException}.
     *
     * @param notificationStore the store
     * @return this builder
     */
    public Builder notificationStore(NotificationStore notificationStore) {
      this.notificationStore = notificationStore;
      return this;
    }

    /**
     * <b>Required.</b> Source of per-user delivery preferences.
     */
    public Builder preferencesStore(PreferencesStore preferencesStore) {
      this.preferencesStore = preferencesStore;
      return this;
    }

    /**
     * <b>Required.</b> Target of popups, sounds and in-app events.
     */
    public Builder sink(NotificationSink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Sets the metrics exporter. It is closed with the session if it is
     * {@link AutoCloseable}.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      this.closeMetrics = true;
      return this;
    }

    /**
     * Sets a metrics exporter that outlives this session, such as one shared by every
     * session of an application. It is never closed by the session.
     *
     * @param metrics the shared metrics exporter
     * @return this builder
     */
    public Builder sharedMetrics(MetricsExporter metrics) {
      this.metrics = metrics;
      this.closeMetrics = false;
      return this;
    }

    /**
     * Optional. Defaults to a new {@link NotifyConfig}.
     */
    public Builder config(NotifyConfig config) {
      this.config = config;
      return this;
    }

    public Builder soundCatalog(SoundCatalog soundCatalog) {
      this.soundCatalog = soundCatalog;
      return this;
    }

    public Builder formatter(BatchFormatter formatter) {
      this.formatter = formatter;
      return this;
    }

    /**
     * Sets the codec used to decode the {@code metadata} column of incoming rows.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     *
     * @param jsonCodec the codec
     * @return this builder
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemDefaultZone()}; its zone is used for quiet
     * hours of users without a zone preference.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the scheduler shared by connection and batch timers. A supplied scheduler is
     * not shut down with the session.
     *
     * <p>Optional. Defaults to a private single-thread daemon scheduler.
     *
     * @param scheduler the scheduler
     * @return this builder
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Optional. Defaults to a pool of {@link NotifyConfig#getDeliveryWorkers()} threads.
     */
    public Builder deliveryExecutor(Executor deliveryExecutor) {
      this.deliveryExecutor = deliveryExecutor;
      return this;
    }

    public Builder connectionListener(ConnectionListener listener) {
      this.connectionListeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    /**
     * @return a new {@link NotificationSession}
     * @throws NullPointerException if {@code transport}, {@code preferencesStore} or
     *                              {@code sink} is null
     */
    public NotificationSession build() {
      return new NotificationSession(this);
    }
  }
}
