package notify.delivery;

import notify.Deliverable;
import notify.Priority;
import notify.batch.BatchKey;
import notify.spi.DeliverySinkException;
import notify.spi.MetricsExporter;
import notify.spi.NotificationSink;
import notify.spi.PreferencesStore;
import notify.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a recipient's preferences to each {@link Deliverable} and performs the
 * resulting side effects on a {@link NotificationSink}.
 *
 * <p>For every deliverable the in-app event is always published, so suppressed
 * notifications still show up in the notification list. Popup and sound are then
 * withheld when the category is muted, or when quiet hours are in effect and the
 * deliverable is not {@link Priority#HIGH}. Otherwise a popup is shown if
 * {@link DeliveryChannel#SYSTEM} is enabled and a sound is played if
 * {@link DeliveryChannel#SOUND} is enabled and the priority is not {@link Priority#LOW}.
 *
 * <p>Preferences are loaded on a worker thread once per dispatch. A failing preference
 * store is logged and the {@linkplain NotificationPreferences#defaults() defaults} are used.
 * Each sink call is isolated: a failing popup does not prevent the sound, and vice versa.
 *
 * <p>Popups that do not require interaction are dismissed after the auto-close delay. A
 * newer popup with the same tag restarts that delay.
 *
 * <p>Deliverables for the same recipient and category reach the sink in dispatch order:
 * each one starts only after the previous one for that pair has finished. Different
 * pairs are delivered in parallel on the worker threads.
 *
 * <p>Once {@link #close()} has been called no sink call is started. A delivery that is
 * waiting or in flight completes with {@link DeliveryOutcome.Suppression#CLOSED}.
 *
 * @see DeliveryPolicyDispatcher.Builder
 */
public final class DeliveryPolicyDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryPolicyDispatcher.class.getName());

  private final PreferencesStore preferencesStore;
  private final NotificationSink sink;
  private final SoundCatalog soundCatalog;
  private final Clock clock;
  private final Duration autoClose;
  private final MetricsExporter metrics;
  private final Executor workers;
  private final ExecutorService ownedWorkers;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final Map<String, ScheduledFuture<?>> pendingDismissals = new ConcurrentHashMap<>();
  private final Map<BatchKey, CompletableFuture<DeliveryOutcome>> lanes = new ConcurrentHashMap<>();
  private final AtomicBoolean running = new AtomicBoolean(true);

  private DeliveryPolicyDispatcher(Builder builder) {
    this.preferencesStore = Objects.requireNonNull(builder.preferencesStore, "preferencesStore");
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    this.soundCatalog = builder.soundCatalog != null ? builder.soundCatalog : SoundCatalog.defaults();
    this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.autoCloseMs <= 0) {
      throw new IllegalArgumentException("autoCloseMs must be > 0");
    }
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    this.autoClose = Duration.ofMillis(builder.autoCloseMs);

    if (builder.executor != null) {
      this.workers = builder.executor;
      this.ownedWorkers = null;
    } else {
      this.ownedWorkers = Executors.newFixedThreadPool(
          builder.workerCount, new DaemonThreadFactory("notify-delivery-"));
      this.workers = ownedWorkers;
    }
    if (builder.scheduler != null) {
      this.scheduler = builder.scheduler;
      this.ownsScheduler = false;
    } else {
      this.scheduler = Executors.newSingleThreadScheduledExecutor(
          new DaemonThreadFactory("notify-popup-expiry-"));
      this.ownsScheduler = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Dispatches a deliverable asynchronously.
   *
   * @param deliverable the deliverable
   * @param recipientId whose preferences apply
   * @return the outcome; completes exceptionally if the dispatcher was already closed or
   *     the worker executor rejected the delivery
   */
  public CompletableFuture<DeliveryOutcome> dispatch(Deliverable deliverable, String recipientId) {
    Objects.requireNonNull(deliverable, "deliverable");
    Objects.requireNonNull(recipientId, "recipientId");
    if (!running.get()) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("DeliveryPolicyDispatcher has been closed"));
    }
    BatchKey lane = new BatchKey(recipientId, deliverable.category());
    CompletableFuture<DeliveryOutcome> result = new CompletableFuture<>();
    Runnable task = () -> {
      try {
        result.complete(deliver(deliverable, recipientId));
      } catch (RuntimeException e) {
        result.completeExceptionally(e);
      }
    };
    CompletableFuture<DeliveryOutcome> previous = lanes.put(lane, result);
    if (previous == null) {
      submit(task, result);
    } else {
      previous.whenComplete((outcome, error) -> submit(task, result));
    }
    result.whenComplete((outcome, error) -> lanes.remove(lane, result));
    return result;
  }

  /**
   * Dispatches a deliverable to its own recipient.
   *
   * @param deliverable the deliverable
   * @return the outcome
   */
  public CompletableFuture<DeliveryOutcome> dispatch(Deliverable deliverable) {
    return dispatch(deliverable, deliverable.recipientId());
  }

  private void submit(Runnable task, CompletableFuture<DeliveryOutcome> result) {
    try {
      workers.execute(task);
    } catch (RejectedExecutionException e) {
      if (running.get()) {
        result.completeExceptionally(e);
      } else {
        task.run();
      }
    }
  }

  /**
   * Runs the delivery synchronously on the calling thread.
   *
   * @param deliverable the deliverable
   * @param recipientId whose preferences apply
   * @return the outcome
   */
  DeliveryOutcome deliver(Deliverable deliverable, String recipientId) {
    if (!running.get()) {
      return dropped(deliverable, false);
    }
    NotificationPreferences preferences = null;
    boolean usedDefaults = false;
    try {
      preferences = preferencesStore.get(recipientId);
    } catch (RuntimeException e) {
      PreferencesUnavailableException error = new PreferencesUnavailableException(recipientId, e);
      logger.log(Level.WARNING, error.getMessage(), error);
      metrics.incrementPreferencesFallbacks();
    }
    if (preferences == null) {
      preferences = NotificationPreferences.defaults();
      usedDefaults = true;
    }
    if (!running.get()) {
      return dropped(deliverable, usedDefaults);
    }

    boolean published = runSinkCall("publish", deliverable, () -> sink.publish(deliverable));

    DeliveryOutcome.Suppression suppression = running.get()
        ? suppressionFor(deliverable, preferences) : DeliveryOutcome.Suppression.CLOSED;
    boolean popupShown = false;
    boolean soundPlayed = false;
    if (suppression == DeliveryOutcome.Suppression.NONE) {
      if (preferences.isEnabled(DeliveryChannel.SYSTEM)) {
        popupShown = showPopup(deliverable);
      }
      if (preferences.isEnabled(DeliveryChannel.SOUND) && deliverable.priority() != Priority.LOW) {
        String sound = soundCatalog.soundFor(deliverable.category());
        soundPlayed = runSinkCall("play sound", deliverable, () -> sink.playSound(sound));
        if (soundPlayed) {
          metrics.incrementSoundsPlayed();
        }
      }
    } else if (suppression != DeliveryOutcome.Suppression.CLOSED) {
      metrics.incrementSuppressed();
      logger.fine(() -> "Suppressed popup and sound for " + deliverable.tag() + ": " + suppression);
    }
    return new DeliveryOutcome(deliverable, published, popupShown, soundPlayed, suppression, usedDefaults);
  }

  private static DeliveryOutcome dropped(Deliverable deliverable, boolean usedDefaults) {
    logger.fine(() -> "Dispatcher closed; dropping " + deliverable.tag());
    return new DeliveryOutcome(deliverable, false, false, false,
        DeliveryOutcome.Suppression.CLOSED, usedDefaults);
  }

  private DeliveryOutcome.Suppression suppressionFor(Deliverable deliverable, NotificationPreferences preferences) {
    if (preferences.isMuted(deliverable.category())) {
      return DeliveryOutcome.Suppression.MUTED;
    }
    if (deliverable.priority() != Priority.HIGH && inQuietHours(preferences)) {
      return DeliveryOutcome.Suppression.QUIET_HOURS;
    }
    return DeliveryOutcome.Suppression.NONE;
  }

  private boolean inQuietHours(NotificationPreferences preferences) {
    QuietHours quietHours = preferences.quietHours();
    if (!quietHours.enabled()) {
      return false;
    }
    ZoneId zone = preferences.zone() != null ? preferences.zone() : clock.getZone();
    return quietHours.contains(LocalTime.now(clock.withZone(zone)));
  }

  private boolean showPopup(Deliverable deliverable) {
    boolean requireInteraction = deliverable.priority() == Priority.HIGH;
    SystemNotification popup = new SystemNotification(
        deliverable.tag(),
        deliverable.title(),
        deliverable.body(),
        requireInteraction,
        requireInteraction ? null : autoClose,
        deliverable);
    if (!runSinkCall("show popup", deliverable, () -> sink.show(popup))) {
      return false;
    }
    metrics.incrementPopupsShown();
    if (requireInteraction) {
      cancelDismissal(popup.tag());
    } else {
      scheduleDismissal(popup.tag());
    }
    return true;
  }

  private void scheduleDismissal(String tag) {
    if (!running.get()) {
      return;
    }
    try {
      pendingDismissals.compute(tag, (key, previous) -> {
        if (previous != null) {
          previous.cancel(false);
        }
        return scheduler.schedule(() -> dismiss(key), autoClose.toMillis(), TimeUnit.MILLISECONDS);
      });
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Popup expiry scheduler is shut down; popup " + tag + " stays open", e);
    }
  }

  private void cancelDismissal(String tag) {
    ScheduledFuture<?> previous = pendingDismissals.remove(tag);
    if (previous != null) {
      previous.cancel(false);
    }
  }

  private void dismiss(String tag) {
    pendingDismissals.remove(tag);
    if (!running.get()) {
      return;
    }
    try {
      sink.dismiss(tag);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Notification sink failed to dismiss popup " + tag, e);
      metrics.incrementSinkFailures();
    }
  }

  private boolean runSinkCall(String action, Deliverable deliverable, Runnable call) {
    if (!running.get()) {
      logger.fine(() -> "Dispatcher closed; skipping " + action + " for " + deliverable.tag());
      return false;
    }
    try {
      call.run();
      return true;
    } catch (DeliverySinkException e) {
      logger.log(Level.WARNING, "Notification sink failed to " + action + " for " + deliverable.tag(), e);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Notification sink failed to " + action + " for " + deliverable.tag(),
          new DeliverySinkException(e.getMessage(), e));
    }
    metrics.incrementSinkFailures();
    return false;
  }

  /**
   * @return number of popups waiting to be dismissed
   */
  public int pendingDismissals() {
    return pendingDismissals.size();
  }

  /**
   * Waits until every deliverable dispatched so far has finished.
   *
   * @param timeoutMs how long to wait
   * @return {@code false} if the wait timed out or was interrupted
   */
  public boolean awaitIdle(long timeoutMs) {
    CompletableFuture<?>[] tails = lanes.values().toArray(new CompletableFuture<?>[0]);
    try {
      CompletableFuture.allOf(tails).get(timeoutMs, TimeUnit.MILLISECONDS);
      return true;
    } catch (ExecutionException e) {
      // a failed delivery still counts as finished
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Stops accepting deliverables, cancels pending popup dismissals and shuts down owned
   * threads without waiting for them. Queued deliveries complete as
   * {@link DeliveryOutcome.Suppression#CLOSED} and a delivery in flight makes no further
   * sink call. Idempotent.
   */
  @Override
  public void close() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    pendingDismissals.values().forEach(task -> task.cancel(false));
    pendingDismissals.clear();
    if (ownedWorkers != null) {
      // drained tasks complete their futures with a CLOSED outcome
      ownedWorkers.shutdownNow().forEach(Runnable::run);
    }
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
  }

  /**
   * Builder for {@link DeliveryPolicyDispatcher}.
   */
  public static final class Builder {
    private PreferencesStore preferencesStore;
    private NotificationSink sink;
    private SoundCatalog soundCatalog;
    private Clock clock;
    private long autoCloseMs = 5000;
    private int workerCount = 2;
    private MetricsExporter metrics;
    private Executor executor;
    private ScheduledExecutorService scheduler;

    private Builder() {
    }

    /**
     * Sets the source of per-user preferences.
     *
     * <p><b>Required.</b>
     *
     * @param preferencesStore the preference store
     * @return this builder
     */
    public Builder preferencesStore(PreferencesStore preferencesStore) {
      this.preferencesStore = preferencesStore;
      return this;
    }

    /**
     * Sets the target of popups, sounds and in-app events.
     *
     * <p><b>Required.</b>
     *
     * @param sink the sink
     * @return this builder
     */
    public Builder sink(NotificationSink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Optional. Defaults to {@link SoundCatalog#defaults()}.
     */
    public Builder soundCatalog(SoundCatalog soundCatalog) {
      this.soundCatalog = soundCatalog;
      return this;
    }

    /**
     * Sets the clock used to evaluate quiet hours. Its zone applies to users without a
     * zone of their own.
     *
     * <p>Optional. Defaults to {@link Clock#systemDefaultZone()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how long a popup that does not require interaction stays open.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
     *
     * @param autoCloseMs auto-close delay in milliseconds
     * @return this builder
     */
    public Builder autoCloseMs(long autoCloseMs) {
      this.autoCloseMs = autoCloseMs;
      return this;
    }

    /**
     * Sets the number of delivery worker threads. Ignored when an
     * {@linkplain #executor(Executor) executor} is supplied. Deliveries for one recipient
     * and category never run concurrently, whatever the count.
     *
     * <p>Optional. Defaults to {@code 2}. Must be &gt; 0.
     *
     * @param workerCount worker thread count
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
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
     * Sets the executor that runs deliveries. A supplied executor is not shut down.
     *
     * <p>Optional. Defaults to a fixed pool of {@code workerCount} daemon threads.
     *
     * @param executor the executor
     * @return this builder
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets the scheduler that dismisses expired popups. A supplied scheduler is not
     * shut down.
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

    public DeliveryPolicyDispatcher build() {
      return new DeliveryPolicyDispatcher(this);
    }
  }
}
