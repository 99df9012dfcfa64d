package notify.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import notify.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code notify.events.received}: rows received from the change stream</li>
 *   <li>{@code notify.events.enqueued}: events added to the batch queue</li>
 *   <li>{@code notify.batch.fastpath}: urgent events delivered without waiting</li>
 *   <li>{@code notify.batch.flushed}: deliverables emitted by a flush, tagged
 *       {@code batched=true|false}</li>
 *   <li>{@code notify.delivery.popup}: system popups shown</li>
 *   <li>{@code notify.delivery.sound}: sounds played</li>
 *   <li>{@code notify.delivery.suppressed}: deliverables muted or held by quiet hours</li>
 *   <li>{@code notify.delivery.sink.failure}: sink calls that threw</li>
 *   <li>{@code notify.preferences.fallback}: deliveries that fell back to default preferences</li>
 *   <li>{@code notify.connection.reconnect}: reconnect attempts scheduled</li>
 *   <li>{@code notify.connection.lost}: connections that exhausted their reconnect budget</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code notify.batch.pending}: events waiting for the next flush</li>
 *   <li>{@code notify.connection.reconnect.attempts}: consecutive failed reconnects</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter eventsReceived;
  private final Counter eventsEnqueued;
  private final Counter fastPath;
  private final Counter singlesFlushed;
  private final Counter batchesFlushed;
  private final Counter popupsShown;
  private final Counter soundsPlayed;
  private final Counter suppressed;
  private final Counter sinkFailures;
  private final Counter preferencesFallbacks;
  private final Counter reconnectsScheduled;
  private final Counter connectionsLost;
  private final Gauge pendingGauge;
  private final Gauge reconnectAttemptsGauge;

  private final AtomicInteger pending = new AtomicInteger();
  private final AtomicInteger reconnectAttempts = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "notify"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "notify");
  }

  /**
   * Creates an exporter with a custom metric name prefix, e.g. one per tenant.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "web.notify"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.eventsReceived = Counter.builder(namePrefix + ".events.received")
        .description("Rows received from the change stream")
        .register(registry);
    this.eventsEnqueued = Counter.builder(namePrefix + ".events.enqueued")
        .description("Events added to the batch queue")
        .register(registry);
    this.fastPath = Counter.builder(namePrefix + ".batch.fastpath")
        .description("Urgent events delivered immediately")
        .register(registry);
    this.singlesFlushed = Counter.builder(namePrefix + ".batch.flushed")
        .description("Deliverables emitted by a flush")
        .tag("batched", "false")
        .register(registry);
    this.batchesFlushed = Counter.builder(namePrefix + ".batch.flushed")
        .description("Deliverables emitted by a flush")
        .tag("batched", "true")
        .register(registry);
    this.popupsShown = Counter.builder(namePrefix + ".delivery.popup")
        .description("System popups shown")
        .register(registry);
    this.soundsPlayed = Counter.builder(namePrefix + ".delivery.sound")
        .description("Notification sounds played")
        .register(registry);
    this.suppressed = Counter.builder(namePrefix + ".delivery.suppressed")
        .description("Deliverables muted or held by quiet hours")
        .register(registry);
    this.sinkFailures = Counter.builder(namePrefix + ".delivery.sink.failure")
        .description("Notification sink calls that failed")
        .register(registry);
    this.preferencesFallbacks = Counter.builder(namePrefix + ".preferences.fallback")
        .description("Deliveries that used default preferences after a store failure")
        .register(registry);
    this.reconnectsScheduled = Counter.builder(namePrefix + ".connection.reconnect")
        .description("Reconnect attempts scheduled")
        .register(registry);
    this.connectionsLost = Counter.builder(namePrefix + ".connection.lost")
        .description("Connections that gave up reconnecting")
        .register(registry);

    this.pendingGauge = Gauge.builder(namePrefix + ".batch.pending", pending, AtomicInteger::get)
        .register(registry);
    this.reconnectAttemptsGauge = Gauge.builder(
            namePrefix + ".connection.reconnect.attempts", reconnectAttempts, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementEventsReceived() {
    if (closed) return;
    eventsReceived.increment();
  }

  @Override
  public void incrementEventsEnqueued() {
    if (closed) return;
    eventsEnqueued.increment();
  }

  @Override
  public void incrementFastPathDeliveries() {
    if (closed) return;
    fastPath.increment();
  }

  @Override
  public void incrementDeliverablesFlushed(boolean batched) {
    if (closed) return;
    (batched ? batchesFlushed : singlesFlushed).increment();
  }

  @Override
  public void recordPendingEvents(int pending) {
    if (closed) return;
    this.pending.set(pending);
  }

  @Override
  public void incrementPopupsShown() {
    if (closed) return;
    popupsShown.increment();
  }

  @Override
  public void incrementSoundsPlayed() {
    if (closed) return;
    soundsPlayed.increment();
  }

  @Override
  public void incrementSuppressed() {
    if (closed) return;
    suppressed.increment();
  }

  @Override
  public void incrementSinkFailures() {
    if (closed) return;
    sinkFailures.increment();
  }

  @Override
  public void incrementPreferencesFallbacks() {
    if (closed) return;
    preferencesFallbacks.increment();
  }

  @Override
  public void incrementReconnectsScheduled() {
    if (closed) return;
    reconnectsScheduled.increment();
  }

  @Override
  public void incrementConnectionsLost() {
    if (closed) return;
    connectionsLost.increment();
  }

  @Override
  public void recordReconnectAttempts(int attempts) {
    if (closed) return;
    reconnectAttempts.set(attempts);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link notify.NotificationSession#close()} so that a closed session
   * leaves no stale gauges behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(eventsReceived, eventsEnqueued, fastPath, singlesFlushed,
        batchesFlushed, popupsShown, soundsPlayed, suppressed, sinkFailures,
        preferencesFallbacks, reconnectsScheduled, connectionsLost,
        pendingGauge, reconnectAttemptsGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
