package notify.spi;

/**
 * Observability hook for exporting notification counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge
 * into Micrometer, Prometheus or another monitoring system.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of change events received from the transport.
   */
  void incrementEventsReceived();

  /**
   * Increments the count of events accepted by the batch queue.
   */
  void incrementEventsEnqueued();

  /**
   * Increments the count of urgent events delivered without waiting for the batch window.
   */
  void incrementFastPathDeliveries();

  /**
   * Increments the count of deliverables emitted by a batch flush.
   *
   * @param batched {@code true} for a multi-event batch, {@code false} for a single
   */
  void incrementDeliverablesFlushed(boolean batched);

  /**
   * Records the number of events waiting in the batch queue.
   *
   * @param pending pending event count
   */
  void recordPendingEvents(int pending);

  /**
   * Increments the count of desktop popups shown.
   */
  void incrementPopupsShown();

  /**
   * Increments the count of sounds played.
   */
  void incrementSoundsPlayed();

  /**
   * Increments the count of deliverables whose popup and sound were suppressed by
   * mute lists or quiet hours.
   */
  void incrementSuppressed();

  /**
   * Increments the count of sink calls that threw.
   */
  default void incrementSinkFailures() {
  }

  /**
   * Increments the count of deliveries that fell back to default preferences because
   * the preference store failed.
   */
  default void incrementPreferencesFallbacks() {
  }

  /**
   * Increments the count of reconnects scheduled after a connection drop.
   */
  void incrementReconnectsScheduled();

  /**
   * Increments the count of connections given up after exhausting reconnect attempts.
   */
  void incrementConnectionsLost();

  /**
   * Records the current reconnect attempt counter.
   *
   * @param attempts attempts since the last successful subscription
   */
  default void recordReconnectAttempts(int attempts) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEventsReceived() {
    }

    @Override
    public void incrementEventsEnqueued() {
    }

    @Override
    public void incrementFastPathDeliveries() {
    }

    @Override
    public void incrementDeliverablesFlushed(boolean batched) {
    }

    @Override
    public void recordPendingEvents(int pending) {
    }

    @Override
    public void incrementPopupsShown() {
    }

    @Override
    public void incrementSoundsPlayed() {
    }

    @Override
    public void incrementSuppressed() {
    }

    @Override
    public void incrementReconnectsScheduled() {
    }

    @Override
    public void incrementConnectionsLost() {
    }
  }
}
