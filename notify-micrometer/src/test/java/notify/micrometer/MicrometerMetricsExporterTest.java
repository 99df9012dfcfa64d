package notify.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementEventCounters() {
    exporter.incrementEventsReceived();
    exporter.incrementEventsReceived();
    exporter.incrementEventsEnqueued();
    exporter.incrementFastPathDeliveries();

    assertEquals(2.0, counter("notify.events.received").count());
    assertEquals(1.0, counter("notify.events.enqueued").count());
    assertEquals(1.0, counter("notify.batch.fastpath").count());
  }

  @Test
  void flushedDeliverablesAreTaggedByKind() {
    exporter.incrementDeliverablesFlushed(true);
    exporter.incrementDeliverablesFlushed(false);
    exporter.incrementDeliverablesFlushed(false);

    assertEquals(1.0, registry.find("notify.batch.flushed").tag("batched", "true").counter().count());
    assertEquals(2.0, registry.find("notify.batch.flushed").tag("batched", "false").counter().count());
  }

  @Test
  void incrementDeliveryCounters() {
    exporter.incrementPopupsShown();
    exporter.incrementSoundsPlayed();
    exporter.incrementSuppressed();
    exporter.incrementSuppressed();
    exporter.incrementSinkFailures();
    exporter.incrementPreferencesFallbacks();

    assertEquals(1.0, counter("notify.delivery.popup").count());
    assertEquals(1.0, counter("notify.delivery.sound").count());
    assertEquals(2.0, counter("notify.delivery.suppressed").count());
    assertEquals(1.0, counter("notify.delivery.sink.failure").count());
    assertEquals(1.0, counter("notify.preferences.fallback").count());
  }

  @Test
  void incrementConnectionCounters() {
    exporter.incrementReconnectsScheduled();
    exporter.incrementReconnectsScheduled();
    exporter.incrementConnectionsLost();

    assertEquals(2.0, counter("notify.connection.reconnect").count());
    assertEquals(1.0, counter("notify.connection.lost").count());
  }

  @Test
  void gaugesTrackLatestValue() {
    exporter.recordPendingEvents(7);
    exporter.recordReconnectAttempts(3);
    assertEquals(7.0, gauge("notify.batch.pending").value());
    assertEquals(3.0, gauge("notify.connection.reconnect.attempts").value());

    exporter.recordPendingEvents(0);
    exporter.recordReconnectAttempts(0);
    assertEquals(0.0, gauge("notify.batch.pending").value());
    assertEquals(0.0, gauge("notify.connection.reconnect.attempts").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "web.notify");
    custom.incrementPopupsShown();
    custom.recordPendingEvents(4);

    assertEquals(1.0, counter("web.notify.delivery.popup").count());
    assertEquals(4.0, gauge("web.notify.batch.pending").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementPopupsShown();

    exporter.close();
    exporter.incrementPopupsShown();
    exporter.recordPendingEvents(9);

    assertNull(registry.find("notify.delivery.popup").counter());
    assertNull(registry.find("notify.batch.pending").gauge());
    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void invalidArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "notify."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
