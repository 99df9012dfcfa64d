package notify.delivery;

import notify.Deliverable;
import notify.Priority;
import notify.RawEvent;
import notify.batch.BatchFormatter;
import notify.batch.BatchKey;
import notify.spi.PreferencesStore;
import notify.testing.CountingMetrics;
import notify.testing.InMemoryPreferencesStore;
import notify.testing.ManualScheduler;
import notify.testing.RecordingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryPolicyDispatcherTest {
  private static final Instant LATE_EVENING = Instant.parse("2024-01-15T23:00:00Z");
  private static final Instant NOON = Instant.parse("2024-01-15T12:00:00Z");

  private final BatchFormatter formatter = new BatchFormatter();
  private RecordingSink sink;
  private InMemoryPreferencesStore preferences;
  private CountingMetrics metrics;
  private ManualScheduler scheduler;
  private DeliveryPolicyDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    sink = new RecordingSink();
    preferences = new InMemoryPreferencesStore();
    metrics = new CountingMetrics();
    at(NOON);
  }

  @AfterEach
  void tearDown() {
    dispatcher.close();
  }

  private void at(Instant now) {
    if (dispatcher != null) {
      dispatcher.close();
    }
    scheduler = new ManualScheduler(now);
    dispatcher = DeliveryPolicyDispatcher.builder()
        .preferencesStore(preferences)
        .sink(sink)
        .metrics(metrics)
        .clock(scheduler.clock(ZoneOffset.UTC))
        .executor(Runnable::run)
        .scheduler(scheduler)
        .build();
  }

  private Deliverable single(String category, Priority priority) {
    return formatter.single(RawEvent.builder("u1", category)
        .title("New " + category).body("body").priority(priority).build());
  }

  private DeliveryOutcome send(Deliverable deliverable) {
    return dispatcher.dispatch(deliverable).join();
  }

  private static NotificationPreferences quietNights() {
    return new NotificationPreferences(EnumSet.allOf(DeliveryChannel.class), Set.of(),
        QuietHours.of("22:00", "08:00"), null);
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRequiresStoreAndSink() {
    assertThrows(NullPointerException.class, () ->
        DeliveryPolicyDispatcher.builder().sink(sink).build());
    assertThrows(NullPointerException.class, () ->
        DeliveryPolicyDispatcher.builder().preferencesStore(preferences).build());
  }

  @Test
  void builderRejectsNonPositiveAutoClose() {
    assertThrows(IllegalArgumentException.class, () -> DeliveryPolicyDispatcher.builder()
        .preferencesStore(preferences).sink(sink).autoCloseMs(0).build());
  }

  // ── Default delivery ────────────────────────────────────────────

  @Test
  void withoutStoredPreferencesEverythingIsDelivered() {
    Deliverable d = single("message", Priority.NORMAL);

    DeliveryOutcome outcome = send(d);

    assertTrue(outcome.published());
    assertTrue(outcome.popupShown());
    assertTrue(outcome.soundPlayed());
    assertTrue(outcome.usedDefaultPreferences());
    assertFalse(outcome.isSuppressed());
    assertEquals(List.of(d), sink.published);
    assertEquals(List.of("/sounds/message.mp3"), sink.sounds);

    SystemNotification popup = sink.shown.get(0);
    assertEquals(d.tag(), popup.tag());
    assertEquals("New message", popup.title());
    assertFalse(popup.requireInteraction());
    assertEquals(Duration.ofSeconds(5), popup.autoClose());
  }

  @Test
  void unknownCategoryUsesFallbackSound() {
    send(single("ad_inquiry", Priority.NORMAL));

    assertEquals(List.of(SoundCatalog.DEFAULT_SOUND), sink.sounds);
  }

  @Test
  void lowPriorityHasPopupButNoSound() {
    DeliveryOutcome outcome = send(single("message", Priority.LOW));

    assertTrue(outcome.popupShown());
    assertFalse(outcome.soundPlayed());
    assertTrue(sink.sounds.isEmpty());
  }

  @Test
  void highPriorityPopupRequiresInteraction() {
    send(single("alert", Priority.HIGH));

    SystemNotification popup = sink.shown.get(0);
    assertTrue(popup.requireInteraction());
    assertNull(popup.autoClose());
    assertEquals(0, dispatcher.pendingDismissals());
    assertEquals(List.of("/sounds/alert.mp3"), sink.sounds);
  }

  @Test
  void batchIsDeliveredUnderBatchTag() {
    RawEvent a = RawEvent.builder("u1", "message").build();
    RawEvent b = RawEvent.builder("u1", "message").build();
    Deliverable batch = formatter.format(new BatchKey("u1", "message"), List.of(a, b));

    send(batch);

    assertEquals("batch-message", sink.shown.get(0).tag());
    assertEquals("You have 2 new notifications of type messages", sink.shown.get(0).body());
  }

  // ── Channel switches ────────────────────────────────────────────

  @Test
  void systemChannelDisabledSkipsPopupOnly() {
    preferences.put("u1", new NotificationPreferences(
        EnumSet.of(DeliveryChannel.SOUND), Set.of(), QuietHours.DISABLED, null));

    DeliveryOutcome outcome = send(single("message", Priority.NORMAL));

    assertTrue(outcome.published());
    assertFalse(outcome.popupShown());
    assertTrue(outcome.soundPlayed());
    assertFalse(outcome.usedDefaultPreferences());
  }

  @Test
  void soundChannelDisabledSkipsSoundOnly() {
    preferences.put("u1", new NotificationPreferences(
        EnumSet.of(DeliveryChannel.SYSTEM), Set.of(), QuietHours.DISABLED, null));

    DeliveryOutcome outcome = send(single("message", Priority.HIGH));

    assertTrue(outcome.popupShown());
    assertFalse(outcome.soundPlayed());
  }

  // ── Muting and quiet hours ──────────────────────────────────────

  @Test
  void mutedCategoryIsPublishedButSilent() {
    preferences.put("u1", new NotificationPreferences(
        EnumSet.allOf(DeliveryChannel.class), Set.of("promotion"), QuietHours.DISABLED, null));

    DeliveryOutcome outcome = send(single("promotion", Priority.HIGH));

    assertEquals(DeliveryOutcome.Suppression.MUTED, outcome.suppression());
    assertTrue(outcome.published());
    assertEquals(1, sink.published.size());
    assertTrue(sink.shown.isEmpty());
    assertTrue(sink.sounds.isEmpty());
    assertEquals(1, metrics.suppressed.get());
  }

  @Test
  void quietHoursSuppressNormalPriorityAcrossMidnight() {
    at(LATE_EVENING);
    preferences.put("u1", quietNights());

    DeliveryOutcome outcome = send(single("message", Priority.NORMAL));

    assertEquals(DeliveryOutcome.Suppression.QUIET_HOURS, outcome.suppression());
    assertEquals(1, sink.published.size());
    assertTrue(sink.shown.isEmpty());
    assertTrue(sink.sounds.isEmpty());
  }

  @Test
  void highPriorityOverridesQuietHours() {
    at(LATE_EVENING);
    preferences.put("u1", quietNights());

    DeliveryOutcome outcome = send(single("alert", Priority.HIGH));

    assertFalse(outcome.isSuppressed());
    assertEquals(1, sink.shown.size());
    assertEquals(1, sink.sounds.size());
  }

  @Test
  void quietHoursDoNotApplyOutsideWindow() {
    preferences.put("u1", quietNights());

    DeliveryOutcome outcome = send(single("message", Priority.NORMAL));

    assertFalse(outcome.isSuppressed());
    assertEquals(1, sink.shown.size());
  }

  @Test
  void disabledQuietHoursNeverSuppress() {
    at(LATE_EVENING);
    preferences.put("u1", new NotificationPreferences(EnumSet.allOf(DeliveryChannel.class),
        Set.of(), QuietHours.of("22:00", "08:00").withEnabled(false), null));

    assertFalse(send(single("message", Priority.NORMAL)).isSuppressed());
  }

  @Test
  void quietHoursUseRecipientZone() {
    // 14:00 UTC is 23:00 in Tokyo
    at(Instant.parse("2024-01-15T14:00:00Z"));
    preferences.put("u1", new NotificationPreferences(EnumSet.allOf(DeliveryChannel.class),
        Set.of(), QuietHours.of("22:00", "08:00"), ZoneId.of("Asia/Tokyo")));

    assertEquals(DeliveryOutcome.Suppression.QUIET_HOURS,
        send(single("message", Priority.NORMAL)).suppression());
  }

  // ── Failure isolation ───────────────────────────────────────────

  @Test
  void preferencesFailureFallsBackToDefaults() {
    at(LATE_EVENING);
    preferences.put("u1", quietNights());
    preferences.failing = true;

    DeliveryOutcome outcome = send(single("message", Priority.NORMAL));

    assertTrue(outcome.usedDefaultPreferences());
    assertTrue(outcome.popupShown());
    assertTrue(outcome.soundPlayed());
    assertEquals(1, metrics.preferencesFallbacks.get());
  }

  @Test
  void preferencesAreReadOncePerDispatch() {
    send(single("message", Priority.NORMAL));
    send(single("message", Priority.NORMAL));

    assertEquals(2, preferences.reads.get());
  }

  @Test
  void publishFailureDoesNotBlockPopupOrSound() {
    sink.failPublish = true;

    DeliveryOutcome outcome = send(single("message", Priority.NORMAL));

    assertFalse(outcome.published());
    assertTrue(outcome.popupShown());
    assertTrue(outcome.soundPlayed());
    assertEquals(1, metrics.sinkFailures.get());
  }

  @Test
  void popupFailureDoesNotBlockSound() {
    sink.failShow = true;

    DeliveryOutcome outcome = send(single("message", Priority.NORMAL));

    assertFalse(outcome.popupShown());
    assertTrue(outcome.soundPlayed());
    assertEquals(0, dispatcher.pendingDismissals());
  }

  @Test
  void soundFailureIsContained() {
    sink.failSound = true;

    DeliveryOutcome outcome = assertDoesNotThrow(() -> send(single("message", Priority.NORMAL)));

    assertTrue(outcome.popupShown());
    assertFalse(outcome.soundPlayed());
    assertEquals(1, metrics.sinkFailures.get());
    assertEquals(0, metrics.sounds.get());
  }

  // ── Popup auto-close ────────────────────────────────────────────

  @Test
  void popupIsDismissedAfterAutoClose() {
    Deliverable d = single("message", Priority.NORMAL);
    send(d);

    scheduler.advance(4999);
    assertTrue(sink.dismissed.isEmpty());

    scheduler.advance(1);
    assertEquals(List.of(d.tag()), sink.dismissed);
    assertEquals(0, dispatcher.pendingDismissals());
  }

  @Test
  void popupWithSameTagRestartsAutoClose() {
    RawEvent a = RawEvent.builder("u1", "message").build();
    RawEvent b = RawEvent.builder("u1", "message").build();
    send(formatter.format(new BatchKey("u1", "message"), List.of(a, b)));
    scheduler.advance(3000);
    send(formatter.format(new BatchKey("u1", "message"), List.of(a, b)));

    scheduler.advance(2000);
    assertTrue(sink.dismissed.isEmpty());
    assertEquals(1, dispatcher.pendingDismissals());

    scheduler.advance(3000);
    assertEquals(List.of("batch-message"), sink.dismissed);
  }

  @Test
  void highPriorityPopupCancelsPendingDismissalForTag() {
    RawEvent normal = RawEvent.builder("u1", "alert").build();
    RawEvent urgent = RawEvent.builder("u1", "alert").priority(Priority.HIGH).build();
    send(formatter.format(new BatchKey("u1", "alert"), List.of(normal, normal)));
    assertEquals(1, dispatcher.pendingDismissals());

    send(formatter.format(new BatchKey("u1", "alert"), List.of(normal, urgent)));

    assertEquals(0, dispatcher.pendingDismissals());
    scheduler.advance(10_000);
    assertTrue(sink.dismissed.isEmpty());
  }

  @Test
  void customAutoCloseDelay() {
    dispatcher.close();
    dispatcher = DeliveryPolicyDispatcher.builder()
        .preferencesStore(preferences)
        .sink(sink)
        .clock(scheduler.clock())
        .executor(Runnable::run)
        .scheduler(scheduler)
        .autoCloseMs(1500)
        .build();

    send(single("message", Priority.NORMAL));

    assertEquals(Duration.ofMillis(1500), sink.shown.get(0).autoClose());
    scheduler.advance(1500);
    assertEquals(1, sink.dismissed.size());
  }

  // ── Lifecycle ───────────────────────────────────────────────────

  @Test
  void dispatchAfterCloseFails() {
    dispatcher.close();

    CompletionException e = assertThrows(CompletionException.class,
        () -> dispatcher.dispatch(single("message", Priority.NORMAL)).join());
    assertInstanceOf(IllegalStateException.class, e.getCause());
  }

  @Test
  void closeCancelsPendingDismissals() {
    send(single("message", Priority.NORMAL));

    dispatcher.close();
    dispatcher.close();
    scheduler.advance(10_000);

    assertTrue(sink.dismissed.isEmpty());
    assertEquals(0, scheduler.queued());
  }

  @Test
  void ownedWorkersDeliverAsynchronously() throws Exception {
    try (DeliveryPolicyDispatcher async = DeliveryPolicyDispatcher.builder()
        .preferencesStore(preferences)
        .sink(sink)
        .build()) {
      DeliveryOutcome outcome = async.dispatch(single("message", Priority.NORMAL))
          .get(5, TimeUnit.SECONDS);

      assertTrue(outcome.published());
    }
  }

  @Test
  void closeWhileLoadingPreferencesTouchesNoSink() throws Exception {
    BlockingPreferences blocking = new BlockingPreferences();
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      DeliveryPolicyDispatcher closing = DeliveryPolicyDispatcher.builder()
          .preferencesStore(blocking)
          .sink(sink)
          .executor(pool)
          .scheduler(scheduler)
          .build();
      CompletableFuture<DeliveryOutcome> pending = closing.dispatch(single("message", Priority.HIGH));
      assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));

      closing.close();
      blocking.release.countDown();
      DeliveryOutcome outcome = pending.get(5, TimeUnit.SECONDS);

      assertEquals(DeliveryOutcome.Suppression.CLOSED, outcome.suppression());
      assertFalse(outcome.published());
      assertTrue(sink.published.isEmpty());
      assertTrue(sink.shown.isEmpty());
      assertTrue(sink.sounds.isEmpty());
      assertEquals(0, closing.pendingDismissals());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void closeCompletesQueuedDeliveriesOnOwnedWorkers() throws Exception {
    BlockingPreferences blocking = new BlockingPreferences();
    DeliveryPolicyDispatcher closing = DeliveryPolicyDispatcher.builder()
        .preferencesStore(blocking)
        .sink(sink)
        .workerCount(1)
        .scheduler(scheduler)
        .build();
    CompletableFuture<DeliveryOutcome> inFlight = closing.dispatch(single("message", Priority.NORMAL));
    assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));
    CompletableFuture<DeliveryOutcome> queued = closing.dispatch(single("system", Priority.NORMAL));

    closing.close();

    assertEquals(DeliveryOutcome.Suppression.CLOSED, queued.get(5, TimeUnit.SECONDS).suppression());
    assertEquals(DeliveryOutcome.Suppression.CLOSED, inFlight.get(5, TimeUnit.SECONDS).suppression());
    assertTrue(sink.published.isEmpty());
  }

  // ── Ordering ────────────────────────────────────────────────────

  @Test
  void sameRecipientAndCategoryReachSinkInDispatchOrder() throws Exception {
    BlockingPreferences blocking = new BlockingPreferences();
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try (DeliveryPolicyDispatcher ordered = DeliveryPolicyDispatcher.builder()
        .preferencesStore(blocking)
        .sink(sink)
        .executor(pool)
        .scheduler(scheduler)
        .build()) {
      Deliverable first = batchOf(2);
      Deliverable second = batchOf(3);

      CompletableFuture<DeliveryOutcome> firstDone = ordered.dispatch(first);
      assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));
      CompletableFuture<DeliveryOutcome> secondDone = ordered.dispatch(second);
      DeliveryOutcome otherCategory = ordered.dispatch(single("system", Priority.NORMAL))
          .get(5, TimeUnit.SECONDS);

      assertTrue(otherCategory.published());
      assertFalse(secondDone.isDone());

      blocking.release.countDown();
      firstDone.get(5, TimeUnit.SECONDS);
      secondDone.get(5, TimeUnit.SECONDS);

      List<Integer> messageCounts = sink.published.stream()
          .filter(d -> d.category().equals("message"))
          .map(Deliverable::count)
          .collect(Collectors.toList());
      assertEquals(List.of(2, 3), messageCounts);
    } finally {
      pool.shutdownNow();
    }
  }

  private Deliverable batchOf(int size) {
    List<RawEvent> events = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      events.add(RawEvent.builder("u1", "message").title("m" + i).body("body").build());
    }
    return formatter.format(new BatchKey("u1", "message"), events);
  }

  /** Blocks the first read until released; later reads return no stored preferences. */
  private static final class BlockingPreferences implements PreferencesStore {
    final CountDownLatch entered = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    private final AtomicBoolean blockNext = new AtomicBoolean(true);

    @Override
    public NotificationPreferences get(String userId) {
      if (blockNext.compareAndSet(true, false)) {
        entered.countDown();
        try {
          release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("interrupted while loading preferences", e);
        }
      }
      return null;
    }

    @Override
    public NotificationPreferences update(String userId, PreferencesUpdate update) {
      throw new UnsupportedOperationException();
    }
  }
}
