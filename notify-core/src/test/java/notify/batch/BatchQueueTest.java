package notify.batch;

import notify.Deliverable;
import notify.Priority;
import notify.RawEvent;
import notify.testing.CountingMetrics;
import notify.testing.ManualScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BatchQueueTest {

  private ManualScheduler scheduler;
  private List<Deliverable> delivered;
  private CountingMetrics metrics;

  @BeforeEach
  void setUp() {
    scheduler = new ManualScheduler();
    delivered = new CopyOnWriteArrayList<>();
    metrics = new CountingMetrics();
  }

  private BatchQueue newQueue() {
    return newQueue(BatchQueue.builder());
  }

  private BatchQueue newQueue(BatchQueue.Builder builder) {
    return builder
        .handler(delivered::add)
        .scheduler(scheduler)
        .metrics(metrics)
        .build();
  }

  private static RawEvent event(String recipient, String category) {
    return RawEvent.builder(recipient, category).title("t").body("b").build();
  }

  private static RawEvent high(String recipient, String category) {
    return RawEvent.builder(recipient, category).title("t").body("b").priority(Priority.HIGH).build();
  }

  @Test
  void builderRejectsMissingHandler() {
    assertThrows(NullPointerException.class, () -> BatchQueue.builder().build());
  }

  @Test
  void builderRejectsNonPositiveDelay() {
    assertThrows(IllegalArgumentException.class, () ->
        BatchQueue.builder().handler(d -> { }).batchDelayMs(0).build());
  }

  @Test
  void burstOfFiveBecomesOneBatchAfterWindow() {
    BatchQueue queue = newQueue();
    for (int i = 0; i < 5; i++) {
      queue.enqueue(event("u1", "message"));
    }

    assertEquals(1000, scheduler.nextDelayMs());
    scheduler.advance(999);
    assertTrue(delivered.isEmpty());
    assertEquals(5, queue.pendingCount());

    scheduler.advance(1);

    assertEquals(1, delivered.size());
    Deliverable batch = delivered.get(0);
    assertEquals(Deliverable.Kind.BATCH, batch.kind());
    assertEquals(5, batch.count());
    assertEquals("batch-message", batch.tag());
    assertEquals("5 new notifications", batch.title());
    assertEquals(0, queue.pendingCount());
    assertEquals(1, metrics.batchesFlushed.get());
  }

  @Test
  void loneEventIsDeliveredAsSingle() {
    BatchQueue queue = newQueue();
    RawEvent event = event("u1", "message");
    queue.enqueue(event);

    scheduler.advance(1000);

    assertEquals(1, delivered.size());
    assertEquals(Deliverable.Kind.SINGLE, delivered.get(0).kind());
    assertEquals("notification-" + event.eventId(), delivered.get(0).tag());
    assertEquals(1, metrics.singlesFlushed.get());
  }

  @Test
  void timerIsSharedAndNotRestartedByLaterEvents() {
    BatchQueue queue = newQueue();
    queue.enqueue(event("u1", "message"));
    scheduler.advance(600);
    queue.enqueue(event("u1", "message"));

    assertEquals(1, scheduler.queued());
    scheduler.advance(400);

    assertEquals(1, delivered.size());
    assertEquals(2, delivered.get(0).count());
  }

  @Test
  void eventAfterFlushArmsFreshWindow() {
    BatchQueue queue = newQueue();
    queue.enqueue(event("u1", "message"));
    scheduler.advance(1000);

    queue.enqueue(event("u1", "message"));

    assertEquals(1000, scheduler.nextDelayMs());
    scheduler.advance(1000);
    assertEquals(2, delivered.size());
  }

  @Test
  void everyKeyIsEmittedOnceInArrivalOrder() {
    BatchQueue queue = newQueue();
    queue.enqueue(event("u1", "message"));
    queue.enqueue(event("u1", "system"));
    queue.enqueue(event("u2", "message"));
    queue.enqueue(event("u1", "message"));

    scheduler.advance(1000);

    assertEquals(3, delivered.size());
    assertEquals(new BatchKey("u1", "message"),
        new BatchKey(delivered.get(0).recipientId(), delivered.get(0).category()));
    assertEquals(2, delivered.get(0).count());
    assertEquals("system", delivered.get(1).category());
    assertEquals("u2", delivered.get(2).recipientId());
  }

  @Test
  void highPriorityIsDeliveredImmediatelyAndStillBatched() {
    BatchQueue queue = newQueue();
    queue.enqueue(event("u1", "alert"));
    RawEvent urgent = high("u1", "alert");

    queue.enqueue(urgent);

    assertEquals(1, delivered.size());
    assertEquals(Deliverable.Kind.SINGLE, delivered.get(0).kind());
    assertEquals("notification-" + urgent.eventId(), delivered.get(0).tag());
    assertEquals(1, metrics.fastPath.get());

    scheduler.advance(1000);

    assertEquals(2, delivered.size());
    Deliverable batch = delivered.get(1);
    assertEquals(2, batch.count());
    assertEquals(Priority.HIGH, batch.priority());
  }

  @Test
  void urgentCategoryTakesFastPath() {
    BatchQueue queue = newQueue();

    queue.enqueue(event("u1", RawEvent.URGENT_CATEGORY));

    assertEquals(1, delivered.size());
    assertEquals(1, queue.pendingCount());
  }

  @Test
  void flushWithNothingPendingReturnsZero() {
    BatchQueue queue = newQueue();

    assertEquals(0, queue.flush());
    assertEquals(0, scheduler.queued());
  }

  @Test
  void manualFlushCancelsTimer() {
    BatchQueue queue = newQueue();
    queue.enqueue(event("u1", "message"));
    queue.enqueue(event("u2", "message"));

    assertEquals(2, queue.flush());

    assertEquals(0, scheduler.queued());
    assertEquals(2, delivered.size());
  }

  @Test
  void failingHandlerDoesNotStopOtherKeys() {
    List<String> seen = new ArrayList<>();
    BatchQueue queue = BatchQueue.builder()
        .scheduler(scheduler)
        .handler(d -> {
          seen.add(d.recipientId());
          if (d.recipientId().equals("u1")) {
            throw new IllegalStateException("boom");
          }
        })
        .build();
    queue.enqueue(event("u1", "message"));
    queue.enqueue(event("u2", "message"));

    assertEquals(2, queue.flush());
    assertEquals(List.of("u1", "u2"), seen);
  }

  @Test
  void eventEnqueuedDuringFlushLandsInNextBatch() {
    List<Deliverable> seen = new CopyOnWriteArrayList<>();
    BatchQueue[] holder = new BatchQueue[1];
    holder[0] = BatchQueue.builder()
        .scheduler(scheduler)
        .handler(d -> {
          seen.add(d);
          if (seen.size() == 1) {
            holder[0].enqueue(event("u1", "message"));
          }
        })
        .build();
    holder[0].enqueue(event("u1", "message"));

    scheduler.advance(1000);
    assertEquals(1, seen.size());
    assertEquals(1, holder[0].pendingCount());

    scheduler.advance(1000);
    assertEquals(2, seen.size());
  }

  @Test
  void closeDiscardsPendingByDefault() {
    BatchQueue queue = newQueue();
    queue.enqueue(event("u1", "message"));
    queue.enqueue(event("u1", "message"));

    queue.close();
    scheduler.advance(5000);

    assertTrue(delivered.isEmpty());
    assertEquals(0, scheduler.queued());
    assertEquals(0, queue.pendingCount());
    assertTrue(queue.isClosed());
  }

  @Test
  void closeFlushesWhenConfigured() {
    BatchQueue queue = newQueue(BatchQueue.builder().flushOnClose(true));
    queue.enqueue(event("u1", "message"));
    queue.enqueue(event("u1", "message"));

    queue.close();

    assertEquals(1, delivered.size());
    assertEquals(2, delivered.get(0).count());
  }

  @Test
  void enqueueAfterCloseIsRejected() {
    BatchQueue queue = newQueue();
    queue.close();

    assertFalse(queue.enqueue(event("u1", "message")));
    assertFalse(queue.enqueue(high("u1", "message")));
    assertEquals(0, queue.flush());
    assertTrue(delivered.isEmpty());
  }

  @Test
  void closeWaitsForUrgentHandoffInProgress() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    BatchQueue queue = BatchQueue.builder()
        .handler(d -> {
          entered.countDown();
          try {
            release.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          delivered.add(d);
        })
        .scheduler(scheduler)
        .build();
    Thread producer = new Thread(() -> queue.enqueue(high("u1", "alert")), "producer");
    producer.start();
    assertTrue(entered.await(5, TimeUnit.SECONDS));

    Thread closer = new Thread(queue::close, "closer");
    closer.start();
    closer.join(200);
    assertTrue(closer.isAlive());

    release.countDown();
    closer.join(5000);
    producer.join(5000);
    assertFalse(closer.isAlive());
    assertEquals(1, delivered.size());
    assertFalse(queue.enqueue(high("u1", "alert")));
    assertEquals(1, delivered.size());
  }

  @Test
  void handlerIsNeverCalledAfterCloseReturns() throws Exception {
    for (int round = 0; round < 100; round++) {
      AtomicBoolean closeReturned = new AtomicBoolean();
      AtomicInteger lateCalls = new AtomicInteger();
      BatchQueue queue = BatchQueue.builder()
          .handler(d -> {
            if (closeReturned.get()) {
              lateCalls.incrementAndGet();
            }
          })
          .scheduler(scheduler)
          .build();
      CountDownLatch start = new CountDownLatch(1);
      Thread producer = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int i = 0; i < 50; i++) {
          queue.enqueue(high("u1", "alert"));
        }
      }, "producer");
      producer.start();
      start.countDown();
      queue.close();
      closeReturned.set(true);
      producer.join(5000);

      assertEquals(0, lateCalls.get(), "round " + round);
    }
  }

  @Test
  void closeIsIdempotent() {
    BatchQueue queue = newQueue(BatchQueue.builder().flushOnClose(true));
    queue.enqueue(event("u1", "message"));

    queue.close();
    queue.close();

    assertEquals(1, delivered.size());
  }

  @Test
  void ownedSchedulerFlushesOnRealTime() throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    try (BatchQueue queue = BatchQueue.builder().batchDelayMs(50).handler(d -> latch.countDown()).build()) {
      queue.enqueue(event("u1", "message"));

      assertTrue(latch.await(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void concurrentEnqueuesAreAllBatched() throws Exception {
    BatchQueue queue = newQueue();
    int threads = 4;
    int perThread = 250;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      for (int t = 0; t < threads; t++) {
        pool.execute(() -> {
          try {
            start.await();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
          }
          for (int i = 0; i < perThread; i++) {
            queue.enqueue(event("u1", "message"));
          }
        });
      }
      start.countDown();
      pool.shutdown();
      assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, scheduler.queued());
    scheduler.advance(1000);

    assertEquals(1, delivered.size());
    assertEquals(threads * perThread, delivered.get(0).count());
    assertEquals(threads * perThread, metrics.eventsEnqueued.get());
  }
}
