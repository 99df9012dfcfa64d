package notify.batch;

import notify.Deliverable;
import notify.RawEvent;
import notify.spi.MetricsExporter;
import notify.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Coalesces bursts of notifications into one deliverable per {@link BatchKey}.
 *
 * <p>The first event enqueued into an empty queue arms a single flush timer of
 * {@code batchDelayMs}; later events join the pending batch without re-arming it. When
 * the timer fires, every key is emitted exactly once: keys holding one event produce a
 * single deliverable, keys holding more produce a batch. Events enqueued while a flush is
 * emitting land in a fresh batch with its own timer.
 *
 * <p>{@linkplain RawEvent#isUrgent() Urgent} events are also delivered immediately on
 * the calling thread. They still join the pending batch so the flush reports them
 * alongside their siblings.
 *
 * <p>This class is thread-safe. Handler calls are serialized with {@link #close()}: once
 * close returns, the handler is not running and is never called again.
 *
 * @see BatchQueue.Builder
 * @see BatchFormatter
 */
public final class BatchQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BatchQueue.class.getName());

  private final DeliverableHandler handler;
  private final BatchFormatter formatter;
  private final long batchDelayMs;
  private final boolean flushOnClose;
  private final MetricsExporter metrics;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;

  private final Object lock = new Object();
  // held around every handler call; taken before lock, never while holding it
  private final Object handoffLock = new Object();
  private Map<BatchKey, List<RawEvent>> pending = new LinkedHashMap<>();
  private int pendingCount;
  private ScheduledFuture<?> flushTask;
  private volatile boolean closed;

  private BatchQueue(Builder builder) {
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.formatter = builder.formatter != null ? builder.formatter : new BatchFormatter();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.batchDelayMs <= 0) {
      throw new IllegalArgumentException("batchDelayMs must be > 0");
    }
    this.batchDelayMs = builder.batchDelayMs;
    this.flushOnClose = builder.flushOnClose;
    if (builder.scheduler != null) {
      this.scheduler = builder.scheduler;
      this.ownsScheduler = false;
    } else {
      this.scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("notify-batch-"));
      this.ownsScheduler = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Adds an event to its batch, arming the flush timer if none is pending. Urgent events
   * are additionally delivered right away.
   *
   * @param event the event
   * @return {@code false} if the queue has been closed and the event was dropped
   */
  public boolean enqueue(RawEvent event) {
    Objects.requireNonNull(event, "event");
    synchronized (lock) {
      if (closed) {
        return false;
      }
      pending.computeIfAbsent(BatchKey.of(event), key -> new ArrayList<>()).add(event);
      pendingCount++;
      if (flushTask == null) {
        flushTask = scheduler.schedule(this::flush, batchDelayMs, TimeUnit.MILLISECONDS);
      }
      metrics.recordPendingEvents(pendingCount);
    }
    metrics.incrementEventsEnqueued();
    if (event.isUrgent()) {
      Deliverable single = formatter.single(event);
      if (handOff(single, false)) {
        metrics.incrementFastPathDeliveries();
      }
    }
    return true;
  }

  /**
   * Emits every pending batch now and cancels the pending timer. Called by the timer; may
   * also be called directly. A no-op once the queue is closed.
   *
   * @return number of deliverables emitted
   */
  public int flush() {
    if (closed) {
      return 0;
    }
    return drain(false);
  }

  /**
   * @return number of events waiting for the next flush
   */
  public int pendingCount() {
    synchronized (lock) {
      return pendingCount;
    }
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Stops accepting events and cancels the pending timer. Pending events are emitted if
   * the queue was built with {@link Builder#flushOnClose(boolean) flushOnClose}, otherwise
   * discarded. Idempotent.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
    }
    synchronized (handoffLock) {
      if (flushOnClose) {
        drain(true);
      } else {
        int dropped;
        synchronized (lock) {
          cancelFlushTask();
          dropped = pendingCount;
          pending = new LinkedHashMap<>();
          pendingCount = 0;
        }
        if (dropped > 0) {
          logger.info("Discarded " + dropped + " pending notification(s) on close");
        }
        metrics.recordPendingEvents(0);
      }
    }
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
  }

  private int drain(boolean closing) {
    Map<BatchKey, List<RawEvent>> batches;
    synchronized (lock) {
      cancelFlushTask();
      if (pending.isEmpty()) {
        return 0;
      }
      batches = pending;
      pending = new LinkedHashMap<>();
      pendingCount = 0;
    }
    metrics.recordPendingEvents(0);
    int emitted = 0;
    for (Map.Entry<BatchKey, List<RawEvent>> entry : batches.entrySet()) {
      List<RawEvent> events = entry.getValue();
      if (!handOff(formatter.format(entry.getKey(), events), closing)) {
        break;
      }
      metrics.incrementDeliverablesFlushed(events.size() > 1);
      emitted++;
    }
    return emitted;
  }

  private boolean handOff(Deliverable deliverable, boolean closing) {
    synchronized (handoffLock) {
      if (closed && !closing) {
        return false;
      }
      deliver(deliverable);
      return true;
    }
  }

  private void cancelFlushTask() {
    if (flushTask != null) {
      flushTask.cancel(false);
      flushTask = null;
    }
  }

  private void deliver(Deliverable deliverable) {
    try {
      handler.handle(deliverable);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Deliverable handler failed for " + deliverable.tag(), e);
    }
  }

  /**
   * Builder for {@link BatchQueue}.
   */
  public static final class Builder {
    private DeliverableHandler handler;
    private BatchFormatter formatter;
    private long batchDelayMs = 1000;
    private boolean flushOnClose;
    private MetricsExporter metrics;
    private ScheduledExecutorService scheduler;

    private Builder() {
    }

    /**
     * Sets the consumer of emitted deliverables.
     *
     * <p><b>Required.</b>
     *
     * @param handler the downstream handler
     * @return this builder
     */
    public Builder handler(DeliverableHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Optional. Defaults to a {@link BatchFormatter} with the built-in category labels.
     */
    public Builder formatter(BatchFormatter formatter) {
      this.formatter = formatter;
      return this;
    }

    /**
     * Sets the coalescing window measured from the first event of a batch.
     *
     * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
     *
     * @param batchDelayMs window in milliseconds
     * @return this builder
     */
    public Builder batchDelayMs(long batchDelayMs) {
      this.batchDelayMs = batchDelayMs;
      return this;
    }

    /**
     * Sets whether {@link BatchQueue#close()} emits pending batches instead of discarding
     * them.
     *
     * <p>Optional. Defaults to {@code false}.
     *
     * @param flushOnClose whether to flush on close
     * @return this builder
     */
    public Builder flushOnClose(boolean flushOnClose) {
      this.flushOnClose = flushOnClose;
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
     * Sets the scheduler that runs the flush timer.
     *
     * <p>Optional. Defaults to a private single-thread daemon scheduler shut down on
     * {@link BatchQueue#close()}. A supplied scheduler is not shut down.
     *
     * @param scheduler the scheduler
     * @return this builder
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public BatchQueue build() {
      return new BatchQueue(this);
    }
  }
}
