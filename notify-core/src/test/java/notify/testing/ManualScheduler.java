package notify.testing;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Delayed;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Deterministic {@link ScheduledExecutorService} driven by virtual time. Nothing runs
 * until {@link #advance(long)} or {@link #runPending()} is called, and then tasks run on
 * the calling thread in due-time order.
 */
public final class ManualScheduler extends AbstractExecutorService implements ScheduledExecutorService {
  private final Instant epoch;
  private final PriorityQueue<Task> tasks = new PriorityQueue<>(
      Comparator.comparingLong((Task t) -> t.dueMs).thenComparingLong(t -> t.seq));
  private long nowMs;
  private long seq;
  private boolean shutdown;

  public ManualScheduler() {
    this(Instant.parse("2024-01-15T12:00:00Z"));
  }

  public ManualScheduler(Instant epoch) {
    this.epoch = epoch;
  }

  /** Moves virtual time forward, running every task that falls due on the way. */
  public void advance(long millis) {
    long target;
    synchronized (this) {
      target = nowMs + millis;
    }
    runUntil(target);
  }

  /** Runs tasks that are already due without moving time. */
  public void runPending() {
    long target;
    synchronized (this) {
      target = nowMs;
    }
    runUntil(target);
  }

  private void runUntil(long target) {
    while (true) {
      Task next;
      synchronized (this) {
        next = tasks.peek();
        if (next == null || next.dueMs > target) {
          nowMs = Math.max(nowMs, target);
          return;
        }
        tasks.poll();
        nowMs = Math.max(nowMs, next.dueMs);
      }
      next.runTask();
    }
  }

  public synchronized long nowMs() {
    return nowMs;
  }

  /** Number of scheduled, not yet cancelled tasks. */
  public synchronized int queued() {
    return tasks.size();
  }

  /** Delay until the next task is due, or {@code -1} if nothing is scheduled. */
  public synchronized long nextDelayMs() {
    Task next = tasks.peek();
    return next == null ? -1 : next.dueMs - nowMs;
  }

  /** A clock that reads this scheduler's virtual time. */
  public Clock clock(ZoneId zone) {
    ManualScheduler scheduler = this;
    return new Clock() {
      @Override
      public ZoneId getZone() {
        return zone;
      }

      @Override
      public Clock withZone(ZoneId other) {
        return scheduler.clock(other);
      }

      @Override
      public Instant instant() {
        return epoch.plusMillis(scheduler.nowMs());
      }
    };
  }

  public Clock clock() {
    return clock(ZoneOffset.UTC);
  }

  private synchronized Task enqueue(Runnable command, long delayMs, long periodMs) {
    if (shutdown) {
      throw new RejectedExecutionException("ManualScheduler is shut down");
    }
    Task task = new Task(command, nowMs + Math.max(0, delayMs), periodMs, seq++);
    tasks.add(task);
    return task;
  }

  private synchronized void requeue(Task task) {
    if (shutdown) {
      return;
    }
    task.dueMs = nowMs + task.periodMs;
    task.seq = seq++;
    tasks.add(task);
  }

  private synchronized boolean remove(Task task) {
    return tasks.remove(task);
  }

  @Override
  public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
    return enqueue(command, unit.toMillis(delay), 0);
  }

  @Override
  public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
    throw new UnsupportedOperationException("Callable tasks are not supported");
  }

  @Override
  public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
    return enqueue(command, unit.toMillis(initialDelay), unit.toMillis(period));
  }

  @Override
  public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay, TimeUnit unit) {
    return enqueue(command, unit.toMillis(initialDelay), unit.toMillis(delay));
  }

  @Override
  public void execute(Runnable command) {
    enqueue(command, 0, 0);
  }

  @Override
  public synchronized void shutdown() {
    shutdown = true;
  }

  @Override
  public synchronized List<Runnable> shutdownNow() {
    shutdown = true;
    List<Runnable> pending = new ArrayList<>(tasks);
    tasks.clear();
    return pending;
  }

  @Override
  public synchronized boolean isShutdown() {
    return shutdown;
  }

  @Override
  public synchronized boolean isTerminated() {
    return shutdown;
  }

  @Override
  public boolean awaitTermination(long timeout, TimeUnit unit) {
    return true;
  }

  private final class Task implements ScheduledFuture<Object>, Runnable {
    private final Runnable command;
    private final long periodMs;
    private long dueMs;
    private long seq;
    private volatile boolean cancelled;
    private volatile boolean done;

    Task(Runnable command, long dueMs, long periodMs, long seq) {
      this.command = command;
      this.dueMs = dueMs;
      this.periodMs = periodMs;
      this.seq = seq;
    }

    void runTask() {
      if (cancelled) {
        return;
      }
      command.run();
      if (periodMs > 0 && !cancelled) {
        requeue(this);
      } else {
        done = true;
      }
    }

    @Override
    public void run() {
      runTask();
    }

    @Override
    public long getDelay(TimeUnit unit) {
      return unit.convert(dueMs - nowMs(), TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed other) {
      return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
      if (done || cancelled) {
        return false;
      }
      cancelled = true;
      remove(this);
      return true;
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }

    @Override
    public boolean isDone() {
      return done || cancelled;
    }

    @Override
    public Object get() {
      if (cancelled) {
        throw new CancellationException();
      }
      return null;
    }

    @Override
    public Object get(long timeout, TimeUnit unit) {
      return get();
    }
  }
}
