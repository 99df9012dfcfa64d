package notify.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon threads behind session timers and delivery workers, named
 * {@code <prefix>1}, {@code <prefix>2}, and so on.
 *
 * <p>A session abandoned without {@code close()} must not keep the JVM alive. A task that
 * dies with an uncaught exception is logged at {@code SEVERE} under the thread's name.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT = (thread, error) ->
      logger.log(Level.SEVERE, "Uncaught failure on " + thread.getName(), error);

  private final String prefix;
  private final AtomicInteger nextId = new AtomicInteger(1);

  /**
   * @param prefix thread name prefix, e.g. {@code "notify-batch-"}
   */
  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread thread = new Thread(task, prefix + nextId.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(LOG_UNCAUGHT);
    return thread;
  }
}
