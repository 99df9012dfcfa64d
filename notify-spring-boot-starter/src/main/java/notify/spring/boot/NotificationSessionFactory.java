package notify.spring.boot;

import notify.NotificationSession;
import notify.NotifyConfig;
import notify.batch.BatchFormatter;
import notify.delivery.SoundCatalog;
import notify.spi.ChangeStreamTransport;
import notify.spi.MetricsExporter;
import notify.spi.NotificationSink;
import notify.spi.NotificationStore;
import notify.spi.PreferencesStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Opens {@link NotificationSession}s from the application's beans and closes whatever is
 * still open when the context shuts down.
 *
 * <p>Every session shares the same metrics exporter. Sessions never close it; its owner
 * is the application context.
 */
public class NotificationSessionFactory implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(NotificationSessionFactory.class.getName());

  private final ChangeStreamTransport transport;
  private final NotificationSink sink;
  private final PreferencesStore preferencesStore;
  private final NotificationStore notificationStore;
  private final MetricsExporter metrics;
  private final SoundCatalog soundCatalog;
  private final BatchFormatter formatter;
  private final NotifyProperties properties;

  private final List<NotificationSession> sessions = new ArrayList<>();
  private boolean closed;

  public NotificationSessionFactory(ChangeStreamTransport transport, NotificationSink sink,
      PreferencesStore preferencesStore, NotificationStore notificationStore,
      MetricsExporter metrics, SoundCatalog soundCatalog, BatchFormatter formatter,
      NotifyProperties properties) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.preferencesStore = preferencesStore;
    this.notificationStore = notificationStore;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.soundCatalog = Objects.requireNonNull(soundCatalog, "soundCatalog");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  /**
   * Opens a session that is not yet subscribed to anything.
   *
   * @return the new session
   * @throws IllegalStateException if no {@link PreferencesStore} is available or the
   *     factory has been closed
   */
  public NotificationSession open() {
    if (preferencesStore == null) {
      throw new IllegalStateException(
          "No PreferencesStore bean; configure a DataSource or declare one");
    }
    NotifyConfig config = properties.toConfig();
    synchronized (sessions) {
      if (closed) {
        throw new IllegalStateException("NotificationSessionFactory is closed");
      }
      sessions.removeIf(NotificationSession::isClosed);
      NotificationSession session = NotificationSession.builder()
          .transport(transport)
          .sink(sink)
          .preferencesStore(preferencesStore)
          .notificationStore(notificationStore)
          .sharedMetrics(metrics)
          .soundCatalog(soundCatalog)
          .formatter(formatter)
          .config(config)
          .build();
      sessions.add(session);
      return session;
    }
  }

  /**
   * Opens a session already subscribed to the user's notification channel.
   *
   * @param userId the signed-in user
   * @return the new session
   */
  public NotificationSession openFor(String userId) {
    Objects.requireNonNull(userId, "userId");
    NotificationSession session = open();
    try {
      session.subscribeToNotifications(userId);
    } catch (RuntimeException e) {
      session.close();
      throw e;
    }
    return session;
  }

  /**
   * @return number of sessions opened by this factory that are still open
   */
  public int openSessions() {
    synchronized (sessions) {
      sessions.removeIf(NotificationSession::isClosed);
      return sessions.size();
    }
  }

  @Override
  public void close() {
    List<NotificationSession> toClose;
    synchronized (sessions) {
      if (closed) {
        return;
      }
      closed = true;
      toClose = new ArrayList<>(sessions);
      sessions.clear();
    }
    RuntimeException failure = null;
    for (NotificationSession session : toClose) {
      try {
        session.close();
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (!toClose.isEmpty()) {
      logger.info("Closed " + toClose.size() + " notification session(s)");
    }
    if (failure != null) {
      throw failure;
    }
  }
}
