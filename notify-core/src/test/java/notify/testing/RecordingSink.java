package notify.testing;

import notify.Deliverable;
import notify.delivery.SystemNotification;
import notify.spi.DeliverySinkException;
import notify.spi.NotificationSink;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sink that records every call. Individual side effects can be made to fail.
 */
public final class RecordingSink implements NotificationSink {
  public final List<Deliverable> published = new CopyOnWriteArrayList<>();
  public final List<SystemNotification> shown = new CopyOnWriteArrayList<>();
  public final List<String> sounds = new CopyOnWriteArrayList<>();
  public final List<String> dismissed = new CopyOnWriteArrayList<>();
  public final List<Map<String, String>> updates = new CopyOnWriteArrayList<>();

  public volatile boolean failPublish;
  public volatile boolean failShow;
  public volatile boolean failSound;

  @Override
  public void publish(Deliverable deliverable) {
    if (failPublish) {
      throw new DeliverySinkException("publish failed");
    }
    published.add(deliverable);
  }

  @Override
  public void show(SystemNotification notification) {
    if (failShow) {
      throw new DeliverySinkException("permission denied");
    }
    shown.add(notification);
  }

  @Override
  public void playSound(String sound) {
    if (failSound) {
      throw new IllegalStateException("audio device busy");
    }
    sounds.add(sound);
  }

  @Override
  public void dismiss(String tag) {
    dismissed.add(tag);
  }

  @Override
  public void recordUpdated(Map<String, String> newRow, Map<String, String> oldRow) {
    updates.add(newRow);
  }
}
