package notify.spring.boot;

import notify.Deliverable;
import notify.delivery.SystemNotification;
import notify.spi.NotificationSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class StubSink implements NotificationSink {
  final List<Deliverable> published = new CopyOnWriteArrayList<>();

  @Override
  public void publish(Deliverable deliverable) {
    published.add(deliverable);
  }

  @Override
  public void show(SystemNotification notification) {
  }

  @Override
  public void playSound(String sound) {
  }
}
