package io.postflow.support;

import io.postflow.event.PublicationEvent;
import io.postflow.spi.NotificationSink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingSink implements NotificationSink {
  private final List<PublicationEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void onPublicationEvent(PublicationEvent event) {
    events.add(event);
  }

  public List<PublicationEvent> events() {
    return new ArrayList<>(events);
  }

  /**
   * Waits until at least {@code count} events arrived.
   */
  public List<PublicationEvent> awaitEvents(int count, Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (events.size() < count && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    return events();
  }
}
