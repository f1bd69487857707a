package io.postflow.dispatch;

import io.postflow.Platform;
import io.postflow.model.Publication;
import io.postflow.poller.DispatchHandler;

import java.util.Objects;

/**
 * Bridges {@link io.postflow.poller.DispatchPoller} to a {@link PublicationDispatcher}.
 */
public final class DispatcherPollerHandler implements DispatchHandler {
  private final PublicationDispatcher dispatcher;

  public DispatcherPollerHandler(PublicationDispatcher dispatcher) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
  }

  @Override
  public int availableCapacity() {
    return dispatcher.availableCapacity();
  }

  @Override
  public boolean hasCapacity(Platform platform) {
    return dispatcher.hasCapacity(platform);
  }

  @Override
  public boolean handle(Publication claimed) {
    return dispatcher.submit(claimed);
  }
}
