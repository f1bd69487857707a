package io.postflow.platform;

import io.postflow.Platform;

/**
 * Looks up the publisher responsible for a platform.
 *
 * @see DefaultPublisherRegistry
 */
public interface PublisherRegistry {

  /**
   * @return the publisher for {@code platform}, or {@code null} if none is registered
   */
  PlatformPublisher publisherFor(Platform platform);
}
