package io.postflow.platform;

import io.postflow.Platform;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Thread-safe registry holding at most one publisher per platform.
 *
 * <pre>{@code
 * PublisherRegistry registry = new DefaultPublisherRegistry()
 *     .register(new TwitterPublisher(restClient))
 *     .register(new LinkedInPublisher(restClient));
 * }</pre>
 */
public final class DefaultPublisherRegistry implements PublisherRegistry {
  private final Map<Platform, PlatformPublisher> publishers = new EnumMap<>(Platform.class);

  /**
   * Registers {@code publisher} under its {@link PlatformPublisher#platform()}.
   *
   * @throws IllegalStateException if a publisher is already registered for that platform
   */
  public synchronized DefaultPublisherRegistry register(PlatformPublisher publisher) {
    Objects.requireNonNull(publisher, "publisher");
    Platform platform = Objects.requireNonNull(publisher.platform(), "publisher.platform()");
    if (publishers.containsKey(platform)) {
      throw new IllegalStateException("Publisher already registered for " + platform.tag());
    }
    publishers.put(platform, publisher);
    return this;
  }

  @Override
  public synchronized PlatformPublisher publisherFor(Platform platform) {
    return publishers.get(platform);
  }
}
