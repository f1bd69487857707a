package io.postflow.platform;

import io.postflow.Platform;
import io.postflow.model.AccessToken;
import io.postflow.model.PublishContent;

/**
 * Creates a post on one external platform.
 *
 * <p>Implementations must not throw: failures are reported as {@link PublishOutcome.Failure}
 * variants. Every network call must carry a timeout shorter than the dispatcher's lease.
 */
public interface PlatformPublisher {

  Platform platform();

  PublishOutcome publish(PublishContent content, AccessToken token);
}
