package io.postflow.model;

import io.postflow.Platform;

import java.time.Instant;
import java.util.Objects;

/**
 * A decrypted, currently usable access token handed to a platform publisher.
 *
 * <p>{@link #toString()} masks the token value.
 */
public record AccessToken(
    String connectionId,
    Platform platform,
    String platformAccountId,
    String value,
    Instant expiresAt
) {
  public AccessToken {
    Objects.requireNonNull(connectionId, "connectionId");
    Objects.requireNonNull(platform, "platform");
    Objects.requireNonNull(value, "value");
  }

  @Override
  public String toString() {
    return "AccessToken[connectionId=" + connectionId + ", platform=" + platform
        + ", platformAccountId=" + platformAccountId + ", value=****, expiresAt=" + expiresAt + "]";
  }
}
