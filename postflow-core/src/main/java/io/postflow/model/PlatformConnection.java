package io.postflow.model;

import io.postflow.Platform;

import java.time.Instant;
import java.util.Objects;

/**
 * A user's authorization to post on one platform.
 *
 * <p>Token fields hold ciphertext as stored; only the credential vault decrypts them.
 * {@code expiresAt == null} means the access token does not expire.
 *
 * @param platformAccountId account, page or member URN the publisher posts as
 */
public record PlatformConnection(
    String id,
    String userId,
    Platform platform,
    String platformAccountId,
    String accessTokenCiphertext,
    String refreshTokenCiphertext,
    Instant expiresAt,
    boolean active,
    Instant createdAt,
    Instant updatedAt
) {
  public PlatformConnection {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(platform, "platform");
    Objects.requireNonNull(accessTokenCiphertext, "accessTokenCiphertext");
  }

  public boolean hasRefreshToken() {
    return refreshTokenCiphertext != null && !refreshTokenCiphertext.isEmpty();
  }

  @Override
  public String toString() {
    return "PlatformConnection[id=" + id + ", userId=" + userId + ", platform=" + platform
        + ", platformAccountId=" + platformAccountId + ", expiresAt=" + expiresAt
        + ", active=" + active + "]";
  }
}
