package io.postflow.model;

import io.postflow.Platform;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A user's request to publish one post to a set of platforms at a point in time.
 *
 * <p>{@code active=false} means cancelled: no new attempts start. {@code completed} is
 * derived and flips to true once every target platform has a terminal publication.
 */
public record Schedule(
    String id,
    String postId,
    String userId,
    Instant scheduledTime,
    Set<Platform> platforms,
    boolean active,
    boolean completed,
    Instant createdAt,
    Instant updatedAt
) {
  public Schedule {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(postId, "postId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(scheduledTime, "scheduledTime");
    platforms = platforms == null || platforms.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(platforms));
  }

  /**
   * Creates a new active, not-yet-completed schedule.
   */
  public static Schedule create(String id, String postId, String userId, Instant scheduledTime,
      Set<Platform> platforms, Instant now) {
    return new Schedule(id, postId, userId, scheduledTime, platforms, true, false, now, now);
  }
}
