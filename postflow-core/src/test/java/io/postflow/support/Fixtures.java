package io.postflow.support;

import io.postflow.Platform;
import io.postflow.model.PlatformConnection;
import io.postflow.model.PostContent;
import io.postflow.model.Schedule;
import io.postflow.spi.MediaStore;
import io.postflow.spi.PostStore;

import java.net.URI;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

public final class Fixtures {
  public static final String USER = "user-1";
  public static final String POST = "post-1";

  private Fixtures() {
  }

  public static Schedule schedule(String id, Instant scheduledTime, Platform first, Platform... rest) {
    return Schedule.create(id, POST, USER, scheduledTime, EnumSet.of(first, rest), scheduledTime.minusSeconds(60));
  }

  public static PlatformConnection connection(String id, Platform platform, String accessToken,
      String refreshToken, Instant expiresAt, Instant now) {
    return new PlatformConnection(id, USER, platform, platform.tag() + "-account", "enc:" + accessToken,
        refreshToken == null ? null : "enc:" + refreshToken, expiresAt, true, now, now);
  }

  public static PostStore postStore() {
    return postId -> POST.equals(postId)
        ? Optional.of(new PostContent("Hello from postflow", List.of("img-1"), "https://example.com/article"))
        : Optional.empty();
  }

  public static MediaStore mediaStore() {
    return ref -> URI.create("https://cdn.example.com/" + ref);
  }
}
