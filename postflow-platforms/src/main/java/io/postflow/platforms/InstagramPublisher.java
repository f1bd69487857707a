package io.postflow.platforms;

import com.fasterxml.jackson.databind.JsonNode;
import io.postflow.Platform;
import io.postflow.model.AccessToken;
import io.postflow.model.PublishContent;
import io.postflow.platform.PublishOutcome;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Publishes an image post to an Instagram professional account in two Graph calls: create a
 * media container from the first image URL, then publish the container.
 *
 * <p>Instagram has no text-only posts, so content without media fails permanently.
 */
public final class InstagramPublisher extends AbstractMetaGraphPublisher {

  public InstagramPublisher(RestClient restClient, Clock clock) {
    super(restClient, clock);
  }

  public static InstagramPublisher create(String graphUrl, Duration callTimeout) {
    return new InstagramPublisher(PlatformRestClients.create(graphUrl, callTimeout), Clock.systemUTC());
  }

  @Override
  public Platform platform() {
    return Platform.INSTAGRAM;
  }

  @Override
  protected PublishOutcome doPublish(PublishContent content, AccessToken token) {
    String igUserId = token.platformAccountId();
    if (igUserId == null || igUserId.isBlank()) {
      return PublishOutcome.permanentError("Instagram connection " + token.connectionId()
          + " has no account id");
    }
    if (!content.hasMedia()) {
      return PublishOutcome.permanentError("Instagram posts require an image");
    }

    MultiValueMap<String, String> container = new LinkedMultiValueMap<>();
    container.add("image_url", content.mediaUrls().get(0).toString());
    container.add("caption", withLink(content));
    String creationId = text(postForm("media", igUserId, token.value(), container), "id");
    if (creationId == null || creationId.isBlank()) {
      // nothing is visible until media_publish, so another attempt cannot duplicate
      return PublishOutcome.transientError("Instagram returned no media container id");
    }

    MultiValueMap<String, String> publish = new LinkedMultiValueMap<>();
    publish.add("creation_id", creationId);
    JsonNode published = postForm("media_publish", igUserId, token.value(), publish);
    return accepted(text(published, "id"), "id");
  }
}
