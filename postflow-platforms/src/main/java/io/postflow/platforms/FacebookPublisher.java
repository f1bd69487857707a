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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts to a Facebook Page with a page access token. Text-only posts go to the
 * {@code /feed} edge with the link preview as {@code link}; posts with media go to
 * {@code /photos} with the first image URL and the text as caption.
 */
public final class FacebookPublisher extends AbstractMetaGraphPublisher {
  private static final Logger logger = Logger.getLogger(FacebookPublisher.class.getName());

  public FacebookPublisher(RestClient restClient, Clock clock) {
    super(restClient, clock);
  }

  public static FacebookPublisher create(String graphUrl, Duration callTimeout) {
    return new FacebookPublisher(PlatformRestClients.create(graphUrl, callTimeout), Clock.systemUTC());
  }

  @Override
  public Platform platform() {
    return Platform.FACEBOOK;
  }

  @Override
  protected PublishOutcome doPublish(PublishContent content, AccessToken token) {
    String pageId = token.platformAccountId();
    if (pageId == null || pageId.isBlank()) {
      return PublishOutcome.permanentError("Facebook connection " + token.connectionId() + " has no page id");
    }

    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    if (content.hasMedia()) {
      if (content.mediaUrls().size() > 1) {
        logger.log(Level.FINE, "Facebook photo post uses the first of {0} media items",
            content.mediaUrls().size());
      }
      form.add("url", content.mediaUrls().get(0).toString());
      form.add("caption", withLink(content));
      JsonNode response = postForm("photos", pageId, token.value(), form);
      String postId = text(response, "post_id");
      return accepted(postId != null ? postId : text(response, "id"), "post_id");
    }

    if (content.text().isBlank() && !content.hasLink()) {
      return PublishOutcome.permanentError("Facebook post has neither text nor link");
    }
    form.add("message", content.text());
    if (content.hasLink()) {
      form.add("link", content.linkPreview().trim());
    }
    JsonNode response = postForm("feed", pageId, token.value(), form);
    return accepted(text(response, "id"), "id");
  }
}
