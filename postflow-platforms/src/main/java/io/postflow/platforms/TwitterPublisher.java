package io.postflow.platforms;

import com.fasterxml.jackson.databind.JsonNode;
import io.postflow.Platform;
import io.postflow.model.AccessToken;
import io.postflow.model.PublishContent;
import io.postflow.platform.PublishOutcome;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Posts to Twitter/X through the v2 {@code POST /2/tweets} endpoint with an OAuth 2.0 user
 * token. The link preview is appended to the text; X unfurls it into a card.
 *
 * <p>Media references are not attached: X only accepts media ids from its own upload API.
 */
public final class TwitterPublisher extends AbstractHttpPublisher {

  public static final String DEFAULT_BASE_URL = "https://api.x.com";

  public TwitterPublisher(RestClient restClient, Clock clock) {
    super(restClient, clock);
  }

  public static TwitterPublisher create(String baseUrl, Duration callTimeout) {
    return new TwitterPublisher(PlatformRestClients.create(baseUrl, callTimeout), Clock.systemUTC());
  }

  @Override
  public Platform platform() {
    return Platform.TWITTER;
  }

  @Override
  protected PublishOutcome doPublish(PublishContent content, AccessToken token) {
    String text = withLink(content);
    if (text.isBlank()) {
      return PublishOutcome.permanentError("Tweet has no text");
    }
    JsonNode response = restClient.post()
        .uri("/2/tweets")
        .headers(h -> h.setBearerAuth(token.value()))
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("text", text))
        .retrieve()
        .body(JsonNode.class);
    return accepted(response == null ? null : response.path("data").path("id").asText(null), "data.id");
  }
}
