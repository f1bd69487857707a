package io.postflow.platforms;

import io.postflow.Platform;
import io.postflow.model.AccessToken;
import io.postflow.model.PublishContent;
import io.postflow.platform.PublishOutcome;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Posts to LinkedIn through the versioned {@code POST /rest/posts} API as the member or
 * organization named by the connection's platform account id. A link preview becomes an
 * article attachment. LinkedIn answers {@code 201 Created} with the new post URN in the
 * {@code x-restli-id} header.
 */
public final class LinkedInPublisher extends AbstractHttpPublisher {

  public static final String DEFAULT_BASE_URL = "https://api.linkedin.com";
  public static final String DEFAULT_API_VERSION = "202401";

  static final String RESTLI_ID_HEADER = "x-restli-id";
  private static final String PERSON_URN_PREFIX = "urn:li:person:";

  private final String apiVersion;

  public LinkedInPublisher(RestClient restClient, Clock clock, String apiVersion) {
    super(restClient, clock);
    this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion");
  }

  public LinkedInPublisher(RestClient restClient, Clock clock) {
    this(restClient, clock, DEFAULT_API_VERSION);
  }

  public static LinkedInPublisher create(String baseUrl, Duration callTimeout) {
    return new LinkedInPublisher(PlatformRestClients.create(baseUrl, callTimeout), Clock.systemUTC());
  }

  @Override
  public Platform platform() {
    return Platform.LINKEDIN;
  }

  @Override
  protected PublishOutcome doPublish(PublishContent content, AccessToken token) {
    String author = authorUrn(token.platformAccountId());
    if (author == null) {
      return PublishOutcome.permanentError("LinkedIn connection " + token.connectionId()
          + " has no member or organization id");
    }
    if (content.text().isBlank() && !content.hasLink()) {
      return PublishOutcome.permanentError("LinkedIn post has no text");
    }

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("author", author);
    body.put("commentary", content.text());
    body.put("visibility", "PUBLIC");
    body.put("distribution", Map.of(
        "feedDistribution", "MAIN_FEED",
        "targetEntities", List.of(),
        "thirdPartyDistributionChannels", List.of()));
    if (content.hasLink()) {
      String link = content.linkPreview().trim();
      body.put("content", Map.of("article", Map.of("source", link, "title", link)));
    }
    body.put("lifecycleState", "PUBLISHED");
    body.put("isReshareDisabledByAuthor", false);

    ResponseEntity<Void> response = restClient.post()
        .uri("/rest/posts")
        .headers(h -> {
          h.setBearerAuth(token.value());
          h.set("LinkedIn-Version", apiVersion);
          h.set("X-Restli-Protocol-Version", "2.0.0");
        })
        .contentType(MediaType.APPLICATION_JSON)
        .body(body)
        .retrieve()
        .toBodilessEntity();
    return accepted(response.getHeaders().getFirst(RESTLI_ID_HEADER), RESTLI_ID_HEADER + " header");
  }

  static String authorUrn(String platformAccountId) {
    if (platformAccountId == null || platformAccountId.isBlank()) {
      return null;
    }
    String id = platformAccountId.trim();
    return id.startsWith("urn:") ? id : PERSON_URN_PREFIX + id;
  }
}
