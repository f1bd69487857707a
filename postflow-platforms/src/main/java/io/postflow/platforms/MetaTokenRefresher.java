package io.postflow.platforms;

import com.fasterxml.jackson.databind.JsonNode;
import io.postflow.Platform;
import io.postflow.spi.TokenRefresher;
import io.postflow.vault.TokenRefreshException;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Extends a long-lived Meta user or page token with the {@code fb_exchange_token} grant.
 *
 * <p>Meta issues no refresh tokens; the long-lived token itself is exchanged for a fresh one.
 * Connections therefore store the long-lived token as their refresh token too, and each
 * exchange rotates it to the newly issued token. Serves both Facebook and Instagram.
 */
public final class MetaTokenRefresher implements TokenRefresher {
  private static final Logger logger = Logger.getLogger(MetaTokenRefresher.class.getName());

  public static final String DEFAULT_TOKEN_URI = "https://graph.facebook.com/v18.0/oauth/access_token";

  private final RestClient restClient;
  private final String tokenUri;
  private final String appId;
  private final String appSecret;
  private final Clock clock;

  public MetaTokenRefresher(RestClient restClient, String tokenUri, String appId, String appSecret, Clock clock) {
    this.restClient = Objects.requireNonNull(restClient, "restClient");
    this.tokenUri = Objects.requireNonNull(tokenUri, "tokenUri");
    this.appId = Objects.requireNonNull(appId, "appId");
    this.appSecret = Objects.requireNonNull(appSecret, "appSecret");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static MetaTokenRefresher create(String appId, String appSecret, Duration callTimeout) {
    return new MetaTokenRefresher(PlatformRestClients.builder(callTimeout).build(), DEFAULT_TOKEN_URI,
        appId, appSecret, Clock.systemUTC());
  }

  @Override
  public RefreshedTokens refresh(Platform platform, String refreshToken) {
    if (platform != Platform.FACEBOOK && platform != Platform.INSTAGRAM) {
      throw new IllegalArgumentException("Not a Meta platform: " + platform);
    }
    if (refreshToken == null || refreshToken.isBlank()) {
      throw new TokenRefreshException("No long-lived token to exchange for " + platform.tag(), null);
    }

    URI uri = UriComponentsBuilder.fromUriString(tokenUri)
        .queryParam("grant_type", "fb_exchange_token")
        .queryParam("client_id", "{appId}")
        .queryParam("client_secret", "{appSecret}")
        .queryParam("fb_exchange_token", "{token}")
        .encode()
        .buildAndExpand(appId, appSecret, refreshToken)
        .toUri();

    JsonNode json;
    try {
      json = restClient.get()
          .uri(uri)
          .accept(MediaType.APPLICATION_JSON)
          .retrieve()
          .body(JsonNode.class);
    } catch (RestClientResponseException e) {
      throw new TokenRefreshException(platform.tag() + " token exchange rejected: "
          + HttpFailureClassifier.describe(e.getStatusCode().value(), e.getResponseBodyAsString()), e);
    } catch (RestClientException e) {
      throw new TokenRefreshException(platform.tag() + " token endpoint unreachable: " + e.getMessage(), e);
    }

    RefreshedTokens exchanged = TokenResponses.parse(platform, json, clock, null);
    logger.log(Level.FINE, "Exchanged {0} long-lived token, expiresAt={1}",
        new Object[]{platform.tag(), exchanged.expiresAt()});
    return new RefreshedTokens(exchanged.accessToken(), exchanged.accessToken(), exchanged.expiresAt());
  }
}
