package io.postflow.platforms;

import com.fasterxml.jackson.databind.JsonNode;
import io.postflow.Platform;
import io.postflow.spi.TokenRefresher;
import io.postflow.vault.TokenRefreshException;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Standard OAuth 2.0 {@code refresh_token} grant against one platform's token endpoint.
 *
 * <pre>{@code
 * TokenRefresher twitter = OAuth2TokenRefresher.twitter(restClient, clientId, clientSecret, clock);
 * }</pre>
 *
 * <p>A response without {@code refresh_token} means the platform kept the old one, reported
 * as a {@code null} refresh token.
 */
public final class OAuth2TokenRefresher implements TokenRefresher {
  private static final Logger logger = Logger.getLogger(OAuth2TokenRefresher.class.getName());

  public static final String TWITTER_TOKEN_URI = "https://api.x.com/2/oauth2/token";
  public static final String LINKEDIN_TOKEN_URI = "https://www.linkedin.com/oauth/v2/accessToken";

  /** How the client authenticates to the token endpoint. */
  public enum ClientAuthentication {
    /** HTTP Basic with client id and secret (Twitter/X confidential clients). */
    BASIC,
    /** {@code client_id} and {@code client_secret} form parameters (LinkedIn). */
    FORM
  }

  private final Platform platform;
  private final RestClient restClient;
  private final String tokenUri;
  private final String clientId;
  private final String clientSecret;
  private final ClientAuthentication clientAuthentication;
  private final Clock clock;

  public OAuth2TokenRefresher(Platform platform, RestClient restClient, String tokenUri, String clientId,
                              String clientSecret, ClientAuthentication clientAuthentication, Clock clock) {
    this.platform = Objects.requireNonNull(platform, "platform");
    this.restClient = Objects.requireNonNull(restClient, "restClient");
    this.tokenUri = Objects.requireNonNull(tokenUri, "tokenUri");
    this.clientId = Objects.requireNonNull(clientId, "clientId");
    this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret");
    this.clientAuthentication = Objects.requireNonNull(clientAuthentication, "clientAuthentication");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static OAuth2TokenRefresher twitter(RestClient restClient, String clientId, String clientSecret, Clock clock) {
    return new OAuth2TokenRefresher(Platform.TWITTER, restClient, TWITTER_TOKEN_URI, clientId, clientSecret,
        ClientAuthentication.BASIC, clock);
  }

  public static OAuth2TokenRefresher linkedIn(RestClient restClient, String clientId, String clientSecret, Clock clock) {
    return new OAuth2TokenRefresher(Platform.LINKEDIN, restClient, LINKEDIN_TOKEN_URI, clientId, clientSecret,
        ClientAuthentication.FORM, clock);
  }

  public static OAuth2TokenRefresher twitter(String clientId, String clientSecret, Duration callTimeout) {
    return twitter(PlatformRestClients.builder(callTimeout).build(), clientId, clientSecret, Clock.systemUTC());
  }

  public static OAuth2TokenRefresher linkedIn(String clientId, String clientSecret, Duration callTimeout) {
    return linkedIn(PlatformRestClients.builder(callTimeout).build(), clientId, clientSecret, Clock.systemUTC());
  }

  public Platform platform() {
    return platform;
  }

  @Override
  public RefreshedTokens refresh(Platform platform, String refreshToken) {
    if (platform != this.platform) {
      throw new IllegalArgumentException("Refresher for " + this.platform.tag() + " cannot refresh "
          + (platform == null ? "null" : platform.tag()) + " tokens");
    }
    if (refreshToken == null || refreshToken.isBlank()) {
      throw new TokenRefreshException("No refresh token for " + platform.tag(), null);
    }

    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "refresh_token");
    form.add("refresh_token", refreshToken);
    form.add("client_id", clientId);
    if (clientAuthentication == ClientAuthentication.FORM) {
      form.add("client_secret", clientSecret);
    }

    JsonNode json;
    try {
      json = restClient.post()
          .uri(tokenUri)
          .headers(h -> {
            if (clientAuthentication == ClientAuthentication.BASIC) {
              h.setBasicAuth(clientId, clientSecret);
            }
          })
          .contentType(MediaType.APPLICATION_FORM_URLENCODED)
          .accept(MediaType.APPLICATION_JSON)
          .body(form)
          .retrieve()
          .body(JsonNode.class);
    } catch (RestClientResponseException e) {
      throw new TokenRefreshException(platform.tag() + " token endpoint rejected the refresh: "
          + HttpFailureClassifier.describe(e.getStatusCode().value(), e.getResponseBodyAsString()), e);
    } catch (RestClientException e) {
      throw new TokenRefreshException(platform.tag() + " token endpoint unreachable: " + e.getMessage(), e);
    }

    RefreshedTokens tokens = TokenResponses.parse(platform, json, clock, null);
    logger.log(Level.FINE, "Refreshed {0} token, rotated={1}, expiresAt={2}",
        new Object[]{platform.tag(), tokens.refreshToken() != null, tokens.expiresAt()});
    return tokens;
  }
}
