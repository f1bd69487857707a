package io.postflow.platforms;

import com.fasterxml.jackson.databind.JsonNode;
import io.postflow.Platform;
import io.postflow.spi.TokenRefresher.RefreshedTokens;
import io.postflow.vault.TokenRefreshException;

import java.time.Clock;
import java.time.Instant;

/** Parses OAuth 2.0 token endpoint responses ({@code access_token}, {@code refresh_token}, {@code expires_in}). */
final class TokenResponses {

  private TokenResponses() {}

  static RefreshedTokens parse(Platform platform, JsonNode json, Clock clock, String rotatedRefreshFallback) {
    String accessToken = json == null ? null : json.path("access_token").asText(null);
    if (accessToken == null || accessToken.isBlank()) {
      throw new TokenRefreshException(platform.tag() + " token endpoint returned no access_token", null);
    }
    String refreshToken = json.path("refresh_token").asText(null);
    if (refreshToken == null || refreshToken.isBlank()) {
      refreshToken = rotatedRefreshFallback;
    }
    long expiresIn = json.path("expires_in").asLong(0);
    Instant expiresAt = expiresIn > 0 ? clock.instant().plusSeconds(expiresIn) : null;
    return new RefreshedTokens(accessToken, refreshToken, expiresAt);
  }
}
