package io.postflow.platforms;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.postflow.platform.PublishOutcome;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Classifies Meta Graph API failures from the {@code error} object in the response body,
 * falling back to {@link HttpFailureClassifier} when the body carries no known code.
 *
 * <p>Graph reports most failures, expired tokens and throttling included, as HTTP 400, so
 * the status alone is not enough.
 */
public final class MetaGraphErrors {
  private static final Logger logger = Logger.getLogger(MetaGraphErrors.class.getName());
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Invalid or expired session, API session. */
  static final Set<Integer> AUTH_CODES = Set.of(190, 102);

  /** Application, user, page and custom-level throttling. */
  static final Set<Integer> RATE_LIMIT_CODES = Set.of(4, 17, 32, 613);

  /** Graph throttling windows are an hour long and rarely announce their reset. */
  public static final Duration DEFAULT_RETRY_AFTER = Duration.ofHours(1);

  private MetaGraphErrors() {}

  public static PublishOutcome.Failure classify(int status, HttpHeaders headers, String body, Clock clock) {
    JsonNode error = errorNode(body);
    if (error != null) {
      int code = error.path("code").asInt(-1);
      String message = "Graph error " + code + ": " + error.path("message").asText("(no message)");
      if (AUTH_CODES.contains(code)) {
        return PublishOutcome.authError(message);
      }
      if (RATE_LIMIT_CODES.contains(code)) {
        return new PublishOutcome.RateLimited(
            HttpFailureClassifier.retryAfter(headers, clock, DEFAULT_RETRY_AFTER), message);
      }
      if (error.path("is_transient").asBoolean(false)) {
        return PublishOutcome.transientError(message);
      }
    }
    return HttpFailureClassifier.classify(status, headers, body, clock);
  }

  private static JsonNode errorNode(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      JsonNode error = MAPPER.readTree(body).path("error");
      return error.isObject() ? error : null;
    } catch (JsonProcessingException e) {
      logger.log(Level.FINE, "Graph error body is not JSON: {0}", e.getOriginalMessage());
      return null;
    }
  }
}
