package io.postflow.platforms;

import io.postflow.platform.PublishOutcome;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps an unsuccessful HTTP response onto a {@link PublishOutcome.Failure}.
 *
 * <ul>
 *   <li>401 and 403 are authentication failures.</li>
 *   <li>429 is a rate limit; the wait comes from {@code Retry-After} or {@code x-rate-limit-reset}.</li>
 *   <li>408 and 5xx are transient.</li>
 *   <li>Any other 4xx is permanent.</li>
 * </ul>
 */
public final class HttpFailureClassifier {
  private static final Logger logger = Logger.getLogger(HttpFailureClassifier.class.getName());

  /** Used when a 429 response names no wait. Matches the Twitter/X rate limit window. */
  public static final Duration DEFAULT_RETRY_AFTER = Duration.ofMinutes(15);

  static final String RATE_LIMIT_RESET = "x-rate-limit-reset";

  private static final int MAX_BODY_IN_MESSAGE = 500;

  private HttpFailureClassifier() {}

  public static PublishOutcome.Failure classify(int status, HttpHeaders headers, String body, Clock clock) {
    String message = describe(status, body);
    if (status == 401 || status == 403) {
      return PublishOutcome.authError(message);
    }
    if (status == 429) {
      return new PublishOutcome.RateLimited(retryAfter(headers, clock, DEFAULT_RETRY_AFTER), message);
    }
    if (status == 408 || status >= 500) {
      return PublishOutcome.transientError(message);
    }
    if (status >= 400) {
      return PublishOutcome.permanentError(message);
    }
    // 1xx/3xx leaking out of the client; the request may not have been processed
    return PublishOutcome.transientError("Unexpected " + message);
  }

  /**
   * Reads the wait a platform asked for. {@code Retry-After} may hold delta seconds or an
   * HTTP date; {@code x-rate-limit-reset} holds the epoch second at which the window resets.
   * Waits in the past collapse to zero.
   */
  public static Duration retryAfter(HttpHeaders headers, Clock clock, Duration fallback) {
    if (headers == null) {
      return fallback;
    }
    Instant now = clock.instant();
    String retryAfter = headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (retryAfter != null && !retryAfter.isBlank()) {
      String value = retryAfter.trim();
      try {
        return nonNegative(Duration.ofSeconds(Long.parseLong(value)));
      } catch (NumberFormatException notSeconds) {
        try {
          Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
          return nonNegative(Duration.between(now, at));
        } catch (DateTimeParseException e) {
          logger.log(Level.FINE, "Ignoring unparseable Retry-After header: {0}", value);
        }
      }
    }
    String reset = headers.getFirst(RATE_LIMIT_RESET);
    if (reset != null && !reset.isBlank()) {
      try {
        Instant at = Instant.ofEpochSecond(Long.parseLong(reset.trim()));
        return nonNegative(Duration.between(now, at));
      } catch (NumberFormatException e) {
        logger.log(Level.FINE, "Ignoring unparseable {0} header: {1}", new Object[]{RATE_LIMIT_RESET, reset});
      }
    }
    return fallback;
  }

  static String describe(int status, String body) {
    if (body == null || body.isBlank()) {
      return "HTTP " + status;
    }
    String trimmed = body.strip();
    if (trimmed.length() > MAX_BODY_IN_MESSAGE) {
      trimmed = trimmed.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
    return "HTTP " + status + ": " + trimmed;
  }

  private static Duration nonNegative(Duration duration) {
    return duration.isNegative() ? Duration.ZERO : duration;
  }
}
