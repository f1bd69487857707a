package io.postflow.platforms;

import io.postflow.model.AccessToken;
import io.postflow.model.PublishContent;
import io.postflow.platform.PlatformPublisher;
import io.postflow.platform.PublishOutcome;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for publishers that talk to a platform over HTTP.
 *
 * <p>Subclasses implement {@link #doPublish} against the happy path and let the
 * {@link RestClient} throw; this class turns error responses and transport failures into
 * {@link PublishOutcome.Failure}s so that {@link #publish} never throws.
 */
public abstract class AbstractHttpPublisher implements PlatformPublisher {
  private static final Logger logger = Logger.getLogger(AbstractHttpPublisher.class.getName());

  protected final RestClient restClient;
  protected final Clock clock;

  protected AbstractHttpPublisher(RestClient restClient, Clock clock) {
    this.restClient = Objects.requireNonNull(restClient, "restClient");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public final PublishOutcome publish(PublishContent content, AccessToken token) {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(token, "token");
    try {
      return doPublish(content, token);
    } catch (RestClientResponseException e) {
      HttpHeaders headers = e.getResponseHeaders() == null ? HttpHeaders.EMPTY : e.getResponseHeaders();
      PublishOutcome.Failure failure = classify(e.getStatusCode().value(), headers, e.getResponseBodyAsString());
      logger.log(Level.FINE, "{0} rejected post for connection {1}: {2} {3}",
          new Object[]{platform().tag(), token.connectionId(), failure.kind(), failure.message()});
      return failure;
    } catch (ResourceAccessException e) {
      return PublishOutcome.transientError("I/O error calling " + platform().tag() + ": " + e.getMessage());
    } catch (RestClientException e) {
      return PublishOutcome.transientError("Error calling " + platform().tag() + ": " + e.getMessage());
    }
  }

  /**
   * Creates the post. May throw any {@link RestClientException}.
   */
  protected abstract PublishOutcome doPublish(PublishContent content, AccessToken token);

  protected PublishOutcome.Failure classify(int status, HttpHeaders headers, String body) {
    return HttpFailureClassifier.classify(status, headers, body, clock);
  }

  /**
   * The post was accepted; a response without an id is reported as permanent, since
   * retrying could create a duplicate.
   */
  protected PublishOutcome accepted(String remotePostId, String source) {
    if (remotePostId == null || remotePostId.isBlank()) {
      logger.log(Level.WARNING, "{0} accepted a post but returned no {1}",
          new Object[]{platform().tag(), source});
      return PublishOutcome.permanentError(platform().tag() + " response carried no " + source);
    }
    return PublishOutcome.success(remotePostId);
  }

  /** Appends the link preview URL to {@code text} on its own line. */
  protected static String withLink(PublishContent content) {
    if (!content.hasLink()) {
      return content.text();
    }
    String link = content.linkPreview().trim();
    return content.text().isBlank() ? link : content.text() + "\n\n" + link;
  }
}
