package io.postflow.platforms;

import com.fasterxml.jackson.databind.JsonNode;
import io.postflow.platform.PublishOutcome;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Shared plumbing for Facebook and Instagram, which both publish through the Graph API with
 * form-encoded edges and report failures as Graph error objects.
 */
public abstract class AbstractMetaGraphPublisher extends AbstractHttpPublisher {

  public static final String DEFAULT_GRAPH_URL = "https://graph.facebook.com/v18.0";

  protected AbstractMetaGraphPublisher(RestClient restClient, Clock clock) {
    super(restClient, clock);
  }

  @Override
  protected PublishOutcome.Failure classify(int status, HttpHeaders headers, String body) {
    return MetaGraphErrors.classify(status, headers, body, clock);
  }

  JsonNode postForm(String edge, String nodeId, String accessToken, MultiValueMap<String, String> form) {
    return restClient.post()
        .uri("/{node}/" + edge, nodeId)
        .headers(h -> h.setBearerAuth(accessToken))
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .body(form)
        .retrieve()
        .body(JsonNode.class);
  }

  static String text(JsonNode node, String field) {
    return node == null ? null : node.path(field).asText(null);
  }
}
