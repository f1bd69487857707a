package io.postflow.platforms;

import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Objects;

/**
 * Builds the {@link RestClient}s used by publishers and token refreshers. Every client gets
 * connect and read timeouts of {@code callTimeout}, which must stay below the dispatcher's
 * lease duration.
 */
public final class PlatformRestClients {

  private PlatformRestClients() {}

  public static RestClient.Builder builder(Duration callTimeout) {
    Objects.requireNonNull(callTimeout, "callTimeout");
    if (callTimeout.isNegative() || callTimeout.isZero()) {
      throw new IllegalArgumentException("callTimeout must be positive");
    }
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(callTimeout);
    requestFactory.setReadTimeout(callTimeout);
    return RestClient.builder().requestFactory(requestFactory);
  }

  public static RestClient create(String baseUrl, Duration callTimeout) {
    Objects.requireNonNull(baseUrl, "baseUrl");
    return builder(callTimeout).baseUrl(baseUrl).build();
  }
}
