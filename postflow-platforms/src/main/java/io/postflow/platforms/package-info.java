/**
 * HTTP publishers for Twitter/X, LinkedIn, Facebook and Instagram, and the OAuth token
 * refreshers the credential vault uses to renew their access tokens.
 *
 * <p>All calls go through Spring's {@link org.springframework.web.client.RestClient} with
 * timeouts from {@link io.postflow.platforms.PlatformRestClients}. Publishers never throw;
 * refreshers throw {@link io.postflow.vault.TokenRefreshException}.
 */
package io.postflow.platforms;
