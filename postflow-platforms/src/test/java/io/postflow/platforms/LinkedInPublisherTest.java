package io.postflow.platforms;

import io.postflow.Platform;
import io.postflow.platform.PublishOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static io.postflow.platforms.JsonRequests.jsonAt;
import static io.postflow.platforms.JsonRequests.jsonMissing;
import static io.postflow.platforms.PublisherFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

class LinkedInPublisherTest {
    private static final String POSTS = "https://api.linkedin.test/rest/posts";

    private MockRestServiceServer server;
    private LinkedInPublisher publisher;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.linkedin.test");
        server = MockRestServiceServer.bindTo(builder).build();
        publisher = new LinkedInPublisher(builder.build(), CLOCK);
    }

    @Test
    void postsAsMemberWithArticleAndReadsRestliId() {
        server.expect(requestTo(POSTS))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer tok-1"))
            .andExpect(header("LinkedIn-Version", LinkedInPublisher.DEFAULT_API_VERSION))
            .andExpect(header("X-Restli-Protocol-Version", "2.0.0"))
            .andExpect(jsonAt("/author", "urn:li:person:abc123"))
            .andExpect(jsonAt("/commentary", "Our new release"))
            .andExpect(jsonAt("/content/article/source", "https://example.com/release"))
            .andExpect(jsonAt("/lifecycleState", "PUBLISHED"))
            .andRespond(withStatus(HttpStatus.CREATED).header("x-restli-id", "urn:li:share:7001"));

        PublishOutcome outcome = publisher.publish(withLink("Our new release", "https://example.com/release"),
            token(Platform.LINKEDIN, "abc123"));

        assertEquals(PublishOutcome.success("urn:li:share:7001"), outcome);
        server.verify();
    }

    @Test
    void organizationUrnIsUsedAsIs() {
        server.expect(requestTo(POSTS))
            .andExpect(jsonAt("/author", "urn:li:organization:42"))
            .andExpect(jsonMissing("/content"))
            .andRespond(withStatus(HttpStatus.CREATED).header("x-restli-id", "urn:li:share:7002"));

        PublishOutcome outcome = publisher.publish(text("Company update"),
            token(Platform.LINKEDIN, "urn:li:organization:42"));

        assertEquals(PublishOutcome.success("urn:li:share:7002"), outcome);
    }

    @Test
    void missingAccountIdIsPermanent() {
        PublishOutcome outcome = publisher.publish(text("hi"), token(Platform.LINKEDIN, null));

        assertInstanceOf(PublishOutcome.PermanentError.class, outcome);
        server.verify();
    }

    @Test
    void forbiddenIsAuthAndTooManyRequestsFallsBackToDefaultWait() {
        server.expect(requestTo(POSTS)).andRespond(withStatus(HttpStatus.FORBIDDEN));
        server.expect(requestTo(POSTS)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        PublishOutcome first = publisher.publish(text("hi"), token(Platform.LINKEDIN, "abc"));
        PublishOutcome second = publisher.publish(text("hi"), token(Platform.LINKEDIN, "abc"));

        assertInstanceOf(PublishOutcome.AuthError.class, first);
        assertEquals(HttpFailureClassifier.DEFAULT_RETRY_AFTER,
            assertInstanceOf(PublishOutcome.RateLimited.class, second).retryAfter());
    }

    @Test
    void createdWithoutIdHeaderIsPermanent() {
        server.expect(requestTo(POSTS)).andRespond(withStatus(HttpStatus.CREATED));

        assertInstanceOf(PublishOutcome.PermanentError.class,
            publisher.publish(text("hi"), token(Platform.LINKEDIN, "abc")));
    }
}
