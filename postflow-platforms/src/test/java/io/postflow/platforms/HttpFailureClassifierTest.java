package io.postflow.platforms;

import io.postflow.model.ErrorKind;
import io.postflow.platform.PublishOutcome;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import static io.postflow.platforms.PublisherFixtures.CLOCK;
import static io.postflow.platforms.PublisherFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;

class HttpFailureClassifierTest {

    private static ErrorKind kindOf(int status) {
        return HttpFailureClassifier.classify(status, HttpHeaders.EMPTY, null, CLOCK).kind();
    }

    @Test
    void statusTable() {
        assertEquals(ErrorKind.AUTH, kindOf(401));
        assertEquals(ErrorKind.AUTH, kindOf(403));
        assertEquals(ErrorKind.RATE_LIMITED, kindOf(429));
        assertEquals(ErrorKind.TRANSIENT, kindOf(408));
        assertEquals(ErrorKind.TRANSIENT, kindOf(500));
        assertEquals(ErrorKind.TRANSIENT, kindOf(503));
        assertEquals(ErrorKind.PERMANENT, kindOf(400));
        assertEquals(ErrorKind.PERMANENT, kindOf(404));
        assertEquals(ErrorKind.PERMANENT, kindOf(422));
    }

    @Test
    void retryAfterAcceptsHttpDate() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER,
            DateTimeFormatter.RFC_1123_DATE_TIME.format(NOW.plusSeconds(300).atZone(ZoneOffset.UTC)));

        assertEquals(Duration.ofSeconds(300), HttpFailureClassifier.retryAfter(headers, CLOCK, Duration.ZERO));
    }

    @Test
    void pastResetCollapsesToZeroAndGarbageFallsBack() {
        HttpHeaders past = new HttpHeaders();
        past.set(HttpFailureClassifier.RATE_LIMIT_RESET, String.valueOf(NOW.minusSeconds(60).getEpochSecond()));
        HttpHeaders garbage = new HttpHeaders();
        garbage.set(HttpHeaders.RETRY_AFTER, "soon");

        assertEquals(Duration.ZERO, HttpFailureClassifier.retryAfter(past, CLOCK, Duration.ofMinutes(1)));
        assertEquals(Duration.ofMinutes(1), HttpFailureClassifier.retryAfter(garbage, CLOCK, Duration.ofMinutes(1)));
    }

    @Test
    void messageCarriesStatusAndTruncatedBody() {
        PublishOutcome.Failure failure = HttpFailureClassifier.classify(400, HttpHeaders.EMPTY, "x".repeat(2000), CLOCK);

        assertTrue(failure.message().startsWith("HTTP 400: xxx"));
        assertTrue(failure.message().length() < 600);
    }
}
