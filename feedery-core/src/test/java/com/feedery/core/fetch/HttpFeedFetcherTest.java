package com.feedery.core.fetch;

import com.feedery.core.model.ConditionalMetadata;
import com.feedery.core.model.FailureKind;
import com.feedery.core.model.FetchResult;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpFeedFetcherTest {

    private static final String FEED = "<rss version=\"2.0\"><channel><title>t</title></channel></rss>";

    private MockWebServer server;
    private HttpFeedFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        fetcher = newFetcher(1024, 0, Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() throws IOException {
        fetcher.close();
        server.shutdown();
    }

    private static HttpFeedFetcher newFetcher(long maxBytes, int retries, Duration timeout) {
        OkHttpClient client = HttpFeedFetcher.buildClient("Planet Test +https://planet.example.org/ Feedery/1.0", timeout);
        return new HttpFeedFetcher(client, maxBytes, retries, 1);
    }

    private String url(String path) {
        return server.url(path).toString();
    }

    @Nested
    @DisplayName("Successful fetches")
    class SuccessTests {

        @Test
        @DisplayName("Should return body and conditional metadata on 200")
        void fetchesBody() throws InterruptedException {
            // Given
            server.enqueue(new MockResponse()
                .setBody(FEED)
                .setHeader("Content-Type", "application/rss+xml; charset=utf-8")
                .setHeader("ETag", "\"v1\"")
                .setHeader("Last-Modified", "Mon, 06 Sep 2021 16:45:00 GMT"));

            // When
            FetchResult result = fetcher.fetch(url("/feed"), ConditionalMetadata.none());

            // Then
            FetchResult.Fetched fetched = assertInstanceOf(FetchResult.Fetched.class, result);
            assertEquals(FEED, new String(fetched.body(), StandardCharsets.UTF_8));
            assertEquals("\"v1\"", fetched.metadata().etag());
            assertEquals("Mon, 06 Sep 2021 16:45:00 GMT", fetched.metadata().lastModified());
            assertNotNull(fetched.metadata().lastFetchedAt());
            assertFalse(fetched.movedPermanently());

            RecordedRequest request = server.takeRequest();
            assertTrue(request.getHeader("User-Agent").endsWith("Feedery/1.0"));
            assertNull(request.getHeader("If-None-Match"));
        }

        @Test
        @DisplayName("Should send validators and report Unchanged on 304")
        void conditionalRequest() throws InterruptedException {
            // Given
            server.enqueue(new MockResponse().setResponseCode(304));
            ConditionalMetadata prior = new ConditionalMetadata("\"v1\"", "Mon, 06 Sep 2021 16:45:00 GMT", null);

            // When
            FetchResult result = fetcher.fetch(url("/feed"), prior);

            // Then
            assertInstanceOf(FetchResult.Unchanged.class, result);
            RecordedRequest request = server.takeRequest();
            assertEquals("\"v1\"", request.getHeader("If-None-Match"));
            assertEquals("Mon, 06 Sep 2021 16:45:00 GMT", request.getHeader("If-Modified-Since"));
        }

        @Test
        @DisplayName("Should send an unconditional request when the cached validators are blank")
        void blankValidatorsAreUnconditional() throws InterruptedException {
            // Given
            server.enqueue(new MockResponse().setBody(FEED));
            ConditionalMetadata prior = new ConditionalMetadata(" ", "", Instant.parse("2021-09-01T00:00:00Z"));

            // When
            FetchResult result = fetcher.fetch(url("/feed"), prior);

            // Then
            assertInstanceOf(FetchResult.Fetched.class, result);
            assertFalse(prior.isConditional());
            RecordedRequest request = server.takeRequest();
            assertNull(request.getHeader("If-None-Match"));
            assertNull(request.getHeader("If-Modified-Since"));
        }
    }

    @Nested
    @DisplayName("Redirects")
    class RedirectTests {

        @Test
        @DisplayName("Should flag a permanent redirect with the final URL")
        void permanentRedirect() {
            // Given
            server.enqueue(new MockResponse().setResponseCode(301).setHeader("Location", "/moved"));
            server.enqueue(new MockResponse().setBody(FEED));

            // When
            FetchResult result = fetcher.fetch(url("/feed"), null);

            // Then
            FetchResult.Fetched fetched = assertInstanceOf(FetchResult.Fetched.class, result);
            assertTrue(fetched.movedPermanently());
            assertEquals(url("/moved"), fetched.finalUrl());
        }

        @Test
        @DisplayName("Should not flag a temporary redirect")
        void temporaryRedirect() {
            // Given
            server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/elsewhere"));
            server.enqueue(new MockResponse().setBody(FEED));

            // When
            FetchResult result = fetcher.fetch(url("/feed"), null);

            // Then
            assertFalse(assertInstanceOf(FetchResult.Fetched.class, result).movedPermanently());
        }
    }

    @Nested
    @DisplayName("Failure classification")
    class FailureTests {

        @Test
        @DisplayName("Should classify 404 as a non-transient HTTP error")
        void httpError() {
            // Given
            server.enqueue(new MockResponse().setResponseCode(404));

            // When
            FetchResult result = fetcher.fetch(url("/missing"), null);

            // Then
            FetchResult.Failed failed = assertInstanceOf(FetchResult.Failed.class, result);
            assertEquals(FailureKind.HTTP_ERROR, failed.kind());
            assertEquals(404, failed.httpStatus());
            assertEquals("http-error(404)", failed.reason());
            assertFalse(failed.isTransient());
        }

        @Test
        @DisplayName("Should reject a body over the size cap")
        void tooLarge() {
            // Given
            server.enqueue(new MockResponse().setBody("x".repeat(4096)));

            // When
            FetchResult result = fetcher.fetch(url("/big"), null);

            // Then
            assertEquals(FailureKind.TOO_LARGE, assertInstanceOf(FetchResult.Failed.class, result).kind());
        }

        @Test
        @DisplayName("Should reject a chunked body over the size cap")
        void tooLargeChunked() {
            // Given
            server.enqueue(new MockResponse().setChunkedBody("y".repeat(4096), 256));

            // When
            FetchResult result = fetcher.fetch(url("/big"), null);

            // Then
            assertEquals(FailureKind.TOO_LARGE, assertInstanceOf(FetchResult.Failed.class, result).kind());
        }

        @Test
        @DisplayName("Should classify an unresponsive server as a timeout")
        void timeout() {
            // Given
            HttpFeedFetcher impatient = newFetcher(1024, 0, Duration.ofMillis(300));
            server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

            // When
            FetchResult result = impatient.fetch(url("/slow"), null);
            impatient.close();

            // Then
            FetchResult.Failed failed = assertInstanceOf(FetchResult.Failed.class, result);
            assertEquals(FailureKind.TIMEOUT, failed.kind());
            assertTrue(failed.isTransient());
        }

        @Test
        @DisplayName("Should classify a refused connection as a connection error")
        void connectionError() throws IOException {
            // Given
            MockWebServer dead = new MockWebServer();
            dead.start();
            String deadUrl = dead.url("/feed").toString();
            dead.shutdown();

            // When
            FetchResult result = fetcher.fetch(deadUrl, null);

            // Then
            assertEquals(FailureKind.CONNECTION_ERROR, assertInstanceOf(FetchResult.Failed.class, result).kind());
        }
    }

    @Nested
    @DisplayName("Retries")
    class RetryTests {

        @Test
        @DisplayName("Should retry a 5xx once and succeed")
        void retriesServerError() {
            // Given
            HttpFeedFetcher retrying = newFetcher(1024, 1, Duration.ofSeconds(2));
            server.enqueue(new MockResponse().setResponseCode(503));
            server.enqueue(new MockResponse().setBody(FEED));

            // When
            FetchResult result = retrying.fetch(url("/flaky"), null);
            retrying.close();

            // Then
            assertInstanceOf(FetchResult.Fetched.class, result);
            assertEquals(2, server.getRequestCount());
        }

        @Test
        @DisplayName("Should not retry a 4xx")
        void doesNotRetryClientError() {
            // Given
            HttpFeedFetcher retrying = newFetcher(1024, 3, Duration.ofSeconds(2));
            server.enqueue(new MockResponse().setResponseCode(403));

            // When
            FetchResult result = retrying.fetch(url("/forbidden"), null);
            retrying.close();

            // Then
            assertInstanceOf(FetchResult.Failed.class, result);
            assertEquals(1, server.getRequestCount());
        }
    }
}
