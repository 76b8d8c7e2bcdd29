package com.feedery.core.fetch;

import com.feedery.core.config.AggregatorConfig;
import com.feedery.core.model.ConditionalMetadata;
import com.feedery.core.model.FailureKind;
import com.feedery.core.model.FetchResult;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp-backed fetcher with conditional requests, a response size cap, and bounded
 * in-run retries for transient failures.
 */
public class HttpFeedFetcher implements FeedFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpFeedFetcher.class);

    private static final String ACCEPT = "application/atom+xml, application/rss+xml, "
        + "application/rdf+xml;q=0.9, application/xml;q=0.8, text/xml;q=0.8, */*;q=0.5";

    private final OkHttpClient client;
    private final long maxResponseBytes;
    private final int retries;
    private final long retryBackoffMillis;

    public HttpFeedFetcher(AggregatorConfig config) {
        this(buildClient(config.getUserAgent(), config.feedTimeout()),
            config.getMaxResponseBytes(), config.getRetries(), config.getRetryBackoffMillis());
    }

    public HttpFeedFetcher(OkHttpClient client, long maxResponseBytes, int retries, long retryBackoffMillis) {
        this.client = client;
        this.maxResponseBytes = maxResponseBytes;
        this.retries = retries;
        this.retryBackoffMillis = retryBackoffMillis;
    }

    public static OkHttpClient buildClient(String userAgent, Duration timeout) {
        long millis = timeout.toMillis();
        return new OkHttpClient.Builder()
            .connectTimeout(millis, TimeUnit.MILLISECONDS)
            .readTimeout(millis, TimeUnit.MILLISECONDS)
            .writeTimeout(millis, TimeUnit.MILLISECONDS)
            .callTimeout(millis, TimeUnit.MILLISECONDS)
            .followRedirects(true)
            .followSslRedirects(true)
            .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                .header("User-Agent", userAgent)
                .build()))
            .build();
    }

    @Override
    public FetchResult fetch(String url, ConditionalMetadata prior) {
        FetchResult result = attempt(url, prior);

        int attempt = 0;
        while (attempt < retries
                && result instanceof FetchResult.Failed failed
                && failed.isTransient()) {
            long delay = retryBackoffMillis << attempt;
            log.debug("Retrying <{}> in {}ms after {}", url, delay, failed.reason());
            if (!pause(delay)) {
                return FetchResult.Failed.of(FailureKind.TIMEOUT, "interrupted while waiting to retry");
            }
            attempt++;
            result = attempt(url, prior);
        }
        return result;
    }

    private FetchResult attempt(String url, ConditionalMetadata prior) {
        Request request;
        try {
            Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", ACCEPT);
            if (prior != null && prior.isConditional()) {
                if (prior.etag() != null && !prior.etag().isBlank()) {
                    builder.header("If-None-Match", prior.etag());
                }
                if (prior.lastModified() != null && !prior.lastModified().isBlank()) {
                    builder.header("If-Modified-Since", prior.lastModified());
                }
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            return FetchResult.Failed.of(FailureKind.CONNECTION_ERROR, "invalid URL: " + e.getMessage());
        }

        Call call = client.newCall(request);
        try (Response response = call.execute()) {
            int code = response.code();
            if (code == 304) {
                return new FetchResult.Unchanged();
            }
            if (!response.isSuccessful()) {
                return FetchResult.Failed.http(code);
            }

            ResponseBody body = response.body();
            byte[] bytes = body != null ? readCapped(body) : new byte[0];
            if (bytes == null) {
                return FetchResult.Failed.of(FailureKind.TOO_LARGE,
                    "response exceeds " + maxResponseBytes + " bytes");
            }

            ConditionalMetadata metadata = new ConditionalMetadata(
                response.header("ETag"),
                response.header("Last-Modified"),
                Instant.now().truncatedTo(ChronoUnit.MILLIS)
            );
            return new FetchResult.Fetched(
                bytes,
                response.header("Content-Type"),
                metadata,
                code,
                response.request().url().toString(),
                movedPermanently(response)
            );

        } catch (SocketTimeoutException e) {
            return FetchResult.Failed.of(FailureKind.TIMEOUT, e.getMessage());
        } catch (InterruptedIOException e) {
            // OkHttp's call timeout surfaces as a bare InterruptedIOException
            return FetchResult.Failed.of(FailureKind.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            if (call.isCanceled()) {
                return FetchResult.Failed.of(FailureKind.TIMEOUT, "cancelled at run deadline");
            }
            return FetchResult.Failed.of(FailureKind.CONNECTION_ERROR, describe(e));
        }
    }

    /** Read the body, or return null once it exceeds the cap. */
    private byte[] readCapped(ResponseBody body) throws IOException {
        long declared = body.contentLength();
        if (declared > maxResponseBytes) {
            return null;
        }
        BufferedSource source = body.source();
        if (source.request(maxResponseBytes + 1)) {
            return null;
        }
        return source.readByteArray();
    }

    /** Whether every redirect hop leading to this response was permanent. */
    private static boolean movedPermanently(Response response) {
        Response hop = response.priorResponse();
        if (hop == null) return false;
        while (hop != null) {
            if (hop.code() != 301 && hop.code() != 308) return false;
            hop = hop.priorResponse();
        }
        return true;
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage()
            : e.getClass().getSimpleName();
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void cancelAll() {
        client.dispatcher().cancelAll();
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
