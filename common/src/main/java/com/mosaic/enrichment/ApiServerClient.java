package com.mosaic.enrichment;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Thin HTTP transport for the inference API.
 *
 * <p>Each call is a single blocking {@code POST} of an opaque binary body. There is no
 * retry: a failed call is reported to the caller, which decides what it means for the
 * entry and the {@link ErrorBudget}. Any status code is returned as-is; only
 * transport problems (connect failure, timeout, reset) surface as {@link IOException}.</p>
 */
@Slf4j
public class ApiServerClient {

    private final HttpClient httpClient;

    public ApiServerClient(Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build());
    }

    public ApiServerClient(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Posts {@code body} to {@code url} and waits at most {@code timeout} for the complete
     * response, body included.
     *
     * @throws IOException          on transport failure, including {@link java.net.http.HttpTimeoutException}
     * @throws InterruptedException if the calling worker is interrupted while waiting
     */
    public ApiResponse post(String url, String contentType, byte[] body, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", contentType)
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        // the request timeout only covers the response headers, a stalled body needs its own bound
        CompletableFuture<HttpResponse<byte[]>> exchange =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        HttpResponse<byte[]> response;
        try {
            response = exchange.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            exchange.cancel(true);
            throw new HttpTimeoutException("Response of " + url + " not complete after " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            exchange.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("POST " + url + " failed", cause);
        }
        log.trace("POST {} ({} bytes) -> {}", url, body.length, response.statusCode());
        return new ApiResponse(response.statusCode(), response.body());
    }
}
