package dev.hack.logs.source.loki;

import dev.hack.logs.shared.Timestamps;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin HTTP/WebSocket client for the Loki endpoints the log pipeline uses.
 */
public final class LokiClient {
    public static final String DEFAULT_BASE_URL = "http://127.0.0.1:3100";
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private static final Logger log = LoggerFactory.getLogger(LokiClient.class);

    private final HttpClient http;
    private final String baseUrl;
    private final Duration queryTimeout;

    public LokiClient(String baseUrl) {
        this(baseUrl, DEFAULT_QUERY_TIMEOUT);
    }

    public LokiClient(String baseUrl, Duration queryTimeout) {
        this(
            HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(CONNECT_TIMEOUT)
                .build(),
            baseUrl,
            queryTimeout
        );
    }

    public LokiClient(HttpClient http, String baseUrl, Duration queryTimeout) {
        this.http = http;
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.queryTimeout = queryTimeout;
    }

    public String baseUrl() {
        return baseUrl;
    }

    /**
     * Probes {@code /ready}; any failure or a non-2xx answer within the timeout means unreachable.
     */
    public boolean isReady(Duration timeout) {
        var request = HttpRequest.newBuilder(URI.create(baseUrl + "/ready"))
            .timeout(timeout)
            .GET()
            .build();
        CompletableFuture<HttpResponse<Void>> pending = http.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        try {
            int status = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS).statusCode();
            log.debug("Loki readiness at {} answered {}", baseUrl, status);
            return status >= 200 && status < 300;
        } catch (TimeoutException ex) {
            pending.cancel(true);
            log.debug("Loki readiness at {} timed out after {} ms", baseUrl, timeout.toMillis());
            return false;
        } catch (ExecutionException ex) {
            log.debug("Loki readiness at {} failed: {}", baseUrl, ex.getCause() == null ? ex : ex.getCause());
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Issues the {@code query_range} request without blocking. Cancelling the returned future
     * abandons the request; a server that does not answer within the query timeout completes it
     * with an {@link java.net.http.HttpTimeoutException}.
     */
    public CompletableFuture<HttpResponse<String>> queryRange(String query, int limit, Instant start, Instant end) {
        var params = new LinkedHashMap<String, String>();
        params.put("query", query);
        params.put("direction", "BACKWARD");
        params.put("limit", String.valueOf(limit));
        params.put("start", Timestamps.toNanos(start));
        params.put("end", Timestamps.toNanos(end));
        var uri = URI.create(baseUrl + "/loki/api/v1/query_range?" + encode(params));
        log.debug("GET {}", uri);
        var request = HttpRequest.newBuilder(uri).timeout(queryTimeout).GET().build();
        return http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    public URI tailUri(String query, int limit, Instant start) {
        var params = new LinkedHashMap<String, String>();
        params.put("query", query);
        params.put("limit", String.valueOf(limit));
        if (start != null) {
            params.put("start", Timestamps.toNanos(start));
        }
        return URI.create(toWebSocketUrl(baseUrl) + "/loki/api/v1/tail?" + encode(params));
    }

    public CompletableFuture<WebSocket> openTail(URI uri, WebSocket.Listener listener) {
        log.debug("Opening Loki tail {}", uri);
        return http.newWebSocketBuilder().buildAsync(uri, listener);
    }

    static String normalizeBaseUrl(String raw) {
        String trimmed = raw == null ? "" : raw.trim().replaceAll("/+$", "");
        return trimmed.isEmpty() ? DEFAULT_BASE_URL : trimmed;
    }

    static String toWebSocketUrl(String httpUrl) {
        if (httpUrl.startsWith("https://")) {
            return "wss://" + httpUrl.substring("https://".length());
        }
        if (httpUrl.startsWith("http://")) {
            return "ws://" + httpUrl.substring("http://".length());
        }
        return httpUrl;
    }

    private static String encode(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8).replace("+", "%20"))
            .collect(Collectors.joining("&"));
    }
}
