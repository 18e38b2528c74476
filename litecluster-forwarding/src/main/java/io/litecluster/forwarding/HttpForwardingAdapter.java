package io.litecluster.forwarding;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ForwardingPort} backed by {@link HttpClient}. Hop-by-hop headers are dropped; the original
 * host, client address and scheme travel as {@code X-Forwarded-*} headers.
 */
public final class HttpForwardingAdapter implements ForwardingPort {

    private static final Set<String> DROPPED_HEADERS = Set.of(
        "host", "content-length", "transfer-encoding", "connection", "keep-alive",
        "upgrade", "expect", "te", "trailer", "proxy-connection"
    );

    private final HttpClient httpClient;
    private final Duration readTimeout;

    public HttpForwardingAdapter(Duration connectTimeout, Duration readTimeout) {
        this(
            HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout must not be null"))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(),
            readTimeout
        );
    }

    public HttpForwardingAdapter(HttpClient httpClient, Duration readTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout must not be null");
    }

    public static HttpForwardingAdapter from(ForwardingConfig config) {
        return new HttpForwardingAdapter(config.connectTimeout(), config.readTimeout());
    }

    @Override
    public ForwardingResult forwardRequest(String primaryUrl, ForwardRequest request) throws IOException {
        URI uri = targetUri(primaryUrl, request);

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(readTimeout)
            .method(request.method().toUpperCase(Locale.ROOT), bodyPublisher(request.body()));

        for (var header : request.headers().entrySet()) {
            if (!DROPPED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                builder.header(header.getKey(), header.getValue());
            }
        }
        String originalHost = request.header("Host");
        if (originalHost != null) {
            builder.setHeader("X-Forwarded-Host", originalHost);
        }
        String clientAddress = request.header("X-Forwarded-For");
        if (clientAddress == null) {
            clientAddress = request.header("X-Real-IP");
        }
        if (clientAddress != null) {
            builder.setHeader("X-Forwarded-For", clientAddress);
        }
        String proto = request.header("X-Forwarded-Proto");
        builder.setHeader("X-Forwarded-Proto", proto != null ? proto : "http");

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while forwarding to " + uri);
        }

        return new ForwardingResult(response.statusCode(), flatten(response.headers().map()), response.body());
    }

    static URI targetUri(String primaryUrl, ForwardRequest request) {
        String base = primaryUrl.endsWith("/") ? primaryUrl.substring(0, primaryUrl.length() - 1) : primaryUrl;
        String path = request.path().startsWith("/") ? request.path() : "/" + request.path();
        String query = request.queryString().isEmpty() ? "" : "?" + request.queryString();
        try {
            return URI.create(base + path + query);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid forward target: " + base + path, e);
        }
    }

    private static HttpRequest.BodyPublisher bodyPublisher(byte[] body) {
        return body == null || body.length == 0
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(body);
    }

    private static Map<String, String> flatten(Map<String, List<String>> headers) {
        Map<String, String> flat = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (!name.startsWith(":") && !DROPPED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                flat.put(name, String.join(", ", values));
            }
        });
        return flat;
    }
}
