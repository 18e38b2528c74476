package io.litecluster.forwarding;

import java.util.Map;
import java.util.Objects;

/**
 * A client request to be replayed against the primary. {@code body} may be null for bodiless
 * methods; {@code queryString} excludes the leading {@code ?}.
 */
public record ForwardRequest(
    String method,
    String path,
    Map<String, String> headers,
    byte[] body,
    String queryString
) {
    public ForwardRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (method.isBlank()) {
            throw new IllegalArgumentException("method must not be blank");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        queryString = queryString == null ? "" : queryString;
    }

    public static ForwardRequest of(String method, String path) {
        return new ForwardRequest(method, path, Map.of(), null, "");
    }

    public String header(String name) {
        for (var entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
