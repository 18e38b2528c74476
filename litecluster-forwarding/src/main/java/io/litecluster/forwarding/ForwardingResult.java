package io.litecluster.forwarding;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

public record ForwardingResult(int statusCode, Map<String, String> headers, byte[] body) {

    public static final int SERVICE_UNAVAILABLE = 503;
    public static final String RETRY_AFTER = "Retry-After";

    public ForwardingResult {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode out of range: " + statusCode);
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = Objects.requireNonNullElse(body, new byte[0]);
    }

    public static ForwardingResult serviceUnavailable(long retryAfterSeconds, String message) {
        return new ForwardingResult(
            SERVICE_UNAVAILABLE,
            Map.of(RETRY_AFTER, Long.toString(retryAfterSeconds), "Content-Type", "text/plain; charset=utf-8"),
            message.getBytes(StandardCharsets.UTF_8)
        );
    }

    public boolean isSuccess() {
        return statusCode < 400;
    }

    public String header(String name) {
        for (var entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public OptionalLong retryAfter() {
        String value = header(RETRY_AFTER);
        if (value == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
