package io.litecluster.forwarding;

import java.util.Objects;
import java.util.Optional;

/**
 * Always resolves to a fixed primary URL taken from configuration.
 */
public final class StaticPrimaryUrlResolver implements PrimaryUrlResolver {

    private final String primaryUrl;

    public StaticPrimaryUrlResolver(String primaryUrl) {
        Objects.requireNonNull(primaryUrl, "primaryUrl must not be null");
        if (primaryUrl.isBlank()) {
            throw new IllegalArgumentException("primaryUrl must not be blank");
        }
        this.primaryUrl = primaryUrl.contains("://") ? primaryUrl : "http://" + primaryUrl;
    }

    @Override
    public Optional<String> resolvePrimaryUrl() {
        return Optional.of(primaryUrl);
    }

    @Override
    public String toString() {
        return "StaticPrimaryUrlResolver{" + primaryUrl + "}";
    }
}
