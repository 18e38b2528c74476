package io.litecluster.forwarding;

import java.util.Optional;

/**
 * Locates the primary that writes are forwarded to.
 */
@FunctionalInterface
public interface PrimaryUrlResolver {

    /**
     * Base URL of the current primary, including the scheme, or empty when no primary is known or
     * this node is the primary.
     */
    Optional<String> resolvePrimaryUrl();
}
