package io.litecluster.common;

import java.util.Objects;

/**
 * A cluster member address in {@code host:port} form. The host part doubles as the node id,
 * which is how peers are addressed for health probes.
 */
public record ClusterMember(String host, int port) {

    public static final int NO_PORT = -1;

    public ClusterMember {
        Objects.requireNonNull(host, "host must not be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port != NO_PORT && (port <= 0 || port > 65535)) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
    }

    public String nodeId() {
        return host;
    }

    public boolean hasPort() {
        return port != NO_PORT;
    }

    public String address() {
        return hasPort() ? host + ":" + port : host;
    }

    public static ClusterMember parse(String spec) {
        Objects.requireNonNull(spec, "member must not be null");
        int colon = spec.lastIndexOf(':');
        if (colon < 0) {
            return new ClusterMember(spec, NO_PORT);
        }
        if (colon == 0) {
            throw new IllegalArgumentException(
                "Member address must be in format host:port, got: " + spec);
        }
        String host = spec.substring(0, colon);
        int port;
        try {
            port = Integer.parseInt(spec.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Member port must be a valid integer, got: " + spec.substring(colon + 1));
        }
        return new ClusterMember(host, port);
    }

    /**
     * Node id of a member entry, split the same way {@link #parse(String)} splits it.
     */
    public static String nodeIdOf(String spec) {
        return parse(spec).nodeId();
    }
}
