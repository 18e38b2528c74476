package io.litecluster.forwarding;

import java.io.IOException;

@FunctionalInterface
public interface ForwardingPort {

    /**
     * Replays {@code request} against the primary at {@code primaryUrl}.
     *
     * @throws IOException on connection failures and timeouts
     */
    ForwardingResult forwardRequest(String primaryUrl, ForwardRequest request) throws IOException;
}
