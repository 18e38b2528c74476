package io.litecluster.server;

import io.litecluster.failover.LoggingPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Slf4jLoggingPort implements LoggingPort {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLoggingPort.class);

    private final String nodeId;

    public Slf4jLoggingPort(String nodeId) {
        this.nodeId = nodeId;
    }

    @Override
    public void warning(String message) {
        log.atWarn()
            .addKeyValue("nodeId", nodeId)
            .log(message);
    }
}
