package io.litecluster.server;

import io.litecluster.failover.EventEmitterPort;
import io.litecluster.failover.FailoverEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every failover event, then hands it to an optional downstream emitter. A failing downstream
 * emitter is logged and does not interrupt the transition that produced the event.
 */
public final class LoggingEventEmitter implements EventEmitterPort {
    private static final Logger log = LoggerFactory.getLogger(LoggingEventEmitter.class);

    private final String nodeId;
    private final EventEmitterPort delegate;

    public LoggingEventEmitter(String nodeId) {
        this(nodeId, null);
    }

    public LoggingEventEmitter(String nodeId, EventEmitterPort delegate) {
        this.nodeId = nodeId;
        this.delegate = delegate;
    }

    @Override
    public void emit(FailoverEvent event) {
        log.atInfo()
            .addKeyValue("nodeId", nodeId)
            .addKeyValue("event", event.type())
            .addKeyValue("reason", event.reasonIfPresent().orElse(""))
            .log("Failover event");

        if (delegate == null) {
            return;
        }
        try {
            delegate.emit(event);
        } catch (RuntimeException e) {
            log.atWarn()
                .addKeyValue("event", event.type())
                .setCause(e)
                .log("Failover event listener failed");
        }
    }
}
