package io.litecluster.failover;

@FunctionalInterface
public interface LoggingPort {

    void warning(String message);
}
