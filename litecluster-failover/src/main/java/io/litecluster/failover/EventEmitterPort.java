package io.litecluster.failover;

@FunctionalInterface
public interface EventEmitterPort {

    void emit(FailoverEvent event);
}
