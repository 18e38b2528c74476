package io.litecluster.benchmark;

import io.litecluster.common.Ticker;
import io.litecluster.forwarding.CircuitBreaker;
import io.litecluster.forwarding.ForwardRequest;
import io.litecluster.forwarding.ForwardingResult;
import io.litecluster.forwarding.ResilientForwarder;
import io.litecluster.forwarding.RetryPolicy;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
public class CircuitBreakerBenchmark {

    private static final ForwardingResult OK = new ForwardingResult(200, Map.of(), new byte[0]);

    private CircuitBreaker closedBreaker;
    private CircuitBreaker openBreaker;
    private ResilientForwarder forwarder;
    private ForwardRequest request;

    @Setup(Level.Trial)
    public void setup() {
        closedBreaker = new CircuitBreaker(5, Duration.ofSeconds(30));

        openBreaker = new CircuitBreaker(1, Duration.ofDays(1), false, Ticker.system());
        openBreaker.recordFailure(openBreaker.tryAcquire());

        forwarder = new ResilientForwarder(
            (primaryUrl, req) -> OK,
            RetryPolicy.defaults(),
            new CircuitBreaker(5, Duration.ofSeconds(30)),
            duration -> { }
        );
        request = ForwardRequest.of("POST", "/api/items");
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public boolean acquireAndRecordClosed() {
        CircuitBreaker.Decision permit = closedBreaker.tryAcquire();
        if (permit.allowed()) {
            closedBreaker.recordSuccess(permit);
        }
        return permit.allowed();
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public long rejectWhileOpen() {
        return openBreaker.tryAcquire().retryAfterSeconds();
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    @Threads(4)
    public boolean acquireAndRecordContended() {
        CircuitBreaker.Decision permit = closedBreaker.tryAcquire();
        if (permit.allowed()) {
            closedBreaker.recordSuccess(permit);
        }
        return permit.allowed();
    }

    @Benchmark
    @BenchmarkMode({Mode.Throughput, Mode.SampleTime})
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public int forwardThroughGuard() {
        return forwarder.forward("http://primary:8000", request).statusCode();
    }
}
