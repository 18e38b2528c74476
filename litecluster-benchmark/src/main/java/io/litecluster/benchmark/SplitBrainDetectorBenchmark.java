package io.litecluster.benchmark;

import io.litecluster.raft.RaftClusterState;
import io.litecluster.raft.RaftNodeState;
import io.litecluster.raft.SplitBrainDetector;
import io.litecluster.raft.SplitBrainStatus;
import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
public class SplitBrainDetectorBenchmark {

    @Param({"3", "7", "51"})
    public int clusterSize;

    private SplitBrainDetector healthyCluster;
    private SplitBrainDetector partitionedCluster;

    @Setup(Level.Trial)
    public void setup() {
        RaftClusterState single = cluster(1);
        RaftClusterState split = cluster(2);
        healthyCluster = new SplitBrainDetector(() -> single);
        partitionedCluster = new SplitBrainDetector(() -> split);
    }

    private RaftClusterState cluster(int leaders) {
        List<RaftNodeState> nodes = new ArrayList<>(clusterSize);
        for (int i = 0; i < clusterSize; i++) {
            String nodeId = "node-" + i;
            nodes.add(i < leaders ? RaftNodeState.leader(nodeId) : RaftNodeState.replica(nodeId));
        }
        return new RaftClusterState(nodes);
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public SplitBrainStatus detectSingleLeader() {
        return healthyCluster.detectSplitBrain();
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public SplitBrainStatus detectSplitBrain() {
        return partitionedCluster.detectSplitBrain();
    }
}
