package io.litecluster.raft;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RaftClusterStateTest {

    @Test
    void countsLeaders() {
        var state = RaftClusterState.of(
            RaftNodeState.leader("node1"),
            RaftNodeState.replica("node2"),
            RaftNodeState.leader("node3"));

        assertThat(state.countLeaders()).isEqualTo(2);
        assertThat(state.hasSingleLeader()).isFalse();
        assertThat(state.getLeaderNodes()).extracting(RaftNodeState::nodeId).containsExactly("node1", "node3");
        assertThat(state.getReplicaNodes()).extracting(RaftNodeState::nodeId).containsExactly("node2");
    }

    @Test
    void singleLeaderIsHealthy() {
        var state = RaftClusterState.of(RaftNodeState.leader("node1"), RaftNodeState.replica("node2"));

        assertThat(state.hasSingleLeader()).isTrue();
    }

    @Test
    void noLeaderIsNotSingleLeader() {
        var state = RaftClusterState.of(RaftNodeState.replica("node1"));

        assertThat(state.countLeaders()).isZero();
        assertThat(state.hasSingleLeader()).isFalse();
        assertThat(state.getLeaderNodes()).isEmpty();
    }

    @Test
    void rejectsEmptyNodeList() {
        assertThatThrownBy(() -> new RaftClusterState(List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nodes must not be empty");
    }

    @Test
    void copiesNodesDefensively() {
        var nodes = new ArrayList<RaftNodeState>();
        nodes.add(RaftNodeState.leader("node1"));
        var state = new RaftClusterState(nodes);

        nodes.add(RaftNodeState.leader("node2"));

        assertThat(state.nodes()).hasSize(1);
    }

    @Test
    void nodeStateRejectsBlankId() {
        assertThatThrownBy(() -> new RaftNodeState("", true))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RaftNodeState(" \t", false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nodeStatesWithSameContentAreEqual() {
        assertThat(RaftNodeState.leader("node1")).isEqualTo(new RaftNodeState("node1", true));
        assertThat(RaftNodeState.leader("node1")).isNotEqualTo(RaftNodeState.replica("node1"));
    }
}
