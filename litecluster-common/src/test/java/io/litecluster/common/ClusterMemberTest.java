package io.litecluster.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ClusterMemberTest {

    @Test
    void parseSplitsHostAndPort() {
        ClusterMember member = ClusterMember.parse("node1:20202");

        assertThat(member.host()).isEqualTo("node1");
        assertThat(member.port()).isEqualTo(20202);
        assertThat(member.nodeId()).isEqualTo("node1");
        assertThat(member.address()).isEqualTo("node1:20202");
    }

    @Test
    void parseAcceptsBareHost() {
        ClusterMember member = ClusterMember.parse("node1");

        assertThat(member.hasPort()).isFalse();
        assertThat(member.address()).isEqualTo("node1");
    }

    @Test
    void parseRejectsMissingHost() {
        assertThatThrownBy(() -> ClusterMember.parse(":8080"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("host:port");
    }

    @Test
    void parseRejectsNonNumericPort() {
        assertThatThrownBy(() -> ClusterMember.parse("node1:http"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("valid integer");
    }

    @Test
    void constructorRejectsOutOfRangePort() {
        assertThatThrownBy(() -> new ClusterMember("node1", 70000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("between 1 and 65535");
    }

    @Test
    void constructorRejectsBlankHost() {
        assertThatThrownBy(() -> new ClusterMember("  ", 8080))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("host must not be blank");
    }

    @Test
    void nodeIdOfStripsPort() {
        assertThat(ClusterMember.nodeIdOf("node2:20202")).isEqualTo("node2");
        assertThat(ClusterMember.nodeIdOf("node2")).isEqualTo("node2");
    }

    @Test
    void nodeIdOfSplitsLikeParse() {
        assertThat(ClusterMember.nodeIdOf("fe80::1:8000")).isEqualTo(ClusterMember.parse("fe80::1:8000").nodeId());
    }

    @Test
    void nodeIdOfRejectsMissingHost() {
        assertThatThrownBy(() -> ClusterMember.nodeIdOf(":8000"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
