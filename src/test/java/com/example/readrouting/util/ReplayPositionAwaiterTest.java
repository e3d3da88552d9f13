package com.example.readrouting.util;

import com.example.readrouting.TestNodes;
import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.exception.PositionUnavailableException;
import com.example.readrouting.position.LogPosition;
import com.example.readrouting.registry.ReplicaRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReplayPositionAwaiterTest {

    private static final LogPosition TARGET = LogPosition.parse("0/3000060");

    @Test
    void returnsOnceReplicaReachesTarget() {
        NodeEndpoint replica = TestNodes.replica("replica1", 5433);
        when(replica.lastReplayPosition())
                .thenThrow(new PositionUnavailableException("replica1", "not in recovery yet"))
                .thenReturn(LogPosition.parse("0/3000000"))
                .thenReturn(TARGET);

        boolean reached = ReplayPositionAwaiter.awaitReplay(replica, TARGET, Duration.ofSeconds(5), Duration.ofMillis(1));

        assertThat(reached).isTrue();
        verify(replica, atLeast(3)).lastReplayPosition();
    }

    @Test
    void givesUpAfterTimeout() {
        NodeEndpoint replica = TestNodes.replica("replica1", 5433);
        when(replica.lastReplayPosition()).thenReturn(LogPosition.parse("0/1000000"));

        boolean reached = ReplayPositionAwaiter.awaitReplay(replica, TARGET, Duration.ofMillis(50), Duration.ofMillis(5));

        assertThat(reached).isFalse();
    }

    @Test
    void waitsForEveryReplica() {
        NodeEndpoint primary = TestNodes.primary("primary");
        NodeEndpoint replica1 = TestNodes.replica("replica1", 5433);
        NodeEndpoint replica2 = TestNodes.replica("replica2", 5434);
        when(primary.currentWritePosition()).thenReturn(TARGET);
        when(replica1.lastReplayPosition()).thenReturn(LogPosition.parse("0/3000100"));
        when(replica2.lastReplayPosition()).thenReturn(LogPosition.parse("0/2FFFFFF"), TARGET);

        ReplicaRegistry registry = new ReplicaRegistry(primary, List.of(replica1, replica2));

        assertThat(ReplayPositionAwaiter.awaitAllReplicas(registry, Duration.ofSeconds(5))).isTrue();
    }
}
