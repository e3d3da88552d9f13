package com.example.readrouting.routing.hash;

import com.example.readrouting.exception.RoutingConfigurationException;
import com.example.readrouting.model.ReplicaNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsistentHashReplicaSelectorTest {

    private static final int KEYS = 10_000;

    private static List<ReplicaNode> replicas(int count) {
        List<ReplicaNode> nodes = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            nodes.add(ReplicaNode.replica("replica" + i, "localhost:" + (5432 + i) + "/testdb"));
        }
        return nodes;
    }

    @Test
    void sameKeyAlwaysSelectsSameReplica() {
        ConsistentHashReplicaSelector selector = new ConsistentHashReplicaSelector();
        List<ReplicaNode> three = replicas(3);
        ReplicaNode first = selector.select("user-42", three);

        for (int i = 0; i < 100; i++) {
            assertThat(selector.select("user-42", three)).isEqualTo(first);
        }
    }

    @Test
    void spreadsKeysRoughlyEvenly() {
        ConsistentHashReplicaSelector selector = new ConsistentHashReplicaSelector();
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < KEYS; i++) {
            counts.merge(selector.select("session-" + i, replicas(3)).getId(), 1, Integer::sum);
        }

        assertThat(counts).hasSize(3);
        for (int count : counts.values()) {
            assertThat(count).isBetween(KEYS / 6, KEYS * 2 / 3);
        }
    }

    @Test
    void addingReplicaMovesOnlyKeysThatLandOnIt() {
        ConsistentHashReplicaSelector beforeRing = new ConsistentHashReplicaSelector();
        ConsistentHashReplicaSelector afterRing = new ConsistentHashReplicaSelector();
        List<ReplicaNode> three = replicas(3);
        List<ReplicaNode> four = replicas(4);

        int moved = 0;
        for (int i = 0; i < KEYS; i++) {
            String key = "session-" + i;
            ReplicaNode before = beforeRing.select(key, three);
            ReplicaNode after = afterRing.select(key, four);
            if (!before.equals(after)) {
                moved++;
                assertThat(after.getId()).isEqualTo("replica4");
            }
        }

        assertThat(moved).isLessThan(KEYS * 2 / 5);
    }

    @Test
    void moduloRemapsMostKeysOnTheSameChange() {
        ModuloReplicaSelector modulo = new ModuloReplicaSelector();
        List<ReplicaNode> three = replicas(3);
        List<ReplicaNode> four = replicas(4);

        int moved = 0;
        for (int i = 0; i < KEYS; i++) {
            String key = "session-" + i;
            if (!modulo.select(key, three).equals(modulo.select(key, four))) {
                moved++;
            }
        }

        assertThat(moved).isGreaterThan(KEYS * 3 / 5);
    }

    @Test
    void emptyReplicaSetIsConfigurationError() {
        assertThatThrownBy(() -> new ConsistentHashReplicaSelector().select("alice", List.of()))
                .isInstanceOf(RoutingConfigurationException.class);
    }

    @Test
    void rejectsNonPositiveVirtualNodes() {
        assertThatThrownBy(() -> new ConsistentHashReplicaSelector(0))
                .isInstanceOf(RoutingConfigurationException.class);
    }
}
