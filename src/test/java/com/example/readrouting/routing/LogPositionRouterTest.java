package com.example.readrouting.routing;

import com.example.readrouting.TestNodes;
import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.exception.PositionUnavailableException;
import com.example.readrouting.model.RoutingDecision;
import com.example.readrouting.position.LogPosition;
import com.example.readrouting.registry.ReplicaRegistry;
import com.example.readrouting.session.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LogPositionRouterTest {

    private NodeEndpoint primary;
    private NodeEndpoint replica;
    private SessionStore store;
    private LogPositionRouter router;

    @BeforeEach
    void setUp() {
        primary = TestNodes.primary("primary");
        replica = TestNodes.replica("replica1", 5433);
        store = new SessionStore();
        router = new LogPositionRouter(store, new ReplicaRegistry(primary, List.of(replica)), null);
    }

    @Test
    void recordsPrimaryPositionAfterWrite() {
        when(primary.currentWritePosition()).thenReturn(LogPosition.parse("0/3000060"));

        router.recordWrite("alice");

        assertThat(store.find("alice").orElseThrow().getLastWritePosition())
                .contains(LogPosition.parse("0/3000060"));
    }

    @Test
    void sessionWithoutWritesIsCaughtUpWithoutAskingReplica() {
        assertThat(router.isCaughtUp("alice", replica)).isTrue();
        assertThat(router.route("alice").getTarget().getId()).isEqualTo("replica1");

        verify(replica, never()).lastReplayPosition();
    }

    @Test
    void routesToPrimaryUntilReplicaReplaysTheWrite() {
        when(primary.currentWritePosition()).thenReturn(LogPosition.parse("0/5000"));
        router.recordWrite("y-writer");

        when(replica.lastReplayPosition()).thenReturn(LogPosition.parse("0/4FFF"));
        RoutingDecision lagging = router.route("y-writer");
        assertThat(lagging.isPrimary()).isTrue();
        assertThat(lagging.getLabel()).isEqualTo("PRIMARY (replica lagging)");

        when(replica.lastReplayPosition()).thenReturn(LogPosition.parse("0/5000"));
        RoutingDecision caughtUp = router.route("y-writer");
        assertThat(caughtUp.getTarget().getId()).isEqualTo("replica1");
        assertThat(caughtUp.getLabel()).isEqualTo("REPLICA (replica1, caught up)");
    }

    @Test
    void comparesPositionsInWalOrder() {
        when(primary.currentWritePosition()).thenReturn(LogPosition.parse("0/10"));
        router.recordWrite("alice");
        when(replica.lastReplayPosition()).thenReturn(LogPosition.parse("0/9"));

        assertThat(router.isCaughtUp("alice", replica)).isFalse();
    }

    @Test
    void unavailableReplayPositionFailsClosed() {
        when(primary.currentWritePosition()).thenReturn(LogPosition.parse("0/10"));
        router.recordWrite("alice");
        when(replica.lastReplayPosition())
                .thenThrow(new PositionUnavailableException("replica1", "statement timeout"));

        assertThat(router.isCaughtUp("alice", replica)).isFalse();
        assertThat(router.route("alice").isPrimary()).isTrue();
    }

    @Test
    void uncapturedWritePositionPinsSessionToPrimary() {
        when(primary.currentWritePosition())
                .thenThrow(new PositionUnavailableException("primary", "connection reset"));
        router.recordWrite("alice");

        assertThat(store.find("alice").orElseThrow().isWritePositionUnknown()).isTrue();
        assertThat(router.route("alice").isPrimary()).isTrue();
        verify(replica, never()).lastReplayPosition();
    }

    @Test
    void laterCapturedWriteReleasesPinnedSession() {
        when(primary.currentWritePosition())
                .thenThrow(new PositionUnavailableException("primary", "connection reset"))
                .thenReturn(LogPosition.parse("0/20"));
        router.recordWrite("alice");
        router.recordWrite("alice");
        when(replica.lastReplayPosition()).thenReturn(LogPosition.parse("0/20"));

        assertThat(router.route("alice").isPrimary()).isFalse();
    }

    @Test
    void lateCaptureOfOlderWriteKeepsSessionPinned() throws Exception {
        CountDownLatch firstCaptureStarted = new CountDownLatch(1);
        CountDownLatch releaseFirstCapture = new CountDownLatch(1);
        AtomicInteger captures = new AtomicInteger();
        when(primary.currentWritePosition()).thenAnswer(invocation -> {
            if (captures.incrementAndGet() == 1) {
                firstCaptureStarted.countDown();
                assertThat(releaseFirstCapture.await(5, TimeUnit.SECONDS)).isTrue();
                return LogPosition.parse("0/100");
            }
            throw new PositionUnavailableException("primary", "connection reset");
        });
        when(replica.lastReplayPosition()).thenReturn(LogPosition.parse("0/150"));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> firstWrite = executor.submit(() -> router.recordWrite("alice"));
            assertThat(firstCaptureStarted.await(5, TimeUnit.SECONDS)).isTrue();

            router.recordWrite("alice");
            releaseFirstCapture.countDown();
            firstWrite.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThat(store.find("alice").orElseThrow().isWritePositionUnknown()).isTrue();
        assertThat(router.isCaughtUp("alice", replica)).isFalse();
        assertThat(router.route("alice").isPrimary()).isTrue();
    }

    @Test
    void otherSessionsUnaffectedByOneSessionsWrite() {
        when(primary.currentWritePosition()).thenReturn(LogPosition.parse("0/5000"));
        router.recordWrite("alice");
        when(replica.lastReplayPosition()).thenReturn(LogPosition.parse("0/1000"));

        assertThat(router.route("alice").isPrimary()).isTrue();
        assertThat(router.route("bob").isPrimary()).isFalse();
    }
}
