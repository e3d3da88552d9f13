package com.example.readrouting.session;

import com.example.readrouting.position.LogPosition;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStoreTest {

    private final SessionStore store = new SessionStore();

    @Test
    void createsSessionOnFirstAccess() {
        assertThat(store.find("alice")).isEmpty();

        SessionState state = store.getOrCreate("alice");

        assertThat(state.getSessionId()).isEqualTo("alice");
        assertThat(state.getLastWriteTime()).isEmpty();
        assertThat(state.getLastWritePosition()).isEmpty();
        assertThat(store.find("alice")).isPresent();
    }

    @Test
    void writeTimeAndPositionAreIndependent() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        store.recordWritePosition("alice", 1, LogPosition.parse("0/100"));
        store.recordWriteTime("alice", now);

        SessionState state = store.find("alice").orElseThrow();
        assertThat(state.getLastWriteTime()).contains(now);
        assertThat(state.getLastWritePosition()).contains(LogPosition.parse("0/100"));
    }

    @Test
    void positionNeverMovesBackwards() {
        store.recordWritePosition("alice", 2, LogPosition.parse("0/200"));
        store.recordWritePosition("alice", 1, LogPosition.parse("0/100"));

        assertThat(store.find("alice").orElseThrow().getLastWritePosition()).contains(LogPosition.parse("0/200"));
    }

    @Test
    void writeTimeNeverMovesBackwards() {
        Instant t0 = Instant.parse("2026-03-01T12:00:00Z");
        store.recordWriteTime("alice", t0.plusSeconds(4));
        store.recordWriteTime("alice", t0);

        assertThat(store.find("alice").orElseThrow().getLastWriteTime()).contains(t0.plusSeconds(4));
    }

    @Test
    void writeSequenceCountsUpPerSession() {
        assertThat(store.nextWriteSequence("alice")).isEqualTo(1);
        assertThat(store.nextWriteSequence("alice")).isEqualTo(2);
        assertThat(store.nextWriteSequence("bob")).isEqualTo(1);
    }

    @Test
    void unknownPositionIsClearedByNextCapture() {
        store.recordWritePosition("alice", 1, LogPosition.parse("0/100"));
        store.markWritePositionUnknown("alice", 2);
        assertThat(store.find("alice").orElseThrow().isWritePositionUnknown()).isTrue();

        store.recordWritePosition("alice", 3, LogPosition.parse("0/300"));

        SessionState state = store.find("alice").orElseThrow();
        assertThat(state.isWritePositionUnknown()).isFalse();
        assertThat(state.getLastWritePosition()).contains(LogPosition.parse("0/300"));
    }

    @Test
    void olderCaptureDoesNotClearNewerUnknownPosition() {
        store.markWritePositionUnknown("alice", 2);
        store.recordWritePosition("alice", 1, LogPosition.parse("0/100"));

        SessionState state = store.find("alice").orElseThrow();
        assertThat(state.isWritePositionUnknown()).isTrue();
        assertThat(state.getLastWritePosition()).contains(LogPosition.parse("0/100"));
    }

    @Test
    void olderFailureDoesNotOverrideNewerCapture() {
        store.recordWritePosition("alice", 2, LogPosition.parse("0/200"));
        store.markWritePositionUnknown("alice", 1);

        assertThat(store.find("alice").orElseThrow().isWritePositionUnknown()).isFalse();
    }

    @Test
    void concurrentWritersKeepHighestPosition() throws Exception {
        List<Integer> offsets = new ArrayList<>();
        for (int i = 1; i <= 2000; i++) {
            offsets.add(i);
        }
        Collections.shuffle(offsets);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            int from = t * 250;
            futures.add(pool.submit(() -> {
                start.await();
                for (int offset : offsets.subList(from, from + 250)) {
                    store.recordWritePosition("shared", offset, LogPosition.parse("0/" + Integer.toHexString(offset)));
                    store.recordWriteTime("shared", Instant.ofEpochSecond(offset));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        SessionState state = store.find("shared").orElseThrow();
        assertThat(state.getLastWritePosition()).contains(LogPosition.parse("0/" + Integer.toHexString(2000)));
        assertThat(state.getLastWriteTime()).contains(Instant.ofEpochSecond(2000));
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void rejectsBlankSessionId() {
        assertThatThrownBy(() -> store.getOrCreate(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.find(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeForgetsSession() {
        store.getOrCreate("alice");
        store.remove("alice");

        assertThat(store.find("alice")).isEmpty();
        assertThat(store.size()).isZero();
    }
}
