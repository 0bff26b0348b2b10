package com.sentinel.agg;

import com.sentinel.common.dto.Hit;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HitTrackerTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final HitTracker tracker = new HitTracker();

    @Test
    void firstHitCreatesEntry() {
        Hit h = tracker.markHit("api", "fp1", "Error: a", T0);

        assertThat(h).isEqualTo(new Hit(T0, T0, 1, "Error: a"));
        assertThat(tracker.get("api", "fp1")).contains(h);
    }

    @Test
    void repeatedHitsCountUpAndKeepFirstSample() {
        for (int i = 0; i < 4; i++) {
            tracker.markHit("api", "fp1", "Error: sample " + i, T0.plusSeconds(i * 10L));
        }

        Hit h = tracker.get("api", "fp1").orElseThrow();
        assertThat(h.count()).isEqualTo(4);
        assertThat(h.firstSeen()).isEqualTo(T0);
        assertThat(h.lastSeen()).isEqualTo(T0.plusSeconds(30));
        assertThat(h.sample()).isEqualTo("Error: sample 0");
    }

    @Test
    void sourcesAreTrackedIndependently() {
        tracker.markHit("api", "fp1", "x", T0);
        tracker.markHit("worker", "fp1", "y", T0.plusSeconds(1));

        assertThat(tracker.allSources()).containsExactly("api", "worker");
        assertThat(tracker.get("api", "fp1").orElseThrow().count()).isEqualTo(1);
        assertThat(tracker.get("worker", "fp1").orElseThrow().sample()).isEqualTo("y");
        assertThat(tracker.get("db", "fp1")).isEmpty();
    }

    @Test
    void snapshotIsOrderedByFirstSeen() {
        tracker.markHit("api", "late", "b", T0.plusSeconds(5));
        tracker.markHit("api", "early", "a", T0);

        assertThat(tracker.snapshot("api")).extracting(HitEntry::fingerprint).containsExactly("early", "late");
        assertThat(tracker.snapshot("unknown")).isEmpty();
    }

    @Test
    void concurrentHitsOnSameKeyAreNotLost() throws Exception {
        int threads = 8;
        int perThread = 5_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        tracker.markHit("api", "hot", "Error: hot", T0);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(tracker.get("api", "hot").orElseThrow().count()).isEqualTo((long) threads * perThread);
    }
}
