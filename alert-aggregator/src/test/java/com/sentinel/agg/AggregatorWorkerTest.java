package com.sentinel.agg;

import com.sentinel.common.Topics;
import com.sentinel.common.adapter.InMemoryBus;
import com.sentinel.common.dto.LogEvent;
import com.sentinel.common.dto.SourceRef;
import com.sentinel.common.dto.StreamClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AggregatorWorkerTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final InMemoryBus<LogEvent> bus = new InMemoryBus<>();
    private final HitTracker tracker = new HitTracker();
    private final List<LogEvent> alerts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        new AggregatorWorker(bus, tracker, new AlertGate(), Clock.fixed(T0, ZoneOffset.UTC), 120).init();
        bus.subscribe(Topics.ALERTS_IMMEDIATE, alerts::add);
    }

    @Test
    void everyLineCountsButRepeatsAreRateLimited() {
        bus.publish(Topics.LOGS_FINGERPRINTED, event("fp", "Error 1", T0));
        bus.publish(Topics.LOGS_FINGERPRINTED, event("fp", "Error 2", T0.plusSeconds(1)));
        bus.publish(Topics.LOGS_FINGERPRINTED, event("fp", "Error 3", T0.plusSeconds(120)));

        assertThat(tracker.get("api", "fp").orElseThrow().count()).isEqualTo(3);
        assertThat(alerts).extracting(LogEvent::getMessage).containsExactly("Error 1", "Error 3");
    }

    @Test
    void missingTimestampFallsBackToClock() {
        bus.publish(Topics.LOGS_FINGERPRINTED, event("fp", "Error", null));

        assertThat(tracker.get("api", "fp").orElseThrow().firstSeen()).isEqualTo(T0);
    }

    private static LogEvent event(String fp, String msg, Instant ts) {
        LogEvent ev = new LogEvent(new SourceRef("id", "api"), StreamClass.STDOUT, ts, msg);
        ev.setFingerprint(fp);
        return ev;
    }
}
