package com.sentinel.ingest;

import com.sentinel.agg.AggregatorWorker;
import com.sentinel.agg.AlertGate;
import com.sentinel.agg.HitEntry;
import com.sentinel.agg.HitTracker;
import com.sentinel.agg.SummaryAggregator;
import com.sentinel.common.adapter.InMemoryBus;
import com.sentinel.common.dto.LogEvent;
import com.sentinel.common.dto.LogLine;
import com.sentinel.common.dto.SourceRef;
import com.sentinel.common.dto.StreamClass;
import com.sentinel.common.port.LogSource;
import com.sentinel.enrich.EnrichWorker;
import com.sentinel.enrich.Fingerprinter;
import com.sentinel.enrich.LineNormalizer;
import com.sentinel.enrich.LinePrefixStripper;
import com.sentinel.notify.AlertDispatcher;
import com.sentinel.notify.NotifyWorker;
import com.sentinel.rules.LineFilter;
import com.sentinel.rules.RulesWorker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PipelineEndToEndTest {
    private static final String ERRORS = "(error|exception|panic|fatal|segfault|stack trace|traceback|unhandled"
            + "|critical|ERR!|failed|reverted|execution reverted|gas needed)";
    private static final String IGNORES = "(healthcheck|heartbeat|timeout=0|connection reset by peer .* retrying"
            + "|client aborted connection)";
    private static final SourceRef API = new SourceRef("c0ffee", "api");
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final LogSource source = mock(LogSource.class);
    private final InMemoryBus<LogEvent> bus = new InMemoryBus<>();
    private final HitTracker tracker = new HitTracker();
    private final List<String> sink = new CopyOnWriteArrayList<>();
    private SourceMultiplexer multiplexer;

    @BeforeEach
    void wire() {
        Fingerprinter fingerprinter = new Fingerprinter(new LineNormalizer());
        AlertDispatcher dispatcher = new AlertDispatcher(sink::add, null, Schedulers.immediate(), 500);
        new RulesWorker(bus, LineFilter.compile(ERRORS, IGNORES)).init();
        new EnrichWorker(bus, fingerprinter).init();
        new AggregatorWorker(bus, tracker, new AlertGate(), Clock.fixed(T0, ZoneOffset.UTC), 120).init();
        new NotifyWorker(bus, dispatcher).init();
        multiplexer = new SourceMultiplexer(source, bus, new LinePrefixStripper(), sink::add,
                new SteppingClock(T0, Duration.ofSeconds(1)));
    }

    @Test
    void repeatedFailureCountsTwiceButAlertsOnce() {
        feed("Error: failed to connect to 10.0.0.5 at 2024-01-01T00:00:00Z request 123",
                "Error: failed to connect to 10.0.0.9 at 2024-01-02T00:00:00Z request 456");

        List<HitEntry> hits = tracker.snapshot("api");
        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).hit().count()).isEqualTo(2);
        assertThat(hits.get(0).hit().firstSeen()).isEqualTo(T0);
        assertThat(hits.get(0).hit().lastSeen()).isEqualTo(T0.plusSeconds(1));
        assertThat(sink).filteredOn(l -> l.startsWith("[ALERT]")).containsExactly(
                "[ALERT] api: Error: failed to connect to 10.0.0.5 at 2024-01-01T00:00:00Z request 123");
    }

    @Test
    void ignoredLinesNeverReachTheTracker() {
        feed("healthcheck ok", "healthcheck error: upstream failed");

        assertThat(tracker.allSources()).isEmpty();
        assertThat(sink).noneMatch(l -> l.startsWith("[ALERT]"));
    }

    @Test
    void summaryReflectsPipelineState() {
        feed("panic: boom 1", "panic: boom 2", "fatal: disk 7 gone", "all good");

        SummaryAggregator summary = new SummaryAggregator(tracker, bus, Clock.fixed(T0, ZoneOffset.UTC));
        summary.tick();

        String text = sink.get(sink.size() - 1);
        assertThat(text).contains("*api*\n• 2× since 2024-01-01T00:00:00Z — panic: boom 1\n• 1× since");
    }

    private void feed(String... lines) {
        Flux<LogLine> flux = Flux.fromArray(lines).map(l -> new LogLine(StreamClass.STDOUT, l));
        when(source.openLineSequence(eq(API), any())).thenReturn(flux);
        StepVerifier.create(multiplexer.follow(API, null)).verifyComplete();
    }
}
