package com.sentinel.ingest;

import com.sentinel.common.Topics;
import com.sentinel.common.dto.LogEvent;
import com.sentinel.common.dto.LogLine;
import com.sentinel.common.dto.SourceRef;
import com.sentinel.common.port.LocalSink;
import com.sentinel.common.port.LogSource;
import com.sentinel.common.port.MessageBus;
import com.sentinel.enrich.LinePrefixStripper;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Follows every target and feeds its lines onto the bus. Each (source, stream)
 * pair gets its own serial worker, so lines of one stream are published in
 * arrival order while different streams and sources proceed concurrently.
 * A stream that ends or fails is reported once and never reopened.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceMultiplexer {
    private final LogSource logSource;
    private final MessageBus<LogEvent> bus;
    private final LinePrefixStripper stripper;
    private final LocalSink localSink;
    private final Clock clock;

    private final Disposable.Composite subscriptions = Disposables.composite();

    public void start(List<SourceRef> targets, Instant since) {
        for (SourceRef ref : targets) {
            subscriptions.add(follow(ref, since).subscribe());
        }
    }

    /** Completes when the source's log stream ends, whether cleanly or not. */
    Mono<Void> follow(SourceRef ref, Instant since) {
        return Mono.defer(() -> logSource.openLineSequence(ref, since)
                        .groupBy(LogLine::stream)
                        .flatMap(stream -> stream
                                .publishOn(Schedulers.boundedElastic())
                                .doOnNext(line -> process(ref, line))
                                .then())
                        .then())
                .doOnSuccess(v -> localSink.write("[" + ref.name() + "] log stream closed"))
                .onErrorResume(e -> {
                    log.warn("Could not follow {}: {}", ref.name(), e.getMessage(), e);
                    localSink.write("[" + ref.name() + "] log stream failed: " + e.getMessage());
                    return Mono.empty();
                });
    }

    void process(SourceRef ref, LogLine line) {
        String text = stripper.strip(line.text());
        if (text.isEmpty()) return;
        bus.publish(Topics.LOGS_RAW, new LogEvent(ref, line.stream(), clock.instant(), text));
    }

    @PreDestroy
    void stop() {
        subscriptions.dispose();
    }
}
