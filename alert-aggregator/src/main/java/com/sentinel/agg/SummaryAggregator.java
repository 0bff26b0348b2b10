package com.sentinel.agg;

import com.sentinel.common.Text;
import com.sentinel.common.Topics;
import com.sentinel.common.dto.Hit;
import com.sentinel.common.dto.LogEvent;
import com.sentinel.common.port.MessageBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Periodic digest of the most frequent fingerprints per source. Read-only over
 * {@link HitTracker}: counts keep growing across ticks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SummaryAggregator {
    static final int TOP_N = 5;
    static final int SAMPLE_LENGTH = 160;

    /** Highest count first; on equal counts the older issue ranks higher. */
    static final Comparator<HitEntry> RANKING = Comparator
            .comparingLong((HitEntry e) -> e.hit().count()).reversed()
            .thenComparing(e -> e.hit().firstSeen());

    private final HitTracker tracker;
    private final MessageBus<LogEvent> bus;
    private final Clock clock;

    @Scheduled(fixedRateString = "${sentinel.summarize-every:300}",
            initialDelayString = "${sentinel.summarize-every:300}",
            timeUnit = TimeUnit.SECONDS)
    public void tick() {
        Instant now = clock.instant();
        summarize(now).ifPresentOrElse(text -> {
            LogEvent ev = new LogEvent();
            ev.setTs(now);
            ev.setMessage(text);
            bus.publish(Topics.ALERTS_SUMMARY, ev);
        }, () -> log.debug("No hits yet, skipping summary"));
    }

    public List<HitEntry> topHits(String source) {
        return tracker.snapshot(source).stream().sorted(RANKING).limit(TOP_N).toList();
    }

    /** @return the rendered digest, or empty when no source has any hits */
    public Optional<String> summarize(Instant now) {
        List<String> blocks = new ArrayList<>();
        for (String source : tracker.allSources()) {
            List<HitEntry> top = topHits(source);
            if (top.isEmpty()) continue;
            String bullets = top.stream().map(e -> bullet(e.hit())).collect(Collectors.joining("\n"));
            blocks.add("*" + source + "*\n" + bullets);
        }
        if (blocks.isEmpty()) return Optional.empty();
        return Optional.of("🧭 *Docker Log Sentinel summary* @ " + now + "\n\n" + String.join("\n\n", blocks));
    }

    private static String bullet(Hit h) {
        return "• " + h.count() + "× since " + h.firstSeen() + " — " + Text.trim(h.sample(), SAMPLE_LENGTH);
    }
}
