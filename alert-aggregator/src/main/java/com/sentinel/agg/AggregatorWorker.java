package com.sentinel.agg;

import com.sentinel.common.Topics;
import com.sentinel.common.dto.LogEvent;
import com.sentinel.common.port.MessageBus;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Counts every fingerprinted line and lets it through as an immediate alert
 * when the rate limit allows.
 */
@Slf4j
@Component
public class AggregatorWorker {
    private final MessageBus<LogEvent> bus;
    private final HitTracker tracker;
    private final AlertGate gate;
    private final Clock clock;
    private final Duration rateLimit;

    public AggregatorWorker(MessageBus<LogEvent> bus, HitTracker tracker, AlertGate gate, Clock clock,
                            @Value("${sentinel.rate-limit:120}") long rateLimitSeconds) {
        this.bus = bus;
        this.tracker = tracker;
        this.gate = gate;
        this.clock = clock;
        this.rateLimit = Duration.ofSeconds(rateLimitSeconds);
    }

    @PostConstruct
    public void init() {
        bus.subscribe(Topics.LOGS_FINGERPRINTED, this::record);
    }

    void record(LogEvent ev) {
        Instant now = ev.getTs() != null ? ev.getTs() : clock.instant();
        tracker.markHit(ev.getSource(), ev.getFingerprint(), ev.getMessage(), now);
        if (gate.canAlert(ev.getSource(), ev.getFingerprint(), now, rateLimit)) {
            bus.publish(Topics.ALERTS_IMMEDIATE, ev);
        } else {
            log.debug("Suppressed repeat alert for {} fingerprint {}", ev.getSource(), ev.getFingerprint());
        }
    }
}
