package com.sentinel.agg;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per (source, fingerprint) rate limit for immediate alerts.
 */
@Component
public class AlertGate {
    private final Map<String, Map<String, Instant>> lastAlertAt = new ConcurrentHashMap<>();

    /**
     * Allows an alert when none fired for this key yet, or when at least
     * {@code window} has passed since the last allowed one, and then records
     * {@code now}. Check and update happen atomically per key.
     */
    public boolean canAlert(String source, String fingerprint, Instant now, Duration window) {
        AtomicBoolean allowed = new AtomicBoolean();
        lastAlertAt.computeIfAbsent(source, k -> new ConcurrentHashMap<>())
                .compute(fingerprint, (k, last) -> {
                    if (last == null || Duration.between(last, now).compareTo(window) >= 0) {
                        allowed.set(true);
                        return now;
                    }
                    return last;
                });
        return allowed.get();
    }
}
