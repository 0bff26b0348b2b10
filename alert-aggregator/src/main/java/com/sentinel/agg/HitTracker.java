package com.sentinel.agg;

import com.sentinel.common.dto.Hit;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Everything seen so far, per source and fingerprint. Lives for the process
 * lifetime: starts empty, never evicts, never persists.
 * <p>
 * Updates go through {@link ConcurrentHashMap#compute}, which serializes
 * writers on the same key, and replace the immutable {@link Hit}, so
 * concurrent hits on one key are never lost and readers always see whole values.
 */
@Component
public class HitTracker {
    private final Map<String, Map<String, Hit>> hits = new ConcurrentHashMap<>();

    /** Records one qualifying observation and returns the updated state. */
    public Hit markHit(String source, String fingerprint, String sampleLine, Instant now) {
        return hits.computeIfAbsent(source, k -> new ConcurrentHashMap<>())
                .compute(fingerprint, (k, h) -> h == null ? Hit.first(now, sampleLine) : h.observedAgain(now));
    }

    public Optional<Hit> get(String source, String fingerprint) {
        return Optional.ofNullable(hits.getOrDefault(source, Map.of()).get(fingerprint));
    }

    /** Point-in-time copy ordered by first sighting, oldest first. */
    public List<HitEntry> snapshot(String source) {
        return hits.getOrDefault(source, Map.of()).entrySet().stream()
                .map(e -> new HitEntry(e.getKey(), e.getValue()))
                .sorted(Comparator.comparing((HitEntry e) -> e.hit().firstSeen())
                        .thenComparing(HitEntry::fingerprint))
                .toList();
    }

    /** Sources with at least one hit, by name. */
    public Set<String> allSources() {
        Set<String> out = new TreeSet<>();
        hits.forEach((source, bucket) -> {
            if (!bucket.isEmpty()) out.add(source);
        });
        return out;
    }
}
