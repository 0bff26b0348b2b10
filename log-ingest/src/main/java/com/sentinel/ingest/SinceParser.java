package com.sentinel.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns {@code --since} into a lower bound: {@code 10m}, {@code 2h}, {@code 1d}
 * relative to now, or an absolute time. Zone-less values are read as UTC.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SinceParser {
    private static final Pattern RELATIVE = Pattern.compile("^([0-9]+)([smhd])$");

    private static final List<Function<String, Instant>> ABSOLUTE = List.of(
            Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant());

    private final Clock clock;

    /** @return empty for a blank or unparseable value, meaning no lower bound */
    public Optional<Instant> parse(String since) {
        if (since == null || since.isBlank()) return Optional.empty();
        String s = since.trim();
        Matcher m = RELATIVE.matcher(s);
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            Duration back = switch (m.group(2)) {
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                default -> Duration.ofDays(n);
            };
            return Optional.of(clock.instant().minus(back));
        }
        for (Function<String, Instant> parser : ABSOLUTE) {
            try {
                return Optional.of(parser.apply(s));
            } catch (DateTimeParseException e) {
                log.trace("'{}' not in this format: {}", s, e.getMessage());
            }
        }
        log.warn("Ignoring unparseable --since value '{}'", since);
        return Optional.empty();
    }
}
