package com.sentinel.enrich;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Drops the runtime's framing and timestamp prefix: up to 30 characters of
 * framing, a date-time with optional fraction and zone, and the whitespace after it.
 */
@Component
public class LinePrefixStripper {
    private static final Pattern PREFIX = Pattern.compile(
            "^.{0,30}[0-9]{4}-[0-9]{2}-[0-9]{2}[T ][0-9]{2}:[0-9]{2}:[0-9]{2}"
                    + "(?:[.,][0-9]+)?(?:Z|[+-][0-9]{2}:?[0-9]{2})?\\s*");

    /** @return the stripped, trimmed line; empty when nothing is left */
    public String strip(String line) {
        if (line == null) return "";
        return PREFIX.matcher(line).replaceFirst("").trim();
    }
}
