package com.sentinel.enrich;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Masks the volatile parts of a log line (ids, addresses, times, counters) so
 * that repeats of the same failure normalize to the same text.
 */
@Component
public class LineNormalizer {
    public static final int MAX_LENGTH = 4000;

    // applied in this order: uuid and timestamp digits must go before the bare-number mask
    private static final Pattern UUID = Pattern.compile(
            "[0-9a-f]{8}-[0-9a-f]{4}-[1-5][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEX = Pattern.compile("0x[0-9a-f]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern IPV4 = Pattern.compile("\\b\\d{1,3}(?:\\.\\d{1,3}){3}\\b");
    private static final Pattern TIMESTAMP = Pattern.compile(
            "\\b\\d{4}-\\d{2}-\\d{2}[T\\s]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?Z?\\b");
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\b");

    public String normalize(String raw) {
        if (raw == null) return "";
        String s = UUID.matcher(raw).replaceAll("<uuid>");
        s = HEX.matcher(s).replaceAll("<hex>");
        s = IPV4.matcher(s).replaceAll("<ip>");
        s = TIMESTAMP.matcher(s).replaceAll("<ts>");
        s = NUMBER.matcher(s).replaceAll("<num>");
        return s.length() > MAX_LENGTH ? s.substring(0, MAX_LENGTH) : s;
    }
}
