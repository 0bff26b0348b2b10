package com.sentinel.common.dto;

/**
 * A raw, line-delimited chunk of container output tagged with the stream it came from.
 */
public record LogLine(StreamClass stream, String text) {
}
