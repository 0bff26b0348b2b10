package com.sentinel.common.port;

/** Plain-text output that every alert, summary and lifecycle line reaches. */
public interface LocalSink {
    void write(String text);
}
