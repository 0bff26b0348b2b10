package com.sentinel.common.adapter;

import com.sentinel.common.port.LocalSink;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes to the {@code sentinel.sink} logger, which the logging setup renders
 * as bare message lines on the console.
 */
@Slf4j(topic = "sentinel.sink")
public class Slf4jLocalSink implements LocalSink {

    @Override
    public void write(String text) {
        log.info(text);
    }
}
