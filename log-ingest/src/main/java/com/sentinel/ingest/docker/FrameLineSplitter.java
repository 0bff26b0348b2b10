package com.sentinel.ingest.docker;

import com.sentinel.common.dto.LogLine;
import com.sentinel.common.dto.StreamClass;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Re-assembles lines from demultiplexed frame payloads, which may split or
 * join lines arbitrarily. Buffers bytes rather than chars so a multi-byte
 * character cut across two frames decodes correctly. Not thread-safe; one
 * instance per followed container.
 */
public class FrameLineSplitter {
    private final Map<StreamClass, ByteArrayOutputStream> pending = new EnumMap<>(StreamClass.class);

    public List<LogLine> accept(StreamClass stream, byte[] payload) {
        List<LogLine> out = new ArrayList<>();
        ByteArrayOutputStream buf = pending.computeIfAbsent(stream, s -> new ByteArrayOutputStream());
        for (byte b : payload) {
            if (b == '\n') {
                out.add(drain(stream, buf));
            } else {
                buf.write(b);
            }
        }
        return out;
    }

    /** Emits trailing partial lines; called once the stream has ended. */
    public List<LogLine> flush() {
        List<LogLine> out = new ArrayList<>();
        pending.forEach((stream, buf) -> {
            if (buf.size() > 0) out.add(drain(stream, buf));
        });
        return out;
    }

    private static LogLine drain(StreamClass stream, ByteArrayOutputStream buf) {
        String text = buf.toString(StandardCharsets.UTF_8);
        buf.reset();
        if (text.endsWith("\r")) text = text.substring(0, text.length() - 1);
        return new LogLine(stream, text);
    }
}
