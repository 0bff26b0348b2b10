package com.sentinel.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * One log line travelling through the pipeline. Each stage fills in what it
 * knows: ingest sets the source, stream and text, the enricher adds the
 * fingerprint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogEvent {
    private String sourceId;
    private String source;
    private StreamClass stream;
    private Instant ts;
    private String message;
    private String fingerprint;

    public LogEvent() {
    }

    public LogEvent(SourceRef ref, StreamClass stream, Instant ts, String message) {
        this.sourceId = ref.id();
        this.source = ref.name();
        this.stream = stream;
        this.ts = ts;
        this.message = message;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public StreamClass getStream() {
        return stream;
    }

    public void setStream(StreamClass stream) {
        this.stream = stream;
    }

    public Instant getTs() {
        return ts;
    }

    public void setTs(Instant ts) {
        this.ts = ts;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    @Override
    public String toString() {
        return "LogEvent{source='%s', stream=%s, ts=%s, fingerprint='%s'}"
                .formatted(source, stream, ts, fingerprint);
    }
}
