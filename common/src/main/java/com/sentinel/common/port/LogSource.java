package com.sentinel.common.port;

import com.sentinel.common.dto.LogLine;
import com.sentinel.common.dto.SourceRef;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.List;

/**
 * The container runtime, seen from the pipeline.
 */
public interface LogSource {

    /** Fails with an exception if the runtime cannot be reached. */
    List<SourceRef> listRunningSources();

    /**
     * Follows the source's stdout and stderr. The returned flux is lazy, never
     * completes while the source keeps logging, and cannot be restarted.
     *
     * @param since lower bound for replayed lines, or {@code null} for none
     */
    Flux<LogLine> openLineSequence(SourceRef source, Instant since);
}
