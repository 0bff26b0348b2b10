package com.sentinel.ingest.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.LogContainerCmd;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import com.sentinel.common.dto.LogLine;
import com.sentinel.common.dto.SourceRef;
import com.sentinel.common.dto.StreamClass;
import com.sentinel.common.port.LogSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Running containers and their followed logs, through the Docker Engine API.
 */
@Slf4j
@RequiredArgsConstructor
public class DockerLogSource implements LogSource {
    private final DockerClient docker;

    @Override
    public List<SourceRef> listRunningSources() {
        List<SourceRef> out = new ArrayList<>();
        for (Container c : docker.listContainersCmd().withShowAll(false).exec()) {
            String name = displayName(c.getNames());
            if (name.isEmpty()) continue;
            out.add(new SourceRef(c.getId(), name));
        }
        return out;
    }

    static String displayName(String[] names) {
        if (names == null || names.length == 0 || names[0] == null) return "";
        return names[0].startsWith("/") ? names[0].substring(1) : names[0];
    }

    @Override
    public Flux<LogLine> openLineSequence(SourceRef source, Instant since) {
        return Flux.create(sink -> {
            LogContainerCmd cmd = docker.logContainerCmd(source.id())
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(true);
            if (since != null) cmd = cmd.withSince((int) since.getEpochSecond());
            FrameCallback callback = cmd.exec(new FrameCallback(sink));
            sink.onDispose(() -> {
                try {
                    callback.close();
                } catch (IOException e) {
                    log.debug("Closing log stream of {} failed", source.name(), e);
                }
            });
        });
    }

    static StreamClass streamClass(StreamType type) {
        return type == StreamType.STDERR ? StreamClass.STDERR : StreamClass.STDOUT;
    }

    static class FrameCallback extends ResultCallback.Adapter<Frame> {
        private final FluxSink<LogLine> sink;
        private final FrameLineSplitter splitter = new FrameLineSplitter();

        FrameCallback(FluxSink<LogLine> sink) {
            this.sink = sink;
        }

        @Override
        public void onNext(Frame frame) {
            splitter.accept(streamClass(frame.getStreamType()), frame.getPayload()).forEach(sink::next);
        }

        @Override
        public void onError(Throwable throwable) {
            sink.error(throwable);
            super.onError(throwable);
        }

        @Override
        public void onComplete() {
            splitter.flush().forEach(sink::next);
            sink.complete();
            super.onComplete();
        }
    }
}
