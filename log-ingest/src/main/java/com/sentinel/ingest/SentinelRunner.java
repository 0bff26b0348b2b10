package com.sentinel.ingest;

import com.sentinel.common.dto.SourceRef;
import com.sentinel.common.port.LocalSink;
import com.sentinel.notify.AlertDispatcher;
import com.sentinel.rules.LineFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
@RequiredArgsConstructor
public class SentinelRunner implements CommandLineRunner {
    private final TargetResolver resolver;
    private final SinceParser sinceParser;
    private final SourceMultiplexer multiplexer;
    private final LineFilter filter;
    private final AlertDispatcher dispatcher;
    private final LocalSink localSink;

    @Value("${sentinel.since:10m}")
    String since;

    @Override
    public void run(String... args) {
        List<SourceRef> targets = resolver.resolve();
        Instant sinceAt = sinceParser.parse(since).orElse(null);
        localSink.write("Watching " + targets.size() + " container(s). " + filter.describe()
                + (dispatcher.hasWebhook() ? " Webhook=on" : " Webhook=off"));
        multiplexer.start(targets, sinceAt);
    }
}
