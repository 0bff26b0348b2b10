package com.sentinel.enrich;

import com.sentinel.common.Topics;
import com.sentinel.common.dto.LogEvent;
import com.sentinel.common.port.MessageBus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EnrichWorker {
    private final MessageBus<LogEvent> bus;
    private final Fingerprinter fingerprinter;

    @PostConstruct
    public void init() {
        bus.subscribe(Topics.LOGS_QUALIFYING, this::process);
    }

    void process(LogEvent ev) {
        ev.setFingerprint(fingerprinter.fingerprint(ev.getMessage()));
        bus.publish(Topics.LOGS_FINGERPRINTED, ev);
    }
}
