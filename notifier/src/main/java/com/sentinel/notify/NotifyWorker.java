package com.sentinel.notify;

import com.sentinel.common.Topics;
import com.sentinel.common.dto.LogEvent;
import com.sentinel.common.port.MessageBus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotifyWorker {
    private final MessageBus<LogEvent> bus;
    private final AlertDispatcher dispatcher;

    @PostConstruct
    public void init() {
        bus.subscribe(Topics.ALERTS_IMMEDIATE, this::notifyNow);
        bus.subscribe(Topics.ALERTS_SUMMARY, this::notifySummary);
    }

    void notifyNow(LogEvent ev) {
        dispatcher.alertNow(ev.getSource(), ev.getMessage());
    }

    void notifySummary(LogEvent ev) {
        dispatcher.summary(ev.getMessage());
    }
}
