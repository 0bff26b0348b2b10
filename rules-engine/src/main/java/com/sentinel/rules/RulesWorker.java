package com.sentinel.rules;

import com.sentinel.common.Topics;
import com.sentinel.common.dto.LogEvent;
import com.sentinel.common.port.MessageBus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Forwards only qualifying lines; ignored and non-matching lines stop here.
 */
@Component
@RequiredArgsConstructor
public class RulesWorker {
  private final MessageBus<LogEvent> bus;
  private final LineFilter filter;

  @PostConstruct
  public void init() {
    bus.subscribe(Topics.LOGS_RAW, this::applyRules);
  }

  void applyRules(LogEvent ev) {
    String msg = ev.getMessage() == null ? "" : ev.getMessage();
    if (filter.classify(msg) == Classification.QUALIFYING) {
      bus.publish(Topics.LOGS_QUALIFYING, ev);
    }
  }
}
