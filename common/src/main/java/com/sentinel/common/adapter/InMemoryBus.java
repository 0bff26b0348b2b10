package com.sentinel.common.adapter;

import com.sentinel.common.port.MessageBus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers synchronously on the publishing thread, so one publisher sees its
 * messages handled in publish order. A subscriber that throws is logged and
 * skipped; the remaining subscribers and the publisher carry on.
 */
@Slf4j
public class InMemoryBus<T> implements MessageBus<T> {
    private final Map<String, List<Consumer<T>>> subscribers = new ConcurrentHashMap<>();

    @Override
    public void publish(String topic, T message) {
        for (Consumer<T> c : subscribers.getOrDefault(topic, List.of())) {
            try {
                c.accept(message);
            } catch (RuntimeException e) {
                log.error("Subscriber on '{}' failed for {}", topic, message, e);
            }
        }
    }

    @Override
    public void subscribe(String topic, Consumer<T> consumer) {
        subscribers.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).add(consumer);
    }
}
