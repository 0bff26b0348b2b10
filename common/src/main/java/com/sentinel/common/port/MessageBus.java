package com.sentinel.common.port;

import java.util.function.Consumer;

/**
 * Topic-addressed hand-off between pipeline stages.
 */
public interface MessageBus<T> {
    void publish(String topic, T message);

    void subscribe(String topic, Consumer<T> consumer);
}
