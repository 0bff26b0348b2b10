package com.sentinel.notify;

import com.sentinel.common.Text;
import com.sentinel.common.port.LocalSink;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Optional;

/**
 * Emits alerts and summaries. The local sink is written synchronously and
 * always; the webhook, when configured, is called in the background, once,
 * and its failures only get logged.
 */
@Slf4j
public class AlertDispatcher {
    static final int LOCAL_LINE_LENGTH = 200;

    private final LocalSink localSink;
    private final WebhookNotifier webhook;
    private final Scheduler scheduler;
    private final int maxLineLength;

    /**
     * @param webhook {@code null} when no webhook URL is configured
     */
    public AlertDispatcher(LocalSink localSink, WebhookNotifier webhook, Scheduler scheduler, int maxLineLength) {
        this.localSink = localSink;
        this.webhook = webhook;
        this.scheduler = scheduler;
        this.maxLineLength = maxLineLength;
    }

    public void alertNow(String source, String message) {
        localSink.write("[ALERT] " + source + ": " + Text.trim(message, LOCAL_LINE_LENGTH));
        sendExternal("🚨 *" + source + "* error\n```\n" + Text.trim(message, maxLineLength) + "\n```");
    }

    public void summary(String text) {
        localSink.write(text);
        sendExternal(text);
    }

    public boolean hasWebhook() {
        return webhook != null;
    }

    public Optional<String> webhookUrl() {
        return Optional.ofNullable(webhook).map(WebhookNotifier::getUrl);
    }

    private void sendExternal(String text) {
        if (webhook == null) return;
        Mono.fromRunnable(() -> webhook.send(text))
                .subscribeOn(scheduler)
                .subscribe(ignored -> { }, e -> {
                    localSink.write("Webhook failed: " + e.getMessage());
                    log.debug("Webhook delivery error", e);
                });
    }
}
