package com.sentinel.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.common.adapter.Slf4jLocalSink;
import com.sentinel.common.port.LocalSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.*;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestClient;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

@Slf4j
@Configuration
public class NotifyConfig {

    @Bean
    public LocalSink localSink() {
        return new Slf4jLocalSink();
    }

    @Bean
    public AlertDispatcher alertDispatcher(LocalSink localSink, ObjectMapper om,
                                           @Value("${sentinel.lark-webhook-url:}") String larkUrl,
                                           @Value("${sentinel.slack-webhook-url:}") String slackUrl,
                                           @Value("${sentinel.slack-channel:}") String slackChannel,
                                           @Value("${sentinel.max-line-length:500}") int maxLineLength,
                                           @Value("${sentinel.webhook-timeout:10}") long timeoutSeconds) {
        WebhookNotifier webhook = null;
        String webhookUrl = webhookUrl(larkUrl, slackUrl);
        if (!webhookUrl.isBlank()) {
            RestClient http = webhookClientBuilder(om, Duration.ofSeconds(timeoutSeconds)).build();
            webhook = new WebhookNotifier(http, webhookUrl, slackChannel);
            log.info("Webhook alerts enabled ({})", webhook.getFlavor());
        }
        return new AlertDispatcher(localSink, webhook, Schedulers.boundedElastic(), maxLineLength);
    }

    /** Lark wins when both are set; an empty Lark value falls through to Slack. */
    static String webhookUrl(String larkUrl, String slackUrl) {
        if (larkUrl != null && !larkUrl.isBlank()) return larkUrl.trim();
        return slackUrl == null ? "" : slackUrl.trim();
    }

    static RestClient.Builder webhookClientBuilder(ObjectMapper om, Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return RestClient.builder()
                .requestFactory(factory)
                .messageConverters(converters -> converters.add(0, new MappingJackson2HttpMessageConverter(om)));
    }
}
