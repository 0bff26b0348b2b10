package com.sentinel.notify;

import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts one JSON message to the configured chat webhook. Single attempt.
 */
public class WebhookNotifier {
    private final RestClient http;
    private final String url;
    private final WebhookFlavor flavor;
    private final String channel;

    public WebhookNotifier(RestClient http, String url, String channel) {
        this.http = http;
        this.url = url;
        this.flavor = WebhookFlavor.forUrl(url);
        this.channel = channel;
    }

    /** @throws RestClientException on transport failure or a non-2xx response */
    public void send(String text) {
        http.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .body(flavor.payload(text, channel))
                .retrieve()
                .toBodilessEntity();
    }

    public String getUrl() {
        return url;
    }

    public WebhookFlavor getFlavor() {
        return flavor;
    }
}
