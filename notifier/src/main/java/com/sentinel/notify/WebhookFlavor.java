package com.sentinel.notify;

import com.sentinel.notify.payload.LarkPayload;
import com.sentinel.notify.payload.SlackPayload;

import java.util.regex.Pattern;

/**
 * Payload family of the configured webhook, decided once from its URL.
 */
public enum WebhookFlavor {
    SLACK_LIKE {
        @Override
        public Object payload(String text, String channel) {
            return SlackPayload.builder().text(text).channel(channel == null || channel.isBlank() ? null : channel).build();
        }
    },
    LARK_LIKE {
        @Override
        public Object payload(String text, String channel) {
            return LarkPayload.text(text);
        }
    };

    private static final Pattern LARK_HOSTS = Pattern.compile("feishu|lark", Pattern.CASE_INSENSITIVE);

    public abstract Object payload(String text, String channel);

    public static WebhookFlavor forUrl(String url) {
        return LARK_HOSTS.matcher(url).find() ? LARK_LIKE : SLACK_LIKE;
    }
}
