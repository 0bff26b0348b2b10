package com.sentinel.notify.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * Lark / Feishu custom bot text message.
 */
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class LarkPayload {
@JsonProperty("msg_type") @Builder.Default private String msgType = "text";
private Content content;

@Data @NoArgsConstructor @AllArgsConstructor
public static class Content {
private String text;
}

public static LarkPayload text(String text) {
return LarkPayload.builder().content(new Content(text)).build();
}
}
