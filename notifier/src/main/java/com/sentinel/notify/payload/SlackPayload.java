package com.sentinel.notify.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SlackPayload {
private String text;
private String channel; // only honoured by legacy incoming webhooks
}
