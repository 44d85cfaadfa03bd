package com.realtime.messaging.gateway.frame;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realtime.messaging.common.ChatException;

/** action 생략 시 add */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReactionFrame(String messageId, String emoji, String action) implements InboundFrame {

    public static final String TYPE = "reaction";
    public static final String ADD = "add";
    public static final String REMOVE = "remove";

    public boolean isRemove() {
        return REMOVE.equalsIgnoreCase(action);
    }

    @Override
    public void validate() {
        if (messageId == null || messageId.isBlank()) {
            throw ChatException.invalidFrame("message_id is required");
        }
        if (emoji == null || emoji.isBlank()) {
            throw ChatException.invalidFrame("emoji is required");
        }
        if (action != null && !ADD.equalsIgnoreCase(action) && !REMOVE.equalsIgnoreCase(action)) {
            throw ChatException.invalidFrame("action must be add or remove");
        }
    }
}
