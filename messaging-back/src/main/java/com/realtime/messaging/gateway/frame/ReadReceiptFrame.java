package com.realtime.messaging.gateway.frame;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realtime.messaging.common.ChatException;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReadReceiptFrame(String messageId) implements InboundFrame {

    public static final String TYPE = "read_receipt";

    @Override
    public void validate() {
        if (messageId == null || messageId.isBlank()) {
            throw ChatException.invalidFrame("message_id is required");
        }
    }
}
