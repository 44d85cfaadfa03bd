package com.realtime.messaging.gateway.frame;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TypingStartFrame() implements InboundFrame {
    public static final String TYPE = "typing_start";
}
