package com.realtime.messaging.gateway.frame;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TypingStopFrame() implements InboundFrame {
    public static final String TYPE = "typing_stop";
}
