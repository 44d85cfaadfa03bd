package com.realtime.messaging.gateway.frame;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 클라이언트 → 서버 프레임. type 필드로 구분하며 {@link FrameCodec}에서 한 번만 디코딩한다.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MessageFrame.class, name = MessageFrame.TYPE),
        @JsonSubTypes.Type(value = TypingStartFrame.class, name = TypingStartFrame.TYPE),
        @JsonSubTypes.Type(value = TypingStopFrame.class, name = TypingStopFrame.TYPE),
        @JsonSubTypes.Type(value = ReadReceiptFrame.class, name = ReadReceiptFrame.TYPE),
        @JsonSubTypes.Type(value = ReactionFrame.class, name = ReactionFrame.TYPE)
})
public interface InboundFrame {

    /** 필수 필드 검사. 실패 시 ChatException(INVALID_FRAME) */
    default void validate() {
    }
}
