package com.realtime.messaging.common;

import lombok.Getter;

@Getter
public class ChatException extends RuntimeException {

    private final ChatErrorCode code;

    public ChatException(ChatErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ChatException(ChatErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static ChatException unauthenticated(String message) {
        return new ChatException(ChatErrorCode.UNAUTHENTICATED, message);
    }

    public static ChatException forbidden(String message) {
        return new ChatException(ChatErrorCode.FORBIDDEN, message);
    }

    public static ChatException notFound(String message) {
        return new ChatException(ChatErrorCode.NOT_FOUND, message);
    }

    public static ChatException badRequest(String message) {
        return new ChatException(ChatErrorCode.BAD_REQUEST, message);
    }

    public static ChatException invalidFrame(String message) {
        return new ChatException(ChatErrorCode.INVALID_FRAME, message);
    }
}
