package com.realtime.messaging.gateway.frame;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realtime.messaging.common.ChatException;
import com.realtime.messaging.message.dto.FileMetadataDto;
import com.realtime.messaging.message.entity.ChatMessage;

/**
 * {"type":"message","content":"...","message_type":"text"}.
 * 구 클라이언트는 content 대신 message 키를 보낸다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageFrame(
        @JsonAlias("message") String content,
        String messageType,
        String parentMessageId,
        FileMetadataDto fileMetadata
) implements InboundFrame {

    public static final String TYPE = "message";

    public ChatMessage.Kind kind() {
        if (messageType == null || messageType.isBlank()) return ChatMessage.Kind.TEXT;
        return switch (messageType.trim().toLowerCase()) {
            case "text" -> ChatMessage.Kind.TEXT;
            case "file" -> ChatMessage.Kind.FILE;
            default -> throw ChatException.invalidFrame("unknown message_type: " + messageType);
        };
    }

    @Override
    public void validate() {
        ChatMessage.Kind kind = kind();
        if (kind == ChatMessage.Kind.TEXT && (content == null || content.isBlank())) {
            throw ChatException.invalidFrame("content is required");
        }
        if (kind == ChatMessage.Kind.FILE && fileMetadata == null) {
            throw ChatException.invalidFrame("file_metadata is required for file messages");
        }
    }
}
