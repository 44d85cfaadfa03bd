package com.realtime.messaging.message.dto;

import com.realtime.messaging.common.GroupRef;
import com.realtime.messaging.message.entity.ChatMessage;

import java.util.UUID;

/**
 * 메시지 저장 요청. fileMetadata는 kind == FILE 일 때만 사용
 */
public record PostMessageCommand(
        GroupRef group,
        UUID senderId,
        String senderName,
        String content,
        ChatMessage.Kind kind,
        String parentMessageId,
        FileMetadataDto fileMetadata
) {
    public static PostMessageCommand text(GroupRef group, UUID senderId, String senderName, String content) {
        return new PostMessageCommand(group, senderId, senderName, content, ChatMessage.Kind.TEXT, null, null);
    }
}
