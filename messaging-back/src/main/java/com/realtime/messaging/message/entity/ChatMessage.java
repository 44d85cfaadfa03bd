package com.realtime.messaging.message.entity;

import com.realtime.messaging.common.GroupRef;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "chat_messages",
        indexes = {
                @Index(name = "ix_chat_messages_message_id", columnList = "message_id", unique = true),
                @Index(name = "ix_chat_messages_group_created", columnList = "group_key, created_at")
        }
)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChatMessage {

    public enum Kind { TEXT, FILE }

    /** content 컬럼 길이 */
    public static final int MAX_CONTENT_CHARS = 4000;

    /** 저장소가 부여하는 단조 증가 id. 같은 created_at 끼리의 정렬 기준 */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // 외부로 노출되는 식별자
    @Column(name = "message_id", nullable = false, length = 64, unique = true)
    private String messageId;

    // room_id / channel_id 중 정확히 하나
    @Column(name = "room_id", length = 40)
    private String roomId;

    @Column(name = "channel_id", length = 40)
    private String channelId;

    /** room:{id} 또는 channel:{id}. 목록/검색 쿼리 키 */
    @Column(name = "group_key", nullable = false, length = 64)
    private String groupKey;

    @Column(name = "sender_id", nullable = false)
    private UUID senderId;

    @Column(name = "sender_name", length = 100)
    private String senderName;

    @Column(nullable = false, length = MAX_CONTENT_CHARS)
    private String content;

    @Enumerated(EnumType.STRING) @Column(nullable = false, length = 10)
    @Builder.Default
    private Kind kind = Kind.TEXT;

    @Column(name = "parent_message_id", length = 64)
    private String parentMessageId;

    @Embedded
    private FileMetadata fileMetadata;

    @Column(nullable = false)
    private boolean broadcast;

    @Column(nullable = false)
    private boolean edited;

    @Column(nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = createdAt;
    }

    public GroupRef group() {
        return roomId != null ? GroupRef.room(roomId) : GroupRef.channel(channelId);
    }
}
