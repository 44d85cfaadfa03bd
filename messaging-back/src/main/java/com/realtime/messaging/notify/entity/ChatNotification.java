package com.realtime.messaging.notify.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "chat_notifications",
        indexes = @Index(name = "ix_chat_notifications_user_read", columnList = "user_id, is_read"),
        // 같은 메시지가 두 번 전달돼도(at-least-once) 알림은 하나
        uniqueConstraints = @UniqueConstraint(name = "uk_chat_notifications_user_message",
                columnNames = {"user_id", "message_id"})
)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChatNotification {

    public static final String NEW_MESSAGE = "new_message";
    public static final String CHANNEL_BROADCAST = "channel_broadcast";

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "room_id", length = 40)
    private String roomId;

    @Column(name = "channel_id", length = 40)
    private String channelId;

    @Column(name = "message_id", nullable = false, length = 64)
    private String messageId;

    @Column(nullable = false, length = 40)
    private String kind;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
