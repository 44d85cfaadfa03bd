package com.realtime.messaging.message.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "message_reactions",
       uniqueConstraints = @UniqueConstraint(name = "uk_message_reactions",
               columnNames = {"message_pk", "emoji", "user_id"}))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MessageReaction {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "message_pk", nullable = false)
    private ChatMessage message;

    @Column(nullable = false, length = 64)
    private String emoji;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
