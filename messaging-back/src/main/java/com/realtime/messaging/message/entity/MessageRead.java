package com.realtime.messaging.message.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/** read_by 집합의 한 원소. (message, user) 유니크라 중복 추가는 no-op */
@Entity
@Table(name = "message_reads",
       uniqueConstraints = @UniqueConstraint(name = "uk_message_reads", columnNames = {"message_pk", "user_id"}))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MessageRead {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "message_pk", nullable = false)
    private ChatMessage message;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "read_at", nullable = false)
    private Instant readAt;
}
